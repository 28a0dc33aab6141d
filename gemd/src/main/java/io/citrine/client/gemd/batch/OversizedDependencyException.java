/*
 * Copyright 2025 Citrine Informatics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * SPDX-License-Identifier: Apache-2.0
 */

package io.citrine.client.gemd.batch;

import io.citrine.client.core.NonRetryableException;
import io.citrine.client.gemd.entity.BaseEntity;

/**
 * An object together with everything it depends on does not fit in a single
 * batch. Raise the batch size or split the object's dependencies.
 */
public class OversizedDependencyException extends NonRetryableException {

  private final transient BaseEntity entity;
  private final int requiredSize;
  private final int batchSize;

  public OversizedDependencyException(BaseEntity entity, int requiredSize, int batchSize) {
    super("Object " + entity.getName() + " (" + entity.getType() + ") needs " + requiredSize
        + " objects in one batch, which exceeds the batch size of " + batchSize);
    this.entity = entity;
    this.requiredSize = requiredSize;
    this.batchSize = batchSize;
  }

  public BaseEntity getEntity() {
    return entity;
  }

  /**
   * Returns the number of objects the entity needs in its batch, itself
   * included.
   *
   * @return the required batch size
   */
  public int getRequiredSize() {
    return requiredSize;
  }

  public int getBatchSize() {
    return batchSize;
  }
}
