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

import java.util.Collection;
import java.util.List;

import io.citrine.client.gemd.entity.BaseEntity;

/**
 * Batcher splits a collection of GEMD objects into batches for submission.
 * Implementations are stateless; the objects passed in are never modified.
 */
public abstract class Batcher {

  protected final TypeGrouper typeGrouper;

  protected Batcher(TypeGrouper typeGrouper) {
    if (typeGrouper == null) {
      throw new IllegalArgumentException("typeGrouper is required");
    }
    this.typeGrouper = typeGrouper;
  }

  /**
   * Collects objects into batches of at most {@code batchSize} objects.
   *
   * @param objects
   *            the objects to batch
   * @param batchSize
   *            the maximum number of objects per batch, at least 1
   * @return the batches
   */
  public abstract List<List<BaseEntity>> batch(Collection<? extends BaseEntity> objects, int batchSize);

  /**
   * Returns a batcher whose batches must be written in order, each batch
   * referencing only itself and earlier batches.
   *
   * @return a {@link BatchByType}
   */
  public static Batcher byType() {
    return new BatchByType();
  }

  /**
   * Returns a batcher whose batches are each self-contained.
   *
   * @return a {@link BatchByDependency}
   */
  public static Batcher byDependency() {
    return new BatchByDependency();
  }

  protected static void checkBatchSize(int batchSize) {
    if (batchSize < 1) {
      throw new IllegalArgumentException("batchSize must be at least 1 but was " + batchSize);
    }
  }

  public TypeGrouper getTypeGrouper() {
    return typeGrouper;
  }
}
