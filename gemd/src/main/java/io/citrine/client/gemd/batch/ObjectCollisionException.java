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
import io.citrine.client.gemd.entity.LinkByUid;

/**
 * Two objects with different content share an identity key, or one object
 * shares keys with two objects that were indexed separately.
 */
public class ObjectCollisionException extends NonRetryableException {

  private final LinkByUid link;

  public ObjectCollisionException(LinkByUid link) {
    super("Colliding objects for " + link);
    this.link = link;
  }

  /**
   * Returns the identity key both objects claim.
   *
   * @return the shared link
   */
  public LinkByUid getLink() {
    return link;
  }
}
