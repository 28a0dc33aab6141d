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

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.EntityRef;
import io.citrine.client.gemd.entity.LinkByUid;

/**
 * IdentityIndex maps identity keys to the objects of one collection and
 * collapses replicates: objects that share an identity key with an object seen
 * earlier are folded into it.
 */
public final class IdentityIndex {

  private final Map<LinkByUid, BaseEntity> byLink;
  private final Map<BaseEntity, BaseEntity> canonical;
  private final List<BaseEntity> entities;

  private IdentityIndex() {
    this.byLink = new LinkedHashMap<>();
    this.canonical = new IdentityHashMap<>();
    this.entities = new ArrayList<>();
  }

  /**
   * Builds an index over a collection of objects.
   *
   * @param objects
   *            the objects to index
   * @return the index
   * @throws ObjectCollisionException
   *             if two objects share an identity key but differ in content
   */
  public static IdentityIndex of(Iterable<? extends BaseEntity> objects) {
    IdentityIndex index = new IdentityIndex();
    for (BaseEntity object : objects) {
      index.add(object);
    }
    return index;
  }

  private void add(BaseEntity object) {
    if (canonical.containsKey(object)) {
      return;
    }
    BaseEntity match = null;
    for (LinkByUid key : object.identityKeys()) {
      BaseEntity existing = byLink.get(key);
      if (existing == null || existing == match) {
        continue;
      }
      if (!existing.contentEquals(object)) {
        throw new ObjectCollisionException(key);
      }
      if (match != null) {
        // the object would join two objects indexed separately
        throw new ObjectCollisionException(key);
      }
      match = existing;
    }

    if (match == null) {
      canonical.put(object, object);
      entities.add(object);
      for (LinkByUid key : object.identityKeys()) {
        byLink.put(key, object);
      }
      return;
    }

    canonical.put(object, match);
    for (LinkByUid key : object.identityKeys()) {
      byLink.putIfAbsent(key, match);
    }
  }

  /**
   * Resolves a reference to the indexed object it denotes.
   *
   * @param ref
   *            a full object or a link
   * @return the indexed object, or null if the reference points outside the
   *         collection
   */
  public BaseEntity resolve(EntityRef ref) {
    if (ref == null) {
      return null;
    }
    if (ref instanceof LinkByUid) {
      return byLink.get(ref);
    }
    BaseEntity entity = (BaseEntity) ref;
    BaseEntity known = canonical.get(entity);
    if (known != null) {
      return known;
    }
    for (LinkByUid key : entity.identityKeys()) {
      known = byLink.get(key);
      if (known != null) {
        return known;
      }
    }
    return null;
  }

  /**
   * Looks up the object owning an identity key.
   *
   * @param link
   *            the identity key
   * @return the object, or null if none
   */
  public BaseEntity get(LinkByUid link) {
    return byLink.get(link);
  }

  /**
   * Returns the distinct objects, replicates removed, in first-seen order.
   *
   * @return the objects
   */
  public List<BaseEntity> entities() {
    return Collections.unmodifiableList(entities);
  }

  /**
   * Returns the mapping from identity key to object.
   *
   * @return an unmodifiable view of the index
   */
  public Map<LinkByUid, BaseEntity> asMap() {
    return Collections.unmodifiableMap(byLink);
  }

  public int size() {
    return entities.size();
  }
}
