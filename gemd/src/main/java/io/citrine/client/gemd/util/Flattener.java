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

package io.citrine.client.gemd.util;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.EntityRef;
import io.citrine.client.gemd.entity.EntityType;

/**
 * Collects every object reachable from a set of roots.
 */
public final class Flattener {

  private Flattener() {
    // Utility class
  }

  /**
   * Gathers the roots and every full object they reference, directly or
   * transitively. Links are not followed. Each object appears once, and the
   * result is sorted so that referenced types come first.
   *
   * @param roots
   *            the objects to start from
   * @return the reachable objects in writable order
   */
  public static List<BaseEntity> flatten(Iterable<? extends BaseEntity> roots) {
    Set<BaseEntity> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    List<BaseEntity> result = new ArrayList<>();
    Deque<BaseEntity> pending = new ArrayDeque<>();
    for (BaseEntity root : roots) {
      if (root != null && seen.add(root)) {
        pending.addLast(root);
      }
    }

    while (!pending.isEmpty()) {
      BaseEntity current = pending.pollFirst();
      result.add(current);
      for (EntityRef ref : current.dependencies()) {
        if (ref instanceof BaseEntity && seen.add((BaseEntity) ref)) {
          pending.addLast((BaseEntity) ref);
        }
      }
    }

    result.sort((a, b) -> EntityType.writableOrder().compare(a.getType(), b.getType()));
    return result;
  }

  /**
   * Flattens a single root.
   *
   * @param root
   *            the object to start from
   * @return the reachable objects in writable order
   */
  public static List<BaseEntity> flatten(BaseEntity root) {
    return flatten(Collections.singletonList(root));
  }
}
