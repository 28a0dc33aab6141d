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
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.EntityType;

/**
 * TypeGrouper groups objects by type and orders the groups so that referenced
 * types come before the types that reference them.
 */
public class TypeGrouper {

  private final Comparator<EntityType> order;

  /**
   * Creates a TypeGrouper using {@link EntityType#writableOrder()}.
   */
  public TypeGrouper() {
    this(EntityType.writableOrder());
  }

  /**
   * Creates a TypeGrouper with a custom type priority.
   *
   * @param order
   *            the order over types; earlier types are written first
   */
  public TypeGrouper(Comparator<EntityType> order) {
    if (order == null) {
      throw new IllegalArgumentException("order is required");
    }
    this.order = order;
  }

  /**
   * Groups objects by type. Each group keeps the input order of its members,
   * and the groups are sorted by type priority.
   *
   * @param entities
   *            the objects to group
   * @return the ordered groups; empty for empty input
   */
  public List<List<BaseEntity>> groupAndOrder(Iterable<? extends BaseEntity> entities) {
    Map<EntityType, List<BaseEntity>> byType = new LinkedHashMap<>();
    for (BaseEntity entity : entities) {
      byType.computeIfAbsent(entity.getType(), t -> new ArrayList<>()).add(entity);
    }
    List<Map.Entry<EntityType, List<BaseEntity>>> entries = new ArrayList<>(byType.entrySet());
    entries.sort(Map.Entry.comparingByKey(order));

    List<List<BaseEntity>> groups = new ArrayList<>(entries.size());
    for (Map.Entry<EntityType, List<BaseEntity>> entry : entries) {
      groups.add(entry.getValue());
    }
    return groups;
  }

  /**
   * Returns an order over objects by the priority of their type.
   *
   * @return the comparator
   */
  public Comparator<BaseEntity> entityOrder() {
    return Comparator.comparing(BaseEntity::getType, order);
  }

  public Comparator<EntityType> getOrder() {
    return order;
  }
}
