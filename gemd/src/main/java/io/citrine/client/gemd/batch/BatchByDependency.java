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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.EntityRef;

/**
 * BatchByDependency builds batches that each contain every in-collection
 * dependency of their members, so any batch can be written on its own.
 *
 * <p>
 * A dependency shared by several clusters is repeated in each of them.
 * References that do not resolve to an object of the collection are treated as
 * already registered and ignored.
 */
public class BatchByDependency extends Batcher {

  private static final Logger logger = LoggerFactory.getLogger(BatchByDependency.class);

  public BatchByDependency() {
    this(new TypeGrouper());
  }

  public BatchByDependency(TypeGrouper typeGrouper) {
    super(typeGrouper);
  }

  /**
   * {@inheritDoc}
   *
   * @throws ObjectCollisionException
   *             if two objects share an identity key but differ in content
   * @throws OversizedDependencyException
   *             if an object and its dependencies do not fit in one batch
   * @throws CyclicDependencyException
   *             if the objects reference each other in a cycle
   */
  @Override
  public List<List<BaseEntity>> batch(Collection<? extends BaseEntity> objects, int batchSize) {
    checkBatchSize(batchSize);
    IdentityIndex index = IdentityIndex.of(objects);
    List<List<BaseEntity>> typeGroups = typeGrouper.groupAndOrder(index.entities());

    ClosureCalculator calculator = new ClosureCalculator(index, batchSize);
    Map<BaseEntity, List<BaseEntity>> supportedBy = new IdentityHashMap<>();
    for (List<BaseEntity> typeGroup : typeGroups) {
      for (BaseEntity entity : typeGroup) {
        for (BaseEntity dependency : calculator.closureOf(entity)) {
          supportedBy.computeIfAbsent(dependency, d -> new ArrayList<>()).add(entity);
        }
      }
    }

    Set<BaseEntity> queued = identitySet();
    List<List<BaseEntity>> batches = new ArrayList<>();
    for (int g = typeGroups.size() - 1; g >= 0; g--) {
      for (BaseEntity entity : typeGroups.get(g)) {
        if (queued.contains(entity)) {
          continue;
        }
        List<BaseEntity> cluster = grow(entity, calculator, supportedBy, queued, batchSize);
        queued.addAll(cluster);
        batches.add(cluster);
      }
    }

    logger.debug("Split {} objects ({} distinct) into {} self-contained batches of at most {}", objects.size(),
        index.size(), batches.size(), batchSize);
    return batches;
  }

  /**
   * Grows a cluster around a seed: the seed and its closure, then as many other
   * dependents of the cluster members as still fit, each with its own closure.
   */
  private List<BaseEntity> grow(BaseEntity seed, ClosureCalculator calculator,
      Map<BaseEntity, List<BaseEntity>> supportedBy, Set<BaseEntity> queued, int batchSize) {
    List<BaseEntity> cluster = new ArrayList<>();
    Set<BaseEntity> members = identitySet();
    cluster.add(seed);
    members.add(seed);
    Deque<BaseEntity> toBeChecked = new ArrayDeque<>();
    for (BaseEntity dependency : calculator.closureOf(seed)) {
      cluster.add(dependency);
      members.add(dependency);
      toBeChecked.addLast(dependency);
    }

    while (!toBeChecked.isEmpty()) {
      BaseEntity parent = toBeChecked.pollLast();
      List<BaseEntity> supporters = supportedBy.getOrDefault(parent, Collections.emptyList());
      for (int i = supporters.size() - 1; i >= 0; i--) {
        BaseEntity candidate = supporters.get(i);
        if (queued.contains(candidate) || members.contains(candidate)) {
          continue;
        }
        List<BaseEntity> novel = new ArrayList<>();
        novel.add(candidate);
        for (BaseEntity dependency : calculator.closureOf(candidate)) {
          if (!members.contains(dependency)) {
            novel.add(dependency);
          }
        }
        if (cluster.size() + novel.size() > batchSize) {
          continue;
        }
        for (BaseEntity addition : novel) {
          cluster.add(addition);
          members.add(addition);
          toBeChecked.addLast(addition);
        }
      }
    }

    cluster.sort(typeGrouper.entityOrder());
    return cluster;
  }

  private static Set<BaseEntity> identitySet() {
    return Collections.newSetFromMap(new IdentityHashMap<>());
  }

  /**
   * Memoized computation of transitive in-collection dependencies.
   */
  private final class ClosureCalculator {

    private final IdentityIndex index;
    private final int batchSize;
    private final Map<BaseEntity, List<BaseEntity>> closures = new IdentityHashMap<>();
    private final Set<BaseEntity> visiting = identitySet();

    ClosureCalculator(IdentityIndex index, int batchSize) {
      this.index = index;
      this.batchSize = batchSize;
    }

    /**
     * Returns the transitive dependencies of an entity, the entity itself
     * excluded, sorted by type order.
     */
    List<BaseEntity> closureOf(BaseEntity entity) {
      List<BaseEntity> known = closures.get(entity);
      if (known != null) {
        return known;
      }
      if (!visiting.add(entity)) {
        throw new CyclicDependencyException(entity);
      }

      List<BaseEntity> direct = new ArrayList<>();
      Set<BaseEntity> directSet = identitySet();
      for (EntityRef ref : entity.dependencies()) {
        BaseEntity resolved = index.resolve(ref);
        if (resolved == null) {
          continue;
        }
        if (resolved == entity) {
          throw new CyclicDependencyException(entity);
        }
        if (directSet.add(resolved)) {
          direct.add(resolved);
        }
      }
      if (direct.size() + 1 > batchSize) {
        throw new OversizedDependencyException(entity, direct.size() + 1, batchSize);
      }

      List<BaseEntity> closure = new ArrayList<>(direct);
      Set<BaseEntity> closureSet = identitySet();
      closureSet.addAll(direct);
      for (BaseEntity dependency : direct) {
        for (BaseEntity transitive : closureOf(dependency)) {
          if (closureSet.add(transitive)) {
            closure.add(transitive);
          }
        }
      }
      if (closure.size() + 1 > batchSize) {
        throw new OversizedDependencyException(entity, closure.size() + 1, batchSize);
      }

      closure.sort(typeGrouper.entityOrder());
      visiting.remove(entity);
      List<BaseEntity> result = Collections.unmodifiableList(closure);
      closures.put(entity, result);
      return result;
    }
  }
}
