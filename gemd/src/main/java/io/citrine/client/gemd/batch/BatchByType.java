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
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.citrine.client.gemd.entity.BaseEntity;

/**
 * BatchByType batches objects by type, in an order that satisfies references
 * when the batches are written one after the other.
 *
 * <p>
 * Each type group is cut into chunks of at most {@code batchSize}, then
 * adjacent chunks are merged from the back while they fit. Merging only ever
 * joins neighbours, so the type order of the groups is kept.
 */
public class BatchByType extends Batcher {

  private static final Logger logger = LoggerFactory.getLogger(BatchByType.class);

  public BatchByType() {
    this(new TypeGrouper());
  }

  public BatchByType(TypeGrouper typeGrouper) {
    super(typeGrouper);
  }

  /**
   * {@inheritDoc}
   *
   * @throws ObjectCollisionException
   *             if two objects share an identity key but differ in content
   */
  @Override
  public List<List<BaseEntity>> batch(Collection<? extends BaseEntity> objects, int batchSize) {
    checkBatchSize(batchSize);
    IdentityIndex index = IdentityIndex.of(objects);

    List<List<BaseEntity>> batches = new ArrayList<>();
    for (List<BaseEntity> typeGroup : typeGrouper.groupAndOrder(index.entities())) {
      for (int start = 0; start < typeGroup.size(); start += batchSize) {
        int end = Math.min(start + batchSize, typeGroup.size());
        batches.add(new ArrayList<>(typeGroup.subList(start, end)));
      }
    }

    for (int i = batches.size() - 2; i >= 0; i--) {
      if (batches.get(i).size() + batches.get(i + 1).size() <= batchSize) {
        batches.get(i).addAll(batches.remove(i + 1));
      }
    }

    logger.debug("Split {} objects ({} distinct) into {} batches of at most {}", objects.size(), index.size(),
        batches.size(), batchSize);
    return batches;
  }
}
