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

package io.citrine.client.gemd.resources;

import com.fasterxml.jackson.databind.JsonNode;

import io.citrine.client.core.ApiError;
import io.citrine.client.core.CitrineException;
import io.citrine.client.core.JsonUtils;
import io.citrine.client.gemd.entity.LinkByUid;

/**
 * An object that a batch deletion job could not delete, and why.
 */
public class DeletionFailure {

  private final LinkByUid id;
  private final ApiError cause;

  public DeletionFailure(LinkByUid id, ApiError cause) {
    this.id = id;
    this.cause = cause;
  }

  /**
   * Parses one entry of a deletion job's {@code failures} output, shaped as
   * {@code {"id": {"scope": ..., "id": ...}, "cause": {...}}}.
   *
   * @param node
   *            the failure entry
   * @return the failure
   * @throws CitrineException
   *             if the entry has no usable id
   */
  static DeletionFailure fromJson(JsonNode node) {
    JsonNode idNode = node.path("id");
    if (!idNode.hasNonNull("scope") || !idNode.hasNonNull("id")) {
      throw new CitrineException("Deletion failure entry has no id: " + node);
    }
    LinkByUid id = new LinkByUid(idNode.get("scope").asText(), idNode.get("id").asText());
    JsonNode causeNode = node.get("cause");
    ApiError cause = causeNode != null && causeNode.isObject()
        ? JsonUtils.fromJsonNode(causeNode, ApiError.class)
        : null;
    return new DeletionFailure(id, cause);
  }

  public LinkByUid getId() {
    return id;
  }

  public ApiError getCause() {
    return cause;
  }

  @Override
  public String toString() {
    return "DeletionFailure{id=" + id + ", cause=" + cause + "}";
  }
}
