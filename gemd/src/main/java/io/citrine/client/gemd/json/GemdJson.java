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

package io.citrine.client.gemd.json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.citrine.client.core.CitrineException;
import io.citrine.client.core.JsonUtils;
import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.LinkByUid;

/**
 * GemdJson converts GEMD objects to and from their wire representation.
 *
 * <p>
 * On the wire every object nested inside another one is replaced by a
 * {@code link_by_uid}, so a payload never embeds a second copy of an object.
 */
public final class GemdJson {

  private static final String LINK_TYPE = "link_by_uid";

  private GemdJson() {
    // Utility class
  }

  /**
   * Serializes an entity for submission: nested objects become links and null
   * fields are dropped.
   *
   * @param entity
   *            the entity to serialize
   * @return the wire representation
   */
  public static ObjectNode toWire(BaseEntity entity) {
    ObjectNode node = JsonUtils.getObjectMapper().valueToTree(entity);
    scrubNulls(node);
    replaceObjectsWithLinks(node);
    return node;
  }

  /**
   * Serializes entities for submission.
   *
   * @param entities
   *            the entities to serialize
   * @return the wire representations, in the same order
   */
  public static List<ObjectNode> toWire(List<? extends BaseEntity> entities) {
    List<ObjectNode> nodes = new ArrayList<>(entities.size());
    for (BaseEntity entity : entities) {
      nodes.add(toWire(entity));
    }
    return nodes;
  }

  /**
   * Builds an entity from its wire representation. The concrete class is chosen
   * from the {@code "type"} field.
   *
   * @param node
   *            the serialized entity
   * @return the entity
   * @throws CitrineException
   *             if the node is not a known GEMD object
   */
  public static BaseEntity build(JsonNode node) {
    if (node == null || !node.isObject()) {
      throw new CitrineException("Expected a serialized GEMD object but got: " + node);
    }
    if (LINK_TYPE.equals(node.path("type").asText())) {
      throw new CitrineException("Expected a serialized GEMD object but got a link: " + node);
    }
    return JsonUtils.fromJsonNode(node, BaseEntity.class);
  }

  /**
   * Builds an entity of an expected class from its wire representation.
   *
   * @param node
   *            the serialized entity
   * @param clazz
   *            the expected class
   * @param <T>
   *            the entity type
   * @return the entity
   */
  public static <T extends BaseEntity> T build(JsonNode node, Class<T> clazz) {
    BaseEntity entity = build(node);
    if (!clazz.isInstance(entity)) {
      throw new CitrineException("Expected " + clazz.getSimpleName() + " but got " + entity.getType());
    }
    return clazz.cast(entity);
  }

  /**
   * Replaces every nested object with a link. The top-level node itself is kept.
   *
   * @param node
   *            the node to rewrite in place
   */
  static void replaceObjectsWithLinks(ObjectNode node) {
    Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      field.setValue(objectToLink(field.getValue()));
    }
  }

  private static JsonNode objectToLink(JsonNode value) {
    if (value.isObject()) {
      ObjectNode object = (ObjectNode) value;
      if (object.has("type") && object.has("uids") && !LINK_TYPE.equals(object.get("type").asText())) {
        return objectToLinkByUid(object);
      }
      replaceObjectsWithLinks(object);
      return object;
    }
    if (value.isArray()) {
      ArrayNode array = (ArrayNode) value;
      for (int i = 0; i < array.size(); i++) {
        array.set(i, objectToLink(array.get(i)));
      }
    }
    return value;
  }

  private static JsonNode objectToLinkByUid(ObjectNode object) {
    JsonNode uids = object.get("uids");
    if (!uids.isObject() || uids.isEmpty()) {
      replaceObjectsWithLinks(object);
      return object;
    }
    String scope = uids.has(BaseEntity.CITRINE_SCOPE) ? BaseEntity.CITRINE_SCOPE : uids.fieldNames().next();
    LinkByUid link = new LinkByUid(scope, uids.get(scope).asText());
    return linkNode(link);
  }

  /**
   * Returns the wire representation of a link.
   *
   * @param link
   *            the link
   * @return the link as {@code {"type": "link_by_uid", "scope": ..., "id": ...}}
   */
  public static ObjectNode linkNode(LinkByUid link) {
    ObjectMapper mapper = JsonUtils.getObjectMapper();
    ObjectNode node = mapper.createObjectNode();
    node.put("type", LINK_TYPE);
    node.put("scope", link.getScope());
    node.put("id", link.getId());
    return node;
  }

  /**
   * Recursively removes object fields whose value is null. Nulls inside arrays
   * are kept since they are positional.
   */
  static void scrubNulls(JsonNode node) {
    if (node.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        if (field.getValue().isNull()) {
          fields.remove();
        } else {
          scrubNulls(field.getValue());
        }
      }
    } else if (node.isArray()) {
      for (JsonNode element : node) {
        scrubNulls(element);
      }
    }
  }
}
