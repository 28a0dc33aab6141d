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

package io.citrine.client.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * JsonUtils provides JSON serialization and deserialization utilities for the
 * client.
 */
public final class JsonUtils {

  private static final ObjectMapper objectMapper;

  static {
    objectMapper = new ObjectMapper();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
  }

  private JsonUtils() {
    // Utility class
  }

  /**
   * Returns the shared ObjectMapper instance.
   *
   * @return the ObjectMapper
   */
  public static ObjectMapper getObjectMapper() {
    return objectMapper;
  }

  /**
   * Converts an object to JSON string.
   *
   * @param value
   *            the object to convert
   * @return the JSON string
   * @throws CitrineException
   *             if serialization fails
   */
  public static String toJson(Object value) throws CitrineException {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new CitrineException("Failed to serialize to JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts an object to a JsonNode.
   *
   * @param value
   *            the object to convert
   * @return the JsonNode
   */
  public static JsonNode toJsonNode(Object value) {
    return objectMapper.valueToTree(value);
  }

  /**
   * Parses a JSON string to the specified type.
   *
   * @param json
   *            the JSON string
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the parsed object
   * @throws CitrineException
   *             if parsing fails
   */
  public static <T> T fromJson(String json, Class<T> clazz) throws CitrineException {
    try {
      return objectMapper.readValue(json, clazz);
    } catch (JsonProcessingException e) {
      throw new CitrineException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }

  /**
   * Converts a JsonNode to the specified type.
   *
   * @param node
   *            the JsonNode
   * @param clazz
   *            the target class
   * @param <T>
   *            the target type
   * @return the converted object
   * @throws CitrineException
   *             if conversion fails
   */
  public static <T> T fromJsonNode(JsonNode node, Class<T> clazz) throws CitrineException {
    try {
      return objectMapper.treeToValue(node, clazz);
    } catch (JsonProcessingException e) {
      throw new CitrineException("Failed to convert JsonNode: " + e.getMessage(), e);
    }
  }

  /**
   * Parses a JSON string to a JsonNode.
   *
   * @param json
   *            the JSON string
   * @return the JsonNode
   * @throws CitrineException
   *             if parsing fails
   */
  public static JsonNode parseJson(String json) throws CitrineException {
    try {
      return objectMapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new CitrineException("Failed to parse JSON: " + e.getMessage(), e);
    }
  }
}
