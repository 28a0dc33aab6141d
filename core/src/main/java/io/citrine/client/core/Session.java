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

import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Session is the HTTP seam of the client. Implementations resolve paths
 * against the platform base URL, attach credentials and map non-2xx responses
 * onto the {@link CitrineException} hierarchy.
 *
 * <p>
 * Paths are relative to the API root, for example
 * {@code teams/{teamId}/datasets/{datasetId}/gemd/batch}.
 */
public interface Session {

  /**
   * GETs a resource as JSON.
   *
   * @param path
   *            the resource path
   * @param params
   *            query parameters, may be empty
   * @return the parsed response body
   */
  JsonNode getResource(String path, Map<String, String> params);

  /**
   * POSTs a JSON body to a resource.
   *
   * @param path
   *            the resource path
   * @param body
   *            the request body, serialized with {@link JsonUtils}
   * @param params
   *            query parameters, may be empty
   * @return the parsed response body
   */
  JsonNode postResource(String path, Object body, Map<String, String> params);

  /**
   * PUTs a JSON body to a resource.
   *
   * @param path
   *            the resource path
   * @param body
   *            the request body, serialized with {@link JsonUtils}
   * @param params
   *            query parameters, may be empty
   * @return the parsed response body
   */
  JsonNode putResource(String path, Object body, Map<String, String> params);

  /**
   * DELETEs a resource.
   *
   * @param path
   *            the resource path
   * @return the parsed response body, or an empty object node
   */
  JsonNode deleteResource(String path);
}
