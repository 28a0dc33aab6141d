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

/**
 * The caller is authenticated but not allowed to perform this call (HTTP
 * status 403).
 */
public class ForbiddenException extends NonRetryableException {

  private final String path;

  public ForbiddenException(String path) {
    super("Forbidden: " + path);
    this.path = path;
  }

  /**
   * Returns the request path that failed.
   *
   * @return the path
   */
  public String getPath() {
    return path;
  }
}
