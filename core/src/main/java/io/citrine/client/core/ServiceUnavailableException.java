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
 * The platform is temporarily unable to serve the request (HTTP status 429,
 * 502, 503 or 504).
 */
public class ServiceUnavailableException extends RetryableException {

  private final String path;
  private final int statusCode;

  public ServiceUnavailableException(String path, int statusCode) {
    super("Service unavailable (" + statusCode + "): " + path);
    this.path = path;
    this.statusCode = statusCode;
  }

  public String getPath() {
    return path;
  }

  public int getStatusCode() {
    return statusCode;
  }
}
