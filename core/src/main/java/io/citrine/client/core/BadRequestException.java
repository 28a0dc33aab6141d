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
 * The request was rejected as invalid (HTTP status 400). The parsed platform
 * error, when the response carried one, is available from {@link #getApiError()}.
 */
public class BadRequestException extends NonRetryableException {

  private final String path;
  private final ApiError apiError;

  public BadRequestException(String path, ApiError apiError) {
    super("Bad request: " + path + (apiError != null && apiError.getMessage() != null
        ? " (" + apiError.getMessage() + ")"
        : ""), null, "400", apiError);
    this.path = path;
    this.apiError = apiError;
  }

  public String getPath() {
    return path;
  }

  /**
   * Returns the platform error body.
   *
   * @return the error, or null if the response body could not be parsed
   */
  public ApiError getApiError() {
    return apiError;
  }
}
