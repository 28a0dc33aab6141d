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

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * ApiError is the root level error model returned by the platform.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {

  @JsonProperty("code")
  private Integer code;

  @JsonProperty("message")
  private String message;

  @JsonProperty("validation_errors")
  private List<ValidationError> validationErrors;

  /**
   * Default constructor.
   */
  public ApiError() {
    this.validationErrors = new ArrayList<>();
  }

  /**
   * Creates an ApiError with a code and message.
   *
   * @param code
   *            the HTTP-like status code
   * @param message
   *            the error message
   */
  public ApiError(Integer code, String message) {
    this();
    this.code = code;
    this.message = message;
  }

  /**
   * Checks if this error contains a validation error with the given failure ID.
   *
   * @param failureId
   *            the failure ID to look for
   * @return true if a matching validation error is present
   */
  public boolean hasFailure(String failureId) {
    if (failureId == null || failureId.isEmpty()) {
      throw new IllegalArgumentException("failureId cannot be empty: '" + failureId + "'");
    }
    if (validationErrors == null) {
      return false;
    }
    return validationErrors.stream().anyMatch(v -> failureId.equals(v.getFailureId()));
  }

  public Integer getCode() {
    return code;
  }

  public void setCode(Integer code) {
    this.code = code;
  }

  public String getMessage() {
    return message;
  }

  public void setMessage(String message) {
    this.message = message;
  }

  public List<ValidationError> getValidationErrors() {
    return validationErrors;
  }

  public void setValidationErrors(List<ValidationError> validationErrors) {
    this.validationErrors = validationErrors;
  }

  @Override
  public String toString() {
    return "ApiError{code=" + code + ", message='" + message + "', validationErrors=" + validationErrors + "}";
  }
}
