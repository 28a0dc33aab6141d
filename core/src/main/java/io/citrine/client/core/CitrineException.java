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
 * CitrineException is the base exception for all Citrine client errors. It
 * provides structured error information including error codes and details.
 */
public class CitrineException extends RuntimeException {

  private final String errorCode;
  private final Object details;

  /**
   * Creates a new CitrineException.
   *
   * @param message
   *            the error message
   */
  public CitrineException(String message) {
    this(message, null, null, null);
  }

  /**
   * Creates a new CitrineException with a cause.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   */
  public CitrineException(String message, Throwable cause) {
    this(message, cause, null, null);
  }

  /**
   * Creates a new CitrineException with full details.
   *
   * @param message
   *            the error message
   * @param cause
   *            the underlying cause
   * @param errorCode
   *            the error code
   * @param details
   *            additional error details
   */
  public CitrineException(String message, Throwable cause, String errorCode, Object details) {
    super(message, cause);
    this.errorCode = errorCode;
    this.details = details;
  }

  /**
   * Returns the error code.
   *
   * @return the error code, or null if not set
   */
  public String getErrorCode() {
    return errorCode;
  }

  /**
   * Returns additional error details.
   *
   * @return the error details, or null if not set
   */
  public Object getDetails() {
    return details;
  }

  /**
   * Whether the failed operation may succeed if attempted again.
   *
   * @return true for transient failures
   */
  public boolean isRetryable() {
    return false;
  }
}
