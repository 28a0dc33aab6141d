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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A user-facing message describing why a request was invalid.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationError {

  @JsonProperty("failure_message")
  private String failureMessage;

  @JsonProperty("property")
  private String property;

  @JsonProperty("input")
  private String input;

  @JsonProperty("failure_id")
  private String failureId;

  public String getFailureMessage() {
    return failureMessage;
  }

  public void setFailureMessage(String failureMessage) {
    this.failureMessage = failureMessage;
  }

  public String getProperty() {
    return property;
  }

  public void setProperty(String property) {
    this.property = property;
  }

  public String getInput() {
    return input;
  }

  public void setInput(String input) {
    this.input = input;
  }

  public String getFailureId() {
    return failureId;
  }

  public void setFailureId(String failureId) {
    this.failureId = failureId;
  }

  @Override
  public String toString() {
    return "ValidationError{failureId='" + failureId + "', failureMessage='" + failureMessage + "'}";
  }
}
