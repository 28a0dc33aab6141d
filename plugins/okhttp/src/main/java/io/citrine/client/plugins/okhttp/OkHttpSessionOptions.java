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

package io.citrine.client.plugins.okhttp;

/**
 * Options for configuring an {@link OkHttpSession}.
 */
public class OkHttpSessionOptions {

  private final String apiKey;
  private final String baseUrl;
  private final int timeout;

  private OkHttpSessionOptions(Builder builder) {
    this.apiKey = builder.apiKey;
    this.baseUrl = builder.baseUrl.endsWith("/") ? builder.baseUrl : builder.baseUrl + "/";
    this.timeout = builder.timeout;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Gets the API token sent as a bearer token.
   *
   * @return the API token
   */
  public String getApiKey() {
    return apiKey;
  }

  /**
   * Gets the base URL for API requests, always ending with a slash.
   *
   * @return the base URL
   */
  public String getBaseUrl() {
    return baseUrl;
  }

  /**
   * Gets the request timeout in seconds.
   *
   * @return the timeout
   */
  public int getTimeout() {
    return timeout;
  }

  /**
   * Builder for OkHttpSessionOptions.
   */
  public static class Builder {
    private String apiKey = System.getenv("CITRINE_API_TOKEN");
    private String baseUrl = getBaseUrlFromEnv();
    private int timeout = 60;

    private static String getBaseUrlFromEnv() {
      String fromEnv = System.getenv("CITRINE_API_URL");
      return fromEnv != null && !fromEnv.isEmpty() ? fromEnv : "https://citrine.io/api/v1/";
    }

    public Builder apiKey(String apiKey) {
      this.apiKey = apiKey;
      return this;
    }

    public Builder baseUrl(String baseUrl) {
      this.baseUrl = baseUrl;
      return this;
    }

    public Builder timeout(int timeout) {
      this.timeout = timeout;
      return this;
    }

    public OkHttpSessionOptions build() {
      if (apiKey == null || apiKey.isEmpty()) {
        throw new IllegalStateException(
            "Citrine API token is required. Set CITRINE_API_TOKEN environment variable or provide it in options.");
      }
      if (baseUrl == null || baseUrl.isEmpty()) {
        throw new IllegalStateException("Citrine API base URL is required.");
      }
      if (timeout < 1) {
        throw new IllegalStateException("timeout must be at least 1 second but was " + timeout);
      }
      return new OkHttpSessionOptions(this);
    }
  }
}
