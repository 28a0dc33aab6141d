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

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import io.citrine.client.core.ApiError;
import io.citrine.client.core.BadRequestException;
import io.citrine.client.core.CitrineException;
import io.citrine.client.core.ConflictException;
import io.citrine.client.core.ForbiddenException;
import io.citrine.client.core.JsonUtils;
import io.citrine.client.core.NonRetryableException;
import io.citrine.client.core.NotFoundException;
import io.citrine.client.core.RetryableException;
import io.citrine.client.core.ServiceUnavailableException;
import io.citrine.client.core.Session;
import io.citrine.client.core.UnauthorizedException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link Session} implementation backed by OkHttp.
 *
 * <p>
 * Every request carries the API token as a bearer token. Non-2xx responses are
 * mapped onto the client exception hierarchy; network failures become
 * {@link RetryableException}.
 */
public class OkHttpSession implements Session {

  private static final Logger logger = LoggerFactory.getLogger(OkHttpSession.class);
  private static final MediaType JSON_MEDIA_TYPE = MediaType.parse("application/json");

  private final OkHttpSessionOptions options;
  private final OkHttpClient client;
  private final HttpUrl baseUrl;

  /**
   * Creates a new OkHttpSession.
   *
   * @param options
   *            the session options
   */
  public OkHttpSession(OkHttpSessionOptions options) {
    this(options, new OkHttpClient.Builder().connectTimeout(options.getTimeout(), TimeUnit.SECONDS)
        .readTimeout(options.getTimeout(), TimeUnit.SECONDS).writeTimeout(options.getTimeout(), TimeUnit.SECONDS)
        .build());
  }

  OkHttpSession(OkHttpSessionOptions options, OkHttpClient client) {
    this.options = options;
    this.client = client;
    this.baseUrl = HttpUrl.parse(options.getBaseUrl());
    if (baseUrl == null) {
      throw new IllegalArgumentException("Invalid base URL: " + options.getBaseUrl());
    }
  }

  @Override
  public JsonNode getResource(String path, Map<String, String> params) {
    return execute("GET", path, params, null);
  }

  @Override
  public JsonNode postResource(String path, Object body, Map<String, String> params) {
    return execute("POST", path, params, body);
  }

  @Override
  public JsonNode putResource(String path, Object body, Map<String, String> params) {
    return execute("PUT", path, params, body);
  }

  @Override
  public JsonNode deleteResource(String path) {
    return execute("DELETE", path, Map.of(), null);
  }

  private JsonNode execute(String method, String path, Map<String, String> params, Object body) {
    HttpUrl url = buildUrl(path, params);
    RequestBody requestBody = null;
    if (body != null) {
      requestBody = RequestBody.create(JsonUtils.toJson(body), JSON_MEDIA_TYPE);
    } else if ("POST".equals(method) || "PUT".equals(method)) {
      requestBody = RequestBody.create("", JSON_MEDIA_TYPE);
    }
    Request request = new Request.Builder().url(url).header("Authorization", "Bearer " + options.getApiKey())
        .header("Content-Type", "application/json").method(method, requestBody).build();

    try (Response response = client.newCall(request).execute()) {
      logger.info("{} {} {}", response.code(), method, path);
      String responseBody = readBody(response);
      if (!response.isSuccessful()) {
        logStacktrace(responseBody);
        throw toException(response.code(), method, path, responseBody);
      }
      if (responseBody == null || responseBody.isBlank()) {
        return NullNode.getInstance();
      }
      return JsonUtils.parseJson(responseBody);
    } catch (IOException e) {
      logger.error("{} {} failed: {}", method, path, e.getMessage());
      throw new RetryableException(method + " " + path + " failed: " + e.getMessage(), e);
    }
  }

  HttpUrl buildUrl(String path, Map<String, String> params) {
    String relative = path.startsWith("/") ? path.substring(1) : path;
    HttpUrl.Builder builder = baseUrl.newBuilder().addPathSegments(relative);
    if (params != null) {
      for (Map.Entry<String, String> param : params.entrySet()) {
        builder.addQueryParameter(param.getKey(), param.getValue());
      }
    }
    return builder.build();
  }

  private static String readBody(Response response) throws IOException {
    ResponseBody body = response.body();
    return body != null ? body.string() : null;
  }

  private static CitrineException toException(int code, String method, String path, String responseBody) {
    switch (code) {
      case 400 :
        logger.error("{} {} rejected: {}", method, path, responseBody);
        return new BadRequestException(path, parseApiError(responseBody));
      case 401 :
        logger.error("{} {} unauthorized", method, path);
        return new UnauthorizedException(path);
      case 403 :
        logger.error("{} {} forbidden", method, path);
        return new ForbiddenException(path);
      case 404 :
        logger.warn("{} {} not found", method, path);
        return new NotFoundException(path);
      case 409 :
        logger.error("{} {} conflict: {}", method, path, responseBody);
        return new ConflictException(path, parseApiError(responseBody));
      case 429 :
      case 502 :
      case 503 :
      case 504 :
        logger.error("{} {} unavailable ({})", method, path, code);
        return new ServiceUnavailableException(path, code);
      default :
        logger.error("{} {} failed with status {}: {}", method, path, code, responseBody);
        return new NonRetryableException("Request " + method + " " + path + " failed with status " + code, null,
            String.valueOf(code), responseBody);
    }
  }

  private static void logStacktrace(String responseBody) {
    if (responseBody == null || responseBody.isBlank()) {
      return;
    }
    try {
      JsonNode stacktrace = JsonUtils.parseJson(responseBody).get("debug_stacktrace");
      if (stacktrace != null && stacktrace.isTextual()) {
        logger.error("Response arrived with stacktrace:\n{}", stacktrace.asText());
      }
    } catch (CitrineException e) {
      logger.debug("Error response is not JSON: {}", e.getMessage());
    }
  }

  private static ApiError parseApiError(String responseBody) {
    if (responseBody == null || responseBody.isBlank()) {
      return null;
    }
    try {
      return JsonUtils.fromJson(responseBody, ApiError.class);
    } catch (CitrineException e) {
      logger.debug("Response body is not an API error: {}", e.getMessage());
      return null;
    }
  }
}
