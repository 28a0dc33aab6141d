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

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.util.Map;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;

import io.citrine.client.core.BadRequestException;
import io.citrine.client.core.ConflictException;
import io.citrine.client.core.ForbiddenException;
import io.citrine.client.core.JsonUtils;
import io.citrine.client.core.NonRetryableException;
import io.citrine.client.core.NotFoundException;
import io.citrine.client.core.RetryableException;
import io.citrine.client.core.ServiceUnavailableException;
import io.citrine.client.core.UnauthorizedException;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;

/**
 * Unit tests for OkHttpSession.
 */
class OkHttpSessionTest {

  private MockWebServer server;
  private OkHttpSession session;

  @BeforeEach
  void setUp() throws IOException {
    server = new MockWebServer();
    server.start();
    OkHttpSessionOptions options = OkHttpSessionOptions.builder().apiKey("secret-token")
        .baseUrl(server.url("/api/v1/").toString()).timeout(5).build();
    session = new OkHttpSession(options);
  }

  @AfterEach
  void tearDown() throws IOException {
    server.shutdown();
  }

  @Test
  void testPutSendsBodyParamsAndToken() throws InterruptedException {
    server.enqueue(new MockResponse().setBody("{\"objects\": []}"));

    JsonNode response = session.putResource("teams/t1/datasets/d1/gemd/batch",
        JsonUtils.parseJson("{\"objects\": [{\"type\": \"process_spec\"}]}"), Map.of("dry_run", "true"));

    assertTrue(response.get("objects").isArray());
    RecordedRequest request = server.takeRequest();
    assertEquals("PUT", request.getMethod());
    assertEquals("/api/v1/teams/t1/datasets/d1/gemd/batch", request.getRequestUrl().encodedPath());
    assertEquals("true", request.getRequestUrl().queryParameter("dry_run"));
    assertEquals("Bearer secret-token", request.getHeader("Authorization"));
    JsonNode sent = JsonUtils.parseJson(request.getBody().readUtf8());
    assertEquals("process_spec", sent.get("objects").get(0).get("type").asText());
  }

  @Test
  void testGetWithQuery() throws InterruptedException {
    server.enqueue(new MockResponse().setBody("{\"status\": \"Running\"}"));

    JsonNode response = session.getResource("/teams/t1/execution/job-status", Map.of("job_id", "j1"));

    assertEquals("Running", response.get("status").asText());
    RecordedRequest request = server.takeRequest();
    assertEquals("GET", request.getMethod());
    assertEquals("/api/v1/teams/t1/execution/job-status?job_id=j1", request.getPath());
  }

  @Test
  void testEmptyBodyIsNull() {
    server.enqueue(new MockResponse().setResponseCode(204));

    assertTrue(session.deleteResource("teams/t1/gemd/x").isNull());
  }

  @Test
  void testBadRequestParsesApiError() {
    server.enqueue(new MockResponse().setResponseCode(400)
        .setBody("{\"code\": 400, \"message\": \"Template not found\", \"validation_errors\": []}"));

    BadRequestException exception = assertThrows(BadRequestException.class,
        () -> session.postResource("teams/t1/gemd/async-batch-delete", Map.of("ids", "[]"), Map.of()));

    assertEquals("Template not found", exception.getApiError().getMessage());
    assertEquals("teams/t1/gemd/async-batch-delete", exception.getPath());
  }

  @Test
  void testBadRequestWithoutJsonBody() {
    server.enqueue(new MockResponse().setResponseCode(400).setBody("<html>nope</html>"));

    BadRequestException exception = assertThrows(BadRequestException.class,
        () -> session.getResource("teams/t1", Map.of()));

    assertNull(exception.getApiError());
  }

  @Test
  void testStatusMapping() {
    server.enqueue(new MockResponse().setResponseCode(401));
    server.enqueue(new MockResponse().setResponseCode(403));
    server.enqueue(new MockResponse().setResponseCode(404));
    server.enqueue(new MockResponse().setResponseCode(409).setBody("{\"code\": 409, \"message\": \"exists\"}"));
    server.enqueue(new MockResponse().setResponseCode(503));
    server.enqueue(new MockResponse().setResponseCode(500));

    assertThrows(UnauthorizedException.class, () -> session.getResource("a", Map.of()));
    assertThrows(ForbiddenException.class, () -> session.getResource("a", Map.of()));
    assertThrows(NotFoundException.class, () -> session.getResource("a", Map.of()));
    ConflictException conflict = assertThrows(ConflictException.class, () -> session.getResource("a", Map.of()));
    assertEquals("exists", conflict.getApiError().getMessage());
    ServiceUnavailableException unavailable = assertThrows(ServiceUnavailableException.class,
        () -> session.getResource("a", Map.of()));
    assertEquals(503, unavailable.getStatusCode());
    assertTrue(unavailable.isRetryable());
    NonRetryableException other = assertThrows(NonRetryableException.class,
        () -> session.getResource("a", Map.of()));
    assertEquals("500", other.getErrorCode());
  }

  @Test
  void testServerStacktraceKeepsBodyInDetails() {
    String body = "{\"debug_stacktrace\": \"Traceback (most recent call last): ...\"}";
    server.enqueue(new MockResponse().setResponseCode(500).setBody(body));

    NonRetryableException exception = assertThrows(NonRetryableException.class,
        () -> session.putResource("teams/t1/batch", Map.of(), Map.of()));

    assertEquals("500", exception.getErrorCode());
    assertEquals(body, exception.getDetails());
  }

  @Test
  void testNetworkFailureIsRetryable() {
    // OkHttp retries a failed connection once
    server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));
    server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

    RetryableException exception = assertThrows(RetryableException.class,
        () -> session.getResource("teams/t1", Map.of()));

    assertTrue(exception.isRetryable());
  }

  @Test
  void testPostWithoutBody() throws InterruptedException {
    server.enqueue(new MockResponse().setBody("{}"));

    session.postResource("teams/t1/things", null, Map.of());

    assertEquals(0, server.takeRequest().getBodySize());
  }
}
