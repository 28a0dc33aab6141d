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

import org.junit.jupiter.api.Test;

/**
 * Unit tests for OkHttpSessionOptions.
 */
class OkHttpSessionOptionsTest {

  @Test
  void testBuilderWithAllOptions() {
    OkHttpSessionOptions options = OkHttpSessionOptions.builder().apiKey("token")
        .baseUrl("https://example.citrine.io/api/v1").timeout(30).build();

    assertEquals("token", options.getApiKey());
    assertEquals("https://example.citrine.io/api/v1/", options.getBaseUrl());
    assertEquals(30, options.getTimeout());
  }

  @Test
  void testDefaultTimeout() {
    OkHttpSessionOptions options = OkHttpSessionOptions.builder().apiKey("token").build();

    assertEquals(60, options.getTimeout());
    assertTrue(options.getBaseUrl().endsWith("/"));
  }

  @Test
  void testMissingApiKey() {
    assertThrows(IllegalStateException.class, () -> OkHttpSessionOptions.builder().apiKey(null).build());
    assertThrows(IllegalStateException.class, () -> OkHttpSessionOptions.builder().apiKey("").build());
  }

  @Test
  void testInvalidTimeout() {
    assertThrows(IllegalStateException.class,
        () -> OkHttpSessionOptions.builder().apiKey("token").timeout(0).build());
  }
}
