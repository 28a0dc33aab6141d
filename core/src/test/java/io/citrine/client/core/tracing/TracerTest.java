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

package io.citrine.client.core.tracing;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

import org.junit.jupiter.api.Test;

import io.citrine.client.core.NotFoundException;

/**
 * Unit tests for Tracer. No OpenTelemetry SDK is installed, so spans are
 * no-ops and only the pass-through behavior is observable.
 */
class TracerTest {

  @Test
  void testReturnsResult() {
    String result = Tracer.runInSpan("gemd/batch", Map.of("citrine:batch", 1, "citrine:dryRun", true),
        () -> "done");

    assertEquals("done", result);
  }

  @Test
  void testPropagatesExceptions() {
    NotFoundException thrown = new NotFoundException("teams/x");

    NotFoundException caught = assertThrows(NotFoundException.class,
        () -> Tracer.runInSpan("gemd/batch", null, () -> {
          throw thrown;
        }));

    assertSame(thrown, caught);
  }

  @Test
  void testAddEventWithoutSpan() {
    assertDoesNotThrow(() -> Tracer.addEvent("submitted", Map.of("count", "3")));
  }
}
