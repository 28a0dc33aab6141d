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

import java.util.Map;
import java.util.function.Supplier;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Scope;

/**
 * Tracer wraps client operations in OpenTelemetry spans. Spans go to whatever
 * SDK the host application registered globally, and are no-ops otherwise.
 */
public final class Tracer {

  private static final String INSTRUMENTATION_NAME = "citrine-java";

  private Tracer() {
    // Utility class
  }

  /**
   * Runs a function within a new span.
   *
   * @param name
   *            the span name
   * @param attributes
   *            span attributes; String, Long, Double and Boolean values keep
   *            their type, anything else is recorded as a string
   * @param fn
   *            the function to execute
   * @param <O>
   *            the output type
   * @return the function result
   */
  public static <O> O runInSpan(String name, Map<String, Object> attributes, Supplier<O> fn) {
    Span span = GlobalOpenTelemetry.getTracer(INSTRUMENTATION_NAME).spanBuilder(name)
        .setSpanKind(SpanKind.CLIENT).startSpan();

    if (attributes != null) {
      for (Map.Entry<String, Object> entry : attributes.entrySet()) {
        if (entry.getValue() instanceof String) {
          span.setAttribute(entry.getKey(), (String) entry.getValue());
        } else if (entry.getValue() instanceof Long) {
          span.setAttribute(entry.getKey(), (Long) entry.getValue());
        } else if (entry.getValue() instanceof Integer) {
          span.setAttribute(entry.getKey(), ((Integer) entry.getValue()).longValue());
        } else if (entry.getValue() instanceof Double) {
          span.setAttribute(entry.getKey(), (Double) entry.getValue());
        } else if (entry.getValue() instanceof Boolean) {
          span.setAttribute(entry.getKey(), (Boolean) entry.getValue());
        } else if (entry.getValue() != null) {
          span.setAttribute(entry.getKey(), entry.getValue().toString());
        }
      }
    }

    try (Scope scope = span.makeCurrent()) {
      O result = fn.get();
      span.setAttribute("citrine:state", "success");
      span.setStatus(StatusCode.OK);
      return result;
    } catch (RuntimeException e) {
      span.setAttribute("citrine:state", "error");
      span.setStatus(StatusCode.ERROR, e.getMessage());
      span.recordException(e);
      throw e;
    } finally {
      span.end();
    }
  }

  /**
   * Adds an event to the current span.
   *
   * @param name
   *            the event name
   * @param attributes
   *            the event attributes
   */
  public static void addEvent(String name, Map<String, String> attributes) {
    Span currentSpan = Span.current();
    AttributesBuilder attrBuilder = Attributes.builder();
    if (attributes != null) {
      for (Map.Entry<String, String> entry : attributes.entrySet()) {
        attrBuilder.put(entry.getKey(), entry.getValue());
      }
    }
    currentSpan.addEvent(name, attrBuilder.build());
  }
}
