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

package io.citrine.client.gemd.json;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.citrine.client.core.CitrineException;
import io.citrine.client.core.JsonUtils;
import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.LinkByUid;
import io.citrine.client.gemd.entity.attribute.Parameter;
import io.citrine.client.gemd.entity.object.MaterialSpec;
import io.citrine.client.gemd.entity.object.ProcessSpec;
import io.citrine.client.gemd.entity.template.ParameterTemplate;
import io.citrine.client.gemd.entity.template.ProcessTemplate;

/**
 * Unit tests for GemdJson.
 */
class GemdJsonTest {

  @Test
  void testNestedObjectsBecomeLinks() {
    ProcessTemplate template = new ProcessTemplate("anneal");
    template.addUid("custom", "t1");
    template.addUid(BaseEntity.CITRINE_SCOPE, "t2");
    ProcessSpec spec = new ProcessSpec("anneal 400C");
    spec.addUid(BaseEntity.CITRINE_SCOPE, "s1");
    spec.setTemplate(template);

    ObjectNode wire = GemdJson.toWire(spec);

    assertEquals("process_spec", wire.get("type").asText());
    JsonNode link = wire.get("template");
    assertEquals("link_by_uid", link.get("type").asText());
    assertEquals("id", link.get("scope").asText());
    assertEquals("t2", link.get("id").asText());
    assertFalse(link.has("name"));
  }

  @Test
  void testLinksInsideAttributes() {
    ParameterTemplate time = new ParameterTemplate("time", null);
    time.addUid("custom", "time");
    ProcessSpec spec = new ProcessSpec("anneal");
    spec.addUid("custom", "s1");
    spec.setParameters(List.of(new Parameter("time", DoubleNode.valueOf(2.0), time)));

    ObjectNode wire = GemdJson.toWire(spec);

    JsonNode parameter = wire.get("parameters").get(0);
    assertEquals("parameter", parameter.get("type").asText());
    assertEquals(2.0, parameter.get("value").asDouble());
    assertEquals("link_by_uid", parameter.get("template").get("type").asText());
    assertEquals("custom", parameter.get("template").get("scope").asText());
  }

  @Test
  void testNullFieldsAreDropped() {
    MaterialSpec spec = new MaterialSpec("powder");
    spec.addUid("custom", "m1");

    ObjectNode wire = GemdJson.toWire(spec);

    assertFalse(wire.has("template"));
    assertFalse(wire.has("process"));
    assertFalse(wire.has("notes"));
    assertEquals("powder", wire.get("name").asText());
  }

  @Test
  void testScrubNullsKeepsArrayPositions() {
    ObjectNode node = (ObjectNode) JsonUtils.parseJson("{\"a\": null, \"b\": [1, null], \"c\": {\"d\": null}}");

    GemdJson.scrubNulls(node);

    assertFalse(node.has("a"));
    assertEquals(2, node.get("b").size());
    assertTrue(node.get("c").isEmpty());
  }

  @Test
  void testBuildReadsTypeAndLinks() {
    JsonNode node = JsonUtils.parseJson("{\"type\": \"process_spec\", \"name\": \"anneal\", "
        + "\"uids\": {\"id\": \"s1\"}, \"tags\": [\"heat\"], "
        + "\"template\": {\"type\": \"link_by_uid\", \"scope\": \"id\", \"id\": \"t1\"}}");

    ProcessSpec spec = GemdJson.build(node, ProcessSpec.class);

    assertEquals("anneal", spec.getName());
    assertEquals("s1", spec.getUids().get("id"));
    assertEquals(List.of("heat"), spec.getTags());
    assertEquals(new LinkByUid("id", "t1"), spec.getTemplate());
  }

  @Test
  void testBuildRejectsLinksAndScalars() {
    JsonNode link = GemdJson.linkNode(new LinkByUid("id", "x"));

    assertThrows(CitrineException.class, () -> GemdJson.build(link));
    assertThrows(CitrineException.class, () -> GemdJson.build(JsonUtils.parseJson("42")));
  }

  @Test
  void testBuildRejectsUnexpectedClass() {
    JsonNode node = JsonUtils.parseJson("{\"type\": \"process_template\", \"name\": \"anneal\"}");

    assertThrows(CitrineException.class, () -> GemdJson.build(node, ProcessSpec.class));
  }
}
