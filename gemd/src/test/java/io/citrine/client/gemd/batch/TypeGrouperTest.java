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

package io.citrine.client.gemd.batch;

import static io.citrine.client.gemd.GemdFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.EntityType;
import io.citrine.client.gemd.entity.object.ProcessRun;
import io.citrine.client.gemd.entity.object.ProcessSpec;
import io.citrine.client.gemd.entity.template.ProcessTemplate;

/**
 * Unit tests for TypeGrouper.
 */
class TypeGrouperTest {

  @Test
  void testGroupsInWritableOrder() {
    ProcessTemplate template = template("t");
    ProcessSpec first = spec("s1", template);
    ProcessSpec second = spec("s2", template);
    ProcessRun run = run("r", first);

    List<List<BaseEntity>> groups = new TypeGrouper().groupAndOrder(List.of(run, second, template, first));

    assertEquals(3, groups.size());
    assertEquals(List.of(template), groups.get(0));
    assertEquals(List.of(second, first), groups.get(1));
    assertEquals(List.of(run), groups.get(2));
  }

  @Test
  void testCustomOrder() {
    ProcessTemplate template = template("t");
    ProcessSpec spec = spec("s", template);

    List<List<BaseEntity>> groups = new TypeGrouper(EntityType.writableOrder().reversed())
        .groupAndOrder(List.of(template, spec));

    assertEquals(List.of(spec), groups.get(0));
    assertEquals(List.of(template), groups.get(1));
  }

  @Test
  void testEmptyInput() {
    assertTrue(new TypeGrouper().groupAndOrder(List.of()).isEmpty());
  }

  @Test
  void testRequiresOrder() {
    assertThrows(IllegalArgumentException.class, () -> new TypeGrouper(null));
  }
}
