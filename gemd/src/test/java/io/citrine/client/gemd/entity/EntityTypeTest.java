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

package io.citrine.client.gemd.entity;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for EntityType.
 */
class EntityTypeTest {

  @Test
  void testTemplatesBeforeSpecsBeforeRuns() {
    List<EntityType> types = new ArrayList<>(Arrays.asList(EntityType.values()));
    Collections.reverse(types);
    types.sort(EntityType.writableOrder());

    assertEquals(EntityType.CONDITION_TEMPLATE, types.get(0));
    assertTrue(types.indexOf(EntityType.PROPERTY_TEMPLATE) < types.indexOf(EntityType.MATERIAL_TEMPLATE));
    assertTrue(types.indexOf(EntityType.PROCESS_TEMPLATE) < types.indexOf(EntityType.PROCESS_SPEC));
    assertTrue(types.indexOf(EntityType.PROCESS_SPEC) < types.indexOf(EntityType.MATERIAL_SPEC));
    assertTrue(types.indexOf(EntityType.INGREDIENT_SPEC) < types.indexOf(EntityType.PROCESS_RUN));
    assertTrue(types.indexOf(EntityType.MATERIAL_RUN) < types.indexOf(EntityType.MEASUREMENT_RUN));
    assertEquals(EntityType.INGREDIENT_RUN, types.get(types.size() - 1));
  }

  @Test
  void testFromValue() {
    assertEquals(EntityType.MATERIAL_RUN, EntityType.fromValue("material_run"));
    assertEquals("measurement_spec", EntityType.MEASUREMENT_SPEC.getValue());
    assertThrows(IllegalArgumentException.class, () -> EntityType.fromValue("link_by_uid"));
  }
}
