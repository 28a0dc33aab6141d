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

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.LinkByUid;
import io.citrine.client.gemd.entity.object.ProcessRun;
import io.citrine.client.gemd.entity.object.ProcessSpec;
import io.citrine.client.gemd.entity.template.ProcessTemplate;

/**
 * Unit tests for BatchByDependency.
 */
class BatchByDependencyTest {

  private final Batcher batcher = Batcher.byDependency();

  @Test
  void testChainFitsInOneBatch() {
    ProcessTemplate template = template("t");
    ProcessSpec spec = spec("s", template);
    ProcessRun run = run("r", spec);

    List<List<BaseEntity>> batches = batcher.batch(List.of(run, spec, template), 3);

    assertEquals(List.of(List.of(template, spec, run)), batches);
  }

  @Test
  void testSharedTemplateRepeatedPerCluster() {
    ProcessTemplate template = template("t");
    ProcessSpec firstSpec = spec("s1", template);
    ProcessSpec secondSpec = spec("s2", template);
    ProcessRun firstRun = run("r1", firstSpec);
    ProcessRun secondRun = run("r2", secondSpec);
    List<BaseEntity> objects = List.of(template, firstSpec, secondSpec, firstRun, secondRun);

    List<List<BaseEntity>> batches = batcher.batch(objects, 3);

    assertEquals(List.of(List.of(template, firstSpec, firstRun), List.of(template, secondSpec, secondRun)),
        batches);
    assertEquals(2, occurrences(batches, template));
    assertSelfContained(batches, objects);
  }

  @Test
  void testEveryObjectCoveredWithinSize() {
    ProcessTemplate template = template("t");
    List<BaseEntity> objects = new ArrayList<>();
    objects.add(template);
    for (int i = 0; i < 5; i++) {
      ProcessSpec spec = spec("s" + i, template);
      objects.add(spec);
      objects.add(run("r" + i, spec));
    }

    List<List<BaseEntity>> batches = batcher.batch(objects, 4);

    for (List<BaseEntity> batch : batches) {
      assertTrue(batch.size() <= 4);
      assertFalse(batch.isEmpty());
    }
    assertEquals(objects.size(), members(batches).size());
    assertSelfContained(batches, objects);
  }

  @Test
  void testDependentsFillRemainingSpace() {
    ProcessTemplate template = template("t");
    ProcessSpec first = spec("s1", template);
    ProcessSpec second = spec("s2", template);
    ProcessSpec third = spec("s3", template);

    List<List<BaseEntity>> batches = batcher.batch(List.of(template, first, second, third), 3);

    assertEquals(List.of(List.of(template, first, third), List.of(template, second)), batches);
  }

  @Test
  void testOversizedClosureNamesObject() {
    ProcessTemplate template = template("t");
    ProcessSpec spec = spec("s", template);
    ProcessRun run = run("r", spec);

    OversizedDependencyException exception = assertThrows(OversizedDependencyException.class,
        () -> batcher.batch(List.of(template, spec, run), 2));

    assertSame(run, exception.getEntity());
    assertEquals(3, exception.getRequiredSize());
    assertEquals(2, exception.getBatchSize());
  }

  @Test
  void testLinearChainFormsOneCluster() {
    List<BaseEntity> chain = linearChain();

    List<List<BaseEntity>> batches = batcher.batch(chain, 10);

    assertEquals(1, batches.size());
    assertEquals(10, batches.get(0).size());
    for (BaseEntity node : chain) {
      assertEquals(1, occurrences(batches, node));
    }
  }

  @Test
  void testLinearChainWithBatchSizeOne() {
    List<BaseEntity> chain = linearChain();

    OversizedDependencyException exception = assertThrows(OversizedDependencyException.class,
        () -> batcher.batch(chain, 1));

    assertEquals(1, exception.getBatchSize());
  }

  @Test
  void testReferencesOutsideCollectionAreIgnored() {
    ProcessSpec spec = spec("s", new LinkByUid("id", "registered-template"));
    ProcessRun run = run("r", template("not-submitted"));

    List<List<BaseEntity>> batches = batcher.batch(List.of(spec), 1);

    assertEquals(List.of(List.of(spec)), batches);
    assertEquals(List.of(List.of(run)), batcher.batch(List.of(run), 1));
  }

  @Test
  void testLinksResolveToSubmittedObjects() {
    ProcessTemplate template = template("t");
    ProcessSpec spec = spec("s", new LinkByUid(SCOPE, "t"));

    List<List<BaseEntity>> batches = batcher.batch(List.of(spec, template), 2);

    assertEquals(List.of(List.of(template, spec)), batches);
  }

  @Test
  void testReplicateDependencyCountedOnce() {
    ProcessTemplate template = template("t");
    ProcessSpec spec = spec("s", template("t"));

    List<List<BaseEntity>> batches = batcher.batch(List.of(template, spec), 2);

    assertEquals(List.of(List.of(template, spec)), batches);
  }

  @Test
  void testCycleDetected() {
    ProcessSpec first = spec("a", null);
    ProcessSpec second = spec("b", first);
    first.setTemplate(second);

    assertThrows(CyclicDependencyException.class, () -> batcher.batch(List.of(first, second), 5));
  }

  @Test
  void testSelfReferenceDetected() {
    ProcessSpec spec = spec("a", null);
    spec.setTemplate(spec);

    CyclicDependencyException exception = assertThrows(CyclicDependencyException.class,
        () -> batcher.batch(List.of(spec), 5));

    assertSame(spec, exception.getEntity());
  }

  @Test
  void testEmptyInput() {
    assertTrue(batcher.batch(List.of(), 3).isEmpty());
  }

  @Test
  void testRejectsNonPositiveBatchSize() {
    assertThrows(IllegalArgumentException.class, () -> batcher.batch(List.of(template("t")), -1));
  }

  private static void assertSelfContained(List<List<BaseEntity>> batches, List<BaseEntity> objects) {
    for (List<BaseEntity> batch : batches) {
      for (BaseEntity member : batch) {
        for (BaseEntity dependency : referenced(member)) {
          if (containsSame(objects, dependency)) {
            assertTrue(containsSame(batch, dependency), batch + " lacks " + dependency + " needed by " + member);
          }
        }
      }
    }
  }
}
