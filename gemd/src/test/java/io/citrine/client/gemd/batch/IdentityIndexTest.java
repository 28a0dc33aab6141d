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

import io.citrine.client.gemd.entity.LinkByUid;
import io.citrine.client.gemd.entity.object.ProcessSpec;
import io.citrine.client.gemd.entity.template.ProcessTemplate;

/**
 * Unit tests for IdentityIndex.
 */
class IdentityIndexTest {

  @Test
  void testIndexesEveryScope() {
    ProcessTemplate template = template("t");
    template.addUid("id", "platform-t");

    IdentityIndex index = IdentityIndex.of(List.of(template));

    assertSame(template, index.get(new LinkByUid(SCOPE, "t")));
    assertSame(template, index.get(new LinkByUid("id", "platform-t")));
    assertEquals(2, index.asMap().size());
  }

  @Test
  void testReplicateWithExtraScopeJoinsOriginal() {
    ProcessTemplate template = template("t");
    ProcessTemplate replicate = template("t");
    replicate.addUid("id", "platform-t");

    IdentityIndex index = IdentityIndex.of(List.of(template, replicate));

    assertEquals(List.of(template), index.entities());
    assertSame(template, index.get(new LinkByUid("id", "platform-t")));
    assertSame(template, index.resolve(replicate));
  }

  @Test
  void testResolvesLinksAndCopies() {
    ProcessTemplate template = template("t");
    ProcessTemplate copy = template("t");
    IdentityIndex index = IdentityIndex.of(List.of(template));

    assertSame(template, index.resolve(template));
    assertSame(template, index.resolve(copy));
    assertSame(template, index.resolve(new LinkByUid(SCOPE, "t")));
    assertNull(index.resolve(new LinkByUid(SCOPE, "elsewhere")));
    assertNull(index.resolve(null));
  }

  @Test
  void testCollapsesReplicates() {
    ProcessTemplate template = template("t");
    ProcessTemplate replicate = template("t");
    replicate.addUid("other", "o1");

    IdentityIndex index = IdentityIndex.of(List.of(template, replicate, template));

    assertEquals(List.of(template), index.entities());
    assertSame(template, index.resolve(replicate));
    assertSame(template, index.get(new LinkByUid("other", "o1")));
  }

  @Test
  void testCollisionOnDifferentContent() {
    ProcessTemplate template = template("t");
    ProcessTemplate impostor = new ProcessTemplate("impostor");
    impostor.addUid(SCOPE, "t");

    ObjectCollisionException exception = assertThrows(ObjectCollisionException.class,
        () -> IdentityIndex.of(List.of(template, impostor)));

    assertTrue(exception.getMessage().contains("LinkByUid(test, t)"));
  }

  @Test
  void testObjectsWithoutUidsStayDistinct() {
    ProcessSpec first = new ProcessSpec("s");
    ProcessSpec second = new ProcessSpec("s");

    assertEquals(2, IdentityIndex.of(List.of(first, second)).size());
  }
}
