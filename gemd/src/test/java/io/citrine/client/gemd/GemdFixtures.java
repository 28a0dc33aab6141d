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

package io.citrine.client.gemd;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.EntityRef;
import io.citrine.client.gemd.entity.object.ProcessRun;
import io.citrine.client.gemd.entity.object.ProcessSpec;
import io.citrine.client.gemd.entity.template.ProcessTemplate;

/**
 * Small object graphs shared by the batching and registration tests.
 */
public final class GemdFixtures {

  public static final String SCOPE = "test";

  private GemdFixtures() {
  }

  public static ProcessTemplate template(String name) {
    ProcessTemplate template = new ProcessTemplate(name);
    template.addUid(SCOPE, name);
    return template;
  }

  public static ProcessSpec spec(String name, EntityRef template) {
    ProcessSpec spec = new ProcessSpec(name);
    spec.addUid(SCOPE, name);
    spec.setTemplate(template);
    return spec;
  }

  public static ProcessRun run(String name, EntityRef spec) {
    ProcessRun run = new ProcessRun(name);
    run.addUid(SCOPE, name);
    run.setSpec(spec);
    return run;
  }

  /**
   * Builds a linear provenance chain of ten objects: one template, four specs
   * and five runs, each referencing the one before it.
   */
  public static List<BaseEntity> linearChain() {
    List<BaseEntity> chain = new ArrayList<>();
    BaseEntity previous = template("t0");
    chain.add(previous);
    for (int i = 1; i < 10; i++) {
      previous = i < 5 ? spec("s" + i, previous) : run("r" + i, previous);
      chain.add(previous);
    }
    return chain;
  }

  /**
   * Returns every object in the batches, each counted once.
   */
  public static Set<BaseEntity> members(List<List<BaseEntity>> batches) {
    Set<BaseEntity> members = Collections.newSetFromMap(new IdentityHashMap<>());
    for (List<BaseEntity> batch : batches) {
      members.addAll(batch);
    }
    return members;
  }

  /**
   * Counts the batches an object appears in.
   */
  public static int occurrences(List<List<BaseEntity>> batches, BaseEntity entity) {
    int count = 0;
    for (List<BaseEntity> batch : batches) {
      for (BaseEntity member : batch) {
        if (member == entity) {
          count++;
        }
      }
    }
    return count;
  }

  /**
   * Returns the full objects an object references directly.
   */
  public static List<BaseEntity> referenced(BaseEntity entity) {
    List<BaseEntity> referenced = new ArrayList<>();
    for (EntityRef ref : entity.dependencies()) {
      if (ref instanceof BaseEntity) {
        referenced.add((BaseEntity) ref);
      }
    }
    return referenced;
  }

  public static boolean containsSame(List<BaseEntity> batch, BaseEntity entity) {
    for (BaseEntity member : batch) {
      if (member == entity) {
        return true;
      }
    }
    return false;
  }
}
