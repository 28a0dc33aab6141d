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

package io.citrine.client.gemd.entity.object;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import io.citrine.client.gemd.entity.EntityRef;
import io.citrine.client.gemd.entity.EntityType;

/**
 * A material run as it was actually used as an input to a process run.
 */
@JsonTypeName("ingredient_run")
public class IngredientRun extends BaseObject {

  @JsonProperty("spec")
  private EntityRef spec;

  @JsonProperty("material")
  private EntityRef material;

  @JsonProperty("process")
  private EntityRef process;

  public IngredientRun() {
  }

  public IngredientRun(String name) {
    super(name);
  }

  @Override
  public EntityType getType() {
    return EntityType.INGREDIENT_RUN;
  }

  @Override
  public List<EntityRef> dependencies() {
    List<EntityRef> dependencies = new ArrayList<>();
    addIfPresent(dependencies, spec);
    addIfPresent(dependencies, material);
    addIfPresent(dependencies, process);
    return dependencies;
  }

  public EntityRef getSpec() {
    return spec;
  }

  public void setSpec(EntityRef spec) {
    this.spec = spec;
  }

  public EntityRef getMaterial() {
    return material;
  }

  public void setMaterial(EntityRef material) {
    this.material = material;
  }

  public EntityRef getProcess() {
    return process;
  }

  public void setProcess(EntityRef process) {
    this.process = process;
  }
}
