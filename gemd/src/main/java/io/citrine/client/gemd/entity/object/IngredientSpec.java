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
 * The intended use of a material spec as an input to a process spec.
 */
@JsonTypeName("ingredient_spec")
public class IngredientSpec extends BaseObject {

  @JsonProperty("material")
  private EntityRef material;

  @JsonProperty("process")
  private EntityRef process;

  @JsonProperty("labels")
  private List<String> labels = new ArrayList<>();

  public IngredientSpec() {
  }

  public IngredientSpec(String name) {
    super(name);
  }

  @Override
  public EntityType getType() {
    return EntityType.INGREDIENT_SPEC;
  }

  @Override
  public List<EntityRef> dependencies() {
    List<EntityRef> dependencies = new ArrayList<>();
    addIfPresent(dependencies, material);
    addIfPresent(dependencies, process);
    return dependencies;
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

  public List<String> getLabels() {
    return labels;
  }

  public void setLabels(List<String> labels) {
    this.labels = labels;
  }
}
