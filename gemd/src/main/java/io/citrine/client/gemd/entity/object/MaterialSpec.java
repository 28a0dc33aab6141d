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
import io.citrine.client.gemd.entity.attribute.PropertyAndConditions;

/**
 * The intended material produced by a process spec.
 */
@JsonTypeName("material_spec")
public class MaterialSpec extends BaseObject {

  @JsonProperty("template")
  private EntityRef template;

  @JsonProperty("process")
  private EntityRef process;

  @JsonProperty("properties")
  private List<PropertyAndConditions> properties = new ArrayList<>();

  public MaterialSpec() {
  }

  public MaterialSpec(String name) {
    super(name);
  }

  @Override
  public EntityType getType() {
    return EntityType.MATERIAL_SPEC;
  }

  @Override
  public List<EntityRef> dependencies() {
    List<EntityRef> dependencies = new ArrayList<>();
    addMaterialProperties(dependencies);
    addIfPresent(dependencies, template);
    addIfPresent(dependencies, process);
    return dependencies;
  }

  private void addMaterialProperties(List<EntityRef> dependencies) {
    if (properties == null) {
      return;
    }
    for (PropertyAndConditions entry : properties) {
      if (entry == null) {
        continue;
      }
      if (entry.getProperty() != null) {
        addIfPresent(dependencies, entry.getProperty().getTemplate());
      }
      addAttributeTemplates(dependencies, entry.getConditions());
    }
  }

  public EntityRef getTemplate() {
    return template;
  }

  public void setTemplate(EntityRef template) {
    this.template = template;
  }

  public EntityRef getProcess() {
    return process;
  }

  public void setProcess(EntityRef process) {
    this.process = process;
  }

  public List<PropertyAndConditions> getProperties() {
    return properties;
  }

  public void setProperties(List<PropertyAndConditions> properties) {
    this.properties = properties;
  }
}
