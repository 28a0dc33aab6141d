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

package io.citrine.client.gemd.entity.template;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import io.citrine.client.gemd.entity.EntityRef;
import io.citrine.client.gemd.entity.EntityType;

/**
 * Template for materials, binding the property templates a material may carry.
 */
@JsonTypeName("material_template")
public class MaterialTemplate extends ObjectTemplate {

  @JsonProperty("properties")
  private List<AttributeBinding> properties = new ArrayList<>();

  public MaterialTemplate() {
  }

  public MaterialTemplate(String name) {
    super(name);
  }

  @Override
  public EntityType getType() {
    return EntityType.MATERIAL_TEMPLATE;
  }

  @Override
  public List<EntityRef> dependencies() {
    List<EntityRef> dependencies = new ArrayList<>();
    addBoundTemplates(dependencies, properties);
    return dependencies;
  }

  public List<AttributeBinding> getProperties() {
    return properties;
  }

  public void setProperties(List<AttributeBinding> properties) {
    this.properties = properties;
  }
}
