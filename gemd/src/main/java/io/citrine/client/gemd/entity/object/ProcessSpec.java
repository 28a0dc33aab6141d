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
import io.citrine.client.gemd.entity.attribute.Condition;
import io.citrine.client.gemd.entity.attribute.Parameter;

/**
 * The intended procedure of a process.
 */
@JsonTypeName("process_spec")
public class ProcessSpec extends BaseObject {

  @JsonProperty("template")
  private EntityRef template;

  @JsonProperty("conditions")
  private List<Condition> conditions = new ArrayList<>();

  @JsonProperty("parameters")
  private List<Parameter> parameters = new ArrayList<>();

  public ProcessSpec() {
  }

  public ProcessSpec(String name) {
    super(name);
  }

  @Override
  public EntityType getType() {
    return EntityType.PROCESS_SPEC;
  }

  @Override
  public List<EntityRef> dependencies() {
    List<EntityRef> dependencies = new ArrayList<>();
    addAttributeTemplates(dependencies, conditions);
    addAttributeTemplates(dependencies, parameters);
    addIfPresent(dependencies, template);
    return dependencies;
  }

  public EntityRef getTemplate() {
    return template;
  }

  public void setTemplate(EntityRef template) {
    this.template = template;
  }

  public List<Condition> getConditions() {
    return conditions;
  }

  public void setConditions(List<Condition> conditions) {
    this.conditions = conditions;
  }

  public List<Parameter> getParameters() {
    return parameters;
  }

  public void setParameters(List<Parameter> parameters) {
    this.parameters = parameters;
  }
}
