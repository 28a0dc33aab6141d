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
 * Template for processes, binding condition and parameter templates.
 */
@JsonTypeName("process_template")
public class ProcessTemplate extends ObjectTemplate {

  @JsonProperty("conditions")
  private List<AttributeBinding> conditions = new ArrayList<>();

  @JsonProperty("parameters")
  private List<AttributeBinding> parameters = new ArrayList<>();

  @JsonProperty("allowed_names")
  private List<String> allowedNames;

  @JsonProperty("allowed_labels")
  private List<String> allowedLabels;

  public ProcessTemplate() {
  }

  public ProcessTemplate(String name) {
    super(name);
  }

  @Override
  public EntityType getType() {
    return EntityType.PROCESS_TEMPLATE;
  }

  @Override
  public List<EntityRef> dependencies() {
    List<EntityRef> dependencies = new ArrayList<>();
    addBoundTemplates(dependencies, conditions);
    addBoundTemplates(dependencies, parameters);
    return dependencies;
  }

  public List<AttributeBinding> getConditions() {
    return conditions;
  }

  public void setConditions(List<AttributeBinding> conditions) {
    this.conditions = conditions;
  }

  public List<AttributeBinding> getParameters() {
    return parameters;
  }

  public void setParameters(List<AttributeBinding> parameters) {
    this.parameters = parameters;
  }

  public List<String> getAllowedNames() {
    return allowedNames;
  }

  public void setAllowedNames(List<String> allowedNames) {
    this.allowedNames = allowedNames;
  }

  public List<String> getAllowedLabels() {
    return allowedLabels;
  }

  public void setAllowedLabels(List<String> allowedLabels) {
    this.allowedLabels = allowedLabels;
  }
}
