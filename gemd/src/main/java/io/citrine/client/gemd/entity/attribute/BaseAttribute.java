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

package io.citrine.client.gemd.entity.attribute;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import io.citrine.client.gemd.entity.EntityRef;

/**
 * BaseAttribute is a named value attached to a spec or run, optionally bound to
 * an attribute template.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = "type", allowGetters = true)
public abstract class BaseAttribute {

  @JsonProperty("name")
  private String name;

  @JsonProperty("value")
  private JsonNode value;

  @JsonProperty("template")
  private EntityRef template;

  @JsonProperty("origin")
  private String origin = "unknown";

  @JsonProperty("notes")
  private String notes;

  protected BaseAttribute() {
  }

  protected BaseAttribute(String name, JsonNode value, EntityRef template) {
    this.name = name;
    this.value = value;
    this.template = template;
  }

  /**
   * Returns the wire type of this attribute.
   *
   * @return the type string
   */
  @JsonProperty("type")
  public abstract String getTypeName();

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public JsonNode getValue() {
    return value;
  }

  public void setValue(JsonNode value) {
    this.value = value;
  }

  public EntityRef getTemplate() {
    return template;
  }

  public void setTemplate(EntityRef template) {
    this.template = template;
  }

  public String getOrigin() {
    return origin;
  }

  public void setOrigin(String origin) {
    this.origin = origin;
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }
}
