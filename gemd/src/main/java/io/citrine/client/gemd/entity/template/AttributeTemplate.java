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

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.EntityRef;

/**
 * AttributeTemplate constrains the values of conditions, parameters or
 * properties. Attribute templates reference nothing.
 */
public abstract class AttributeTemplate extends BaseEntity {

  @JsonProperty("description")
  private String description;

  @JsonProperty("bounds")
  private JsonNode bounds;

  protected AttributeTemplate() {
  }

  protected AttributeTemplate(String name, JsonNode bounds) {
    super(name);
    this.bounds = bounds;
  }

  @Override
  public List<EntityRef> dependencies() {
    return Collections.emptyList();
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public JsonNode getBounds() {
    return bounds;
  }

  public void setBounds(JsonNode bounds) {
    this.bounds = bounds;
  }
}
