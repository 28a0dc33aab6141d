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

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.JsonNode;

import io.citrine.client.gemd.entity.EntityRef;

/**
 * Binds an attribute template to an object template, optionally narrowing its
 * bounds. Serialized as a two element array {@code [template, bounds]}.
 */
@JsonFormat(shape = JsonFormat.Shape.ARRAY)
@JsonPropertyOrder({"template", "bounds"})
public class AttributeBinding {

  @JsonProperty("template")
  private EntityRef template;

  @JsonProperty("bounds")
  private JsonNode bounds;

  public AttributeBinding() {
  }

  public AttributeBinding(EntityRef template) {
    this(template, null);
  }

  public AttributeBinding(EntityRef template, JsonNode bounds) {
    this.template = template;
    this.bounds = bounds;
  }

  public EntityRef getTemplate() {
    return template;
  }

  public void setTemplate(EntityRef template) {
    this.template = template;
  }

  public JsonNode getBounds() {
    return bounds;
  }

  public void setBounds(JsonNode bounds) {
    this.bounds = bounds;
  }
}
