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

import com.fasterxml.jackson.databind.JsonNode;

import io.citrine.client.gemd.entity.EntityRef;

/**
 * A property of a material, process or measurement.
 */
public class Property extends BaseAttribute {

  public Property() {
  }

  public Property(String name, JsonNode value, EntityRef template) {
    super(name, value, template);
  }

  @Override
  public String getTypeName() {
    return "property";
  }
}
