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

import com.fasterxml.jackson.annotation.JsonProperty;

import io.citrine.client.gemd.entity.BaseEntity;

/**
 * ObjectTemplate is the common parent of material, measurement and process
 * templates.
 */
public abstract class ObjectTemplate extends BaseEntity {

  @JsonProperty("description")
  private String description;

  protected ObjectTemplate() {
  }

  protected ObjectTemplate(String name) {
    super(name);
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }
}
