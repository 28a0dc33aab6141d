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

import com.fasterxml.jackson.annotation.JsonProperty;

import io.citrine.client.gemd.entity.BaseEntity;

/**
 * BaseObject is the common parent of specs and runs.
 */
public abstract class BaseObject extends BaseEntity {

  @JsonProperty("notes")
  private String notes;

  protected BaseObject() {
  }

  protected BaseObject(String name) {
    super(name);
  }

  public String getNotes() {
    return notes;
  }

  public void setNotes(String notes) {
    this.notes = notes;
  }
}
