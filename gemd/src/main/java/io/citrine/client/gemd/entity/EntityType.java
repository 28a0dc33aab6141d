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

package io.citrine.client.gemd.entity;

import java.util.Comparator;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * EntityType is the discriminator of every GEMD data object, serialized as its
 * {@code "type"} field.
 *
 * <p>
 * Constants are declared in writable order: every type only references types
 * declared before it, so writing objects in this order never references an
 * object that has not been written yet.
 */
public enum EntityType {
  CONDITION_TEMPLATE("condition_template"),
  PARAMETER_TEMPLATE("parameter_template"),
  PROPERTY_TEMPLATE("property_template"),
  MATERIAL_TEMPLATE("material_template"),
  MEASUREMENT_TEMPLATE("measurement_template"),
  PROCESS_TEMPLATE("process_template"),
  PROCESS_SPEC("process_spec"),
  MATERIAL_SPEC("material_spec"),
  MEASUREMENT_SPEC("measurement_spec"),
  INGREDIENT_SPEC("ingredient_spec"),
  PROCESS_RUN("process_run"),
  MATERIAL_RUN("material_run"),
  MEASUREMENT_RUN("measurement_run"),
  INGREDIENT_RUN("ingredient_run");

  private static final Comparator<EntityType> WRITABLE_ORDER = Comparator.comparingInt(EntityType::ordinal);

  private final String value;

  EntityType(String value) {
    this.value = value;
  }

  /**
   * Returns the wire name of the type.
   *
   * @return the type string
   */
  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Returns the default priority of this type when writing; lower writes first.
   *
   * @return the priority
   */
  public int writablePriority() {
    return ordinal();
  }

  /**
   * Returns the default writable order over types.
   *
   * @return the comparator
   */
  public static Comparator<EntityType> writableOrder() {
    return WRITABLE_ORDER;
  }

  @JsonCreator
  public static EntityType fromValue(String value) {
    for (EntityType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown entity type: " + value);
  }

  @Override
  public String toString() {
    return value;
  }
}
