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

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import io.citrine.client.gemd.entity.object.IngredientRun;
import io.citrine.client.gemd.entity.object.IngredientSpec;
import io.citrine.client.gemd.entity.object.MaterialRun;
import io.citrine.client.gemd.entity.object.MaterialSpec;
import io.citrine.client.gemd.entity.object.MeasurementRun;
import io.citrine.client.gemd.entity.object.MeasurementSpec;
import io.citrine.client.gemd.entity.object.ProcessRun;
import io.citrine.client.gemd.entity.object.ProcessSpec;
import io.citrine.client.gemd.entity.template.ConditionTemplate;
import io.citrine.client.gemd.entity.template.MaterialTemplate;
import io.citrine.client.gemd.entity.template.MeasurementTemplate;
import io.citrine.client.gemd.entity.template.ParameterTemplate;
import io.citrine.client.gemd.entity.template.ProcessTemplate;
import io.citrine.client.gemd.entity.template.PropertyTemplate;

/**
 * EntityRef is anything that can stand in a reference field of a GEMD object:
 * either the full object or a {@link LinkByUid} pointing at it.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({@JsonSubTypes.Type(value = LinkByUid.class, name = "link_by_uid"),
    @JsonSubTypes.Type(value = ConditionTemplate.class, name = "condition_template"),
    @JsonSubTypes.Type(value = ParameterTemplate.class, name = "parameter_template"),
    @JsonSubTypes.Type(value = PropertyTemplate.class, name = "property_template"),
    @JsonSubTypes.Type(value = MaterialTemplate.class, name = "material_template"),
    @JsonSubTypes.Type(value = MeasurementTemplate.class, name = "measurement_template"),
    @JsonSubTypes.Type(value = ProcessTemplate.class, name = "process_template"),
    @JsonSubTypes.Type(value = ProcessSpec.class, name = "process_spec"),
    @JsonSubTypes.Type(value = MaterialSpec.class, name = "material_spec"),
    @JsonSubTypes.Type(value = MeasurementSpec.class, name = "measurement_spec"),
    @JsonSubTypes.Type(value = IngredientSpec.class, name = "ingredient_spec"),
    @JsonSubTypes.Type(value = ProcessRun.class, name = "process_run"),
    @JsonSubTypes.Type(value = MaterialRun.class, name = "material_run"),
    @JsonSubTypes.Type(value = MeasurementRun.class, name = "measurement_run"),
    @JsonSubTypes.Type(value = IngredientRun.class, name = "ingredient_run")})
public interface EntityRef {

  /**
   * Returns a link to the referenced object.
   *
   * @return the link
   * @throws IllegalStateException
   *             if the reference is an object without any uid
   */
  LinkByUid toLink();
}
