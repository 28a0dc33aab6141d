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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.citrine.client.gemd.entity.attribute.BaseAttribute;
import io.citrine.client.gemd.entity.template.AttributeBinding;
import io.citrine.client.gemd.json.GemdJson;

/**
 * BaseEntity is the root of every GEMD data object: templates, specs and runs.
 *
 * <p>
 * An entity is identified by its uids, a map from scope to id. Two entities
 * sharing any (scope, id) pair describe the same logical object. Entities use
 * identity equality; use {@link #contentEquals(BaseEntity)} to compare values.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public abstract class BaseEntity implements EntityRef {

  /** The scope of platform-assigned ids. */
  public static final String CITRINE_SCOPE = "id";

  @JsonProperty("uids")
  private Map<String, String> uids;

  @JsonProperty("tags")
  private List<String> tags;

  @JsonProperty("name")
  private String name;

  protected BaseEntity() {
    this.uids = new LinkedHashMap<>();
    this.tags = new ArrayList<>();
  }

  protected BaseEntity(String name) {
    this();
    this.name = name;
  }

  /**
   * Returns the type of this entity.
   *
   * @return the entity type
   */
  @JsonIgnore
  public abstract EntityType getType();

  /**
   * Returns the objects this entity directly references. Each element is either
   * a full entity or a {@link LinkByUid}.
   *
   * @return the shallow dependencies
   */
  public abstract List<EntityRef> dependencies();

  /**
   * Returns the identity keys of this entity, one link per uid.
   *
   * @return the identity keys, in uid insertion order
   */
  public Set<LinkByUid> identityKeys() {
    Set<LinkByUid> keys = new LinkedHashSet<>();
    for (Map.Entry<String, String> uid : uids.entrySet()) {
      keys.add(new LinkByUid(uid.getKey(), uid.getValue()));
    }
    return keys;
  }

  /**
   * Adds or replaces the uid for a scope.
   *
   * @param scope
   *            the scope
   * @param id
   *            the id
   */
  public void addUid(String scope, String id) {
    uids.put(scope, id);
  }

  /**
   * Removes the uid for a scope.
   *
   * @param scope
   *            the scope
   * @return the removed id, or null if there was none
   */
  public String removeUid(String scope) {
    return uids.remove(scope);
  }

  /**
   * Returns a link to this entity, preferring the platform scope.
   *
   * @return the link
   * @throws IllegalStateException
   *             if the entity has no uids
   */
  @Override
  public LinkByUid toLink() {
    if (uids.isEmpty()) {
      throw new IllegalStateException(this + " has no uids and cannot be linked");
    }
    if (uids.containsKey(CITRINE_SCOPE)) {
      return new LinkByUid(CITRINE_SCOPE, uids.get(CITRINE_SCOPE));
    }
    Map.Entry<String, String> first = uids.entrySet().iterator().next();
    return new LinkByUid(first.getKey(), first.getValue());
  }

  /**
   * Compares two entities by value. Both are serialized with nested objects
   * replaced by links; uids are ignored except that a scope present on both
   * must map to the same id.
   *
   * @param other
   *            the entity to compare with
   * @return true if the two entities carry the same content
   */
  public boolean contentEquals(BaseEntity other) {
    if (other == this) {
      return true;
    }
    if (other == null || other.getType() != getType()) {
      return false;
    }
    for (Map.Entry<String, String> uid : uids.entrySet()) {
      String otherId = other.uids.get(uid.getKey());
      if (otherId != null && !otherId.equals(uid.getValue())) {
        return false;
      }
    }
    ObjectNode mine = GemdJson.toWire(this);
    ObjectNode theirs = GemdJson.toWire(other);
    mine.remove("uids");
    theirs.remove("uids");
    return mine.equals(theirs);
  }

  protected static void addIfPresent(List<EntityRef> dependencies, EntityRef ref) {
    if (ref != null) {
      dependencies.add(ref);
    }
  }

  protected static void addAttributeTemplates(List<EntityRef> dependencies,
      List<? extends BaseAttribute> attributes) {
    if (attributes == null) {
      return;
    }
    for (BaseAttribute attribute : attributes) {
      if (attribute != null) {
        addIfPresent(dependencies, attribute.getTemplate());
      }
    }
  }

  protected static void addBoundTemplates(List<EntityRef> dependencies, List<AttributeBinding> bindings) {
    if (bindings == null) {
      return;
    }
    for (AttributeBinding binding : bindings) {
      if (binding != null) {
        addIfPresent(dependencies, binding.getTemplate());
      }
    }
  }

  // Getters and setters

  public Map<String, String> getUids() {
    return uids;
  }

  public void setUids(Map<String, String> uids) {
    this.uids = uids != null ? new LinkedHashMap<>(uids) : new LinkedHashMap<>();
  }

  public List<String> getTags() {
    return tags;
  }

  public void setTags(List<String> tags) {
    this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
  }

  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + "{name='" + name + "', uids=" + uids + "}";
  }
}
