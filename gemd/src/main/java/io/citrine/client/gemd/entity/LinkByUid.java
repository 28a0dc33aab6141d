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

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * LinkByUid is a lightweight reference to a GEMD object: a (scope, id) pair.
 * Two links are equal iff scope and id match.
 */
@JsonTypeName("link_by_uid")
@JsonPropertyOrder({"scope", "id"})
public final class LinkByUid implements EntityRef {

  private final String scope;
  private final String id;

  /**
   * Creates a new LinkByUid.
   *
   * @param scope
   *            the uid scope
   * @param id
   *            the id within the scope
   */
  @JsonCreator
  public LinkByUid(@JsonProperty("scope") String scope, @JsonProperty("id") String id) {
    if (scope == null || scope.isEmpty()) {
      throw new IllegalArgumentException("scope is required");
    }
    if (id == null || id.isEmpty()) {
      throw new IllegalArgumentException("id is required");
    }
    this.scope = scope;
    this.id = id;
  }

  /**
   * Creates a link to an object in the given scope.
   *
   * @param entity
   *            the object
   * @param scope
   *            the scope to link by
   * @return the link
   * @throws IllegalArgumentException
   *             if the object has no uid in that scope
   */
  public static LinkByUid fromEntity(BaseEntity entity, String scope) {
    String id = entity.getUids().get(scope);
    if (id == null) {
      throw new IllegalArgumentException(entity + " has no uid in scope " + scope);
    }
    return new LinkByUid(scope, id);
  }

  @JsonProperty("scope")
  public String getScope() {
    return scope;
  }

  @JsonProperty("id")
  public String getId() {
    return id;
  }

  @Override
  public LinkByUid toLink() {
    return this;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LinkByUid)) {
      return false;
    }
    LinkByUid that = (LinkByUid) o;
    return scope.equals(that.scope) && id.equals(that.id);
  }

  @Override
  public int hashCode() {
    return Objects.hash(scope, id);
  }

  @Override
  public String toString() {
    return "LinkByUid(" + scope + ", " + id + ")";
  }
}
