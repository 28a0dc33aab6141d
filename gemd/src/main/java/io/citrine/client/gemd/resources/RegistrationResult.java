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

package io.citrine.client.gemd.resources;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import io.citrine.client.gemd.entity.BaseEntity;

/**
 * The outcome of a registration: the objects the platform returned and, for
 * each object that was submitted, its server version.
 *
 * <p>
 * The submitted objects are left as they are until {@link #applyUpdates()} is
 * called.
 */
public class RegistrationResult {

  private final List<BaseEntity> registered;
  private final Map<BaseEntity, BaseEntity> serverVersions;
  private final boolean dryRun;

  RegistrationResult(List<BaseEntity> registered, Map<BaseEntity, BaseEntity> serverVersions, boolean dryRun) {
    this.registered = Collections.unmodifiableList(registered);
    this.serverVersions = serverVersions;
    this.dryRun = dryRun;
  }

  /**
   * Returns the objects returned by the platform, in submission order.
   *
   * @return the registered objects
   */
  public List<BaseEntity> getRegistered() {
    return registered;
  }

  /**
   * Returns the server version of a submitted object.
   *
   * @param original
   *            a submitted object, compared by identity
   * @return the server version, or null if the object was not submitted
   */
  public BaseEntity serverVersionOf(BaseEntity original) {
    return serverVersions.get(original);
  }

  /**
   * Returns the mapping from submitted object to server version. Keys are
   * compared by identity.
   *
   * @return an unmodifiable view of the mapping
   */
  public Map<BaseEntity, BaseEntity> getServerVersions() {
    return Collections.unmodifiableMap(serverVersions);
  }

  public boolean isDryRun() {
    return dryRun;
  }

  /**
   * Merges the uids and tags of each server version into the submitted object.
   * Existing uids are overwritten by the server's; tags are added if missing.
   *
   * @throws IllegalStateException
   *             if the result comes from a dry run, whose server state is not
   *             persisted
   */
  public void applyUpdates() {
    if (dryRun) {
      throw new IllegalStateException("Cannot apply the updates of a dry run");
    }
    for (Map.Entry<BaseEntity, BaseEntity> entry : serverVersions.entrySet()) {
      BaseEntity original = entry.getKey();
      BaseEntity server = entry.getValue();
      if (original == server) {
        continue;
      }
      for (Map.Entry<String, String> uid : server.getUids().entrySet()) {
        original.addUid(uid.getKey(), uid.getValue());
      }
      for (String tag : server.getTags()) {
        if (!original.getTags().contains(tag)) {
          original.getTags().add(tag);
        }
      }
    }
  }

  static RegistrationResult empty(boolean dryRun) {
    return new RegistrationResult(Collections.emptyList(), new IdentityHashMap<>(), dryRun);
  }
}
