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

/**
 * Options for {@link GemdResourceCollection#registerAll(java.util.List, RegistrationOptions)}.
 */
public class RegistrationOptions {

  /** Batch size used when none is configured. */
  public static final int DEFAULT_BATCH_SIZE = 50;

  private final boolean dryRun;
  private final boolean includeNested;
  private final int batchSize;

  private RegistrationOptions(Builder builder) {
    this.dryRun = builder.dryRun;
    this.includeNested = builder.includeNested;
    this.batchSize = builder.batchSize;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the default options: a real write of the given objects only, in
   * batches of {@value #DEFAULT_BATCH_SIZE}.
   *
   * @return the default options
   */
  public static RegistrationOptions defaults() {
    return builder().build();
  }

  /**
   * Whether the platform only validates the objects without storing them.
   *
   * @return true for a dry run
   */
  public boolean isDryRun() {
    return dryRun;
  }

  /**
   * Whether every object reachable from the given ones is registered too.
   *
   * @return true to include nested objects
   */
  public boolean isIncludeNested() {
    return includeNested;
  }

  public int getBatchSize() {
    return batchSize;
  }

  /**
   * Builder for RegistrationOptions.
   */
  public static class Builder {
    private boolean dryRun = false;
    private boolean includeNested = false;
    private int batchSize = DEFAULT_BATCH_SIZE;

    public Builder dryRun(boolean dryRun) {
      this.dryRun = dryRun;
      return this;
    }

    public Builder includeNested(boolean includeNested) {
      this.includeNested = includeNested;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public RegistrationOptions build() {
      if (batchSize < 1) {
        throw new IllegalStateException("batchSize must be at least 1 but was " + batchSize);
      }
      return new RegistrationOptions(this);
    }
  }
}
