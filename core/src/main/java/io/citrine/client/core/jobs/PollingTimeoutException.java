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

package io.citrine.client.core.jobs;

import java.util.UUID;

import io.citrine.client.core.CitrineException;

/**
 * A job did not reach a terminal state before the caller's timeout. The job on
 * the platform is unaffected.
 */
public class PollingTimeoutException extends CitrineException {

  private final UUID jobId;

  public PollingTimeoutException(UUID jobId) {
    super("Job " + jobId + " timed out.");
    this.jobId = jobId;
  }

  public UUID getJobId() {
    return jobId;
  }
}
