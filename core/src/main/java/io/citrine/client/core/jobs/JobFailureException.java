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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

import io.citrine.client.core.NonRetryableException;

/**
 * A job terminated with "Failure" status.
 */
public class JobFailureException extends NonRetryableException {

  private final UUID jobId;
  private final List<String> failureReasons;

  public JobFailureException(UUID jobId, List<String> failureReasons) {
    super("Job " + jobId + " terminated with Failure status. Failure reasons: " + failureReasons);
    this.jobId = jobId;
    this.failureReasons = Collections.unmodifiableList(new ArrayList<>(failureReasons));
  }

  public UUID getJobId() {
    return jobId;
  }

  public List<String> getFailureReasons() {
    return failureReasons;
  }
}
