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

package io.citrine.client.core;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.fasterxml.jackson.databind.JsonNode;

import io.citrine.client.core.jobs.JobStatus;

/**
 * Transport is the set of network calls the bulk registration and deletion
 * operations are built on. Every call blocks until the platform has answered.
 * Failures surface as {@link RetryableException} or
 * {@link NonRetryableException}; no call is retried here.
 */
public interface Transport {

  /**
   * Writes one batch of serialized objects.
   *
   * @param path
   *            the batch endpoint path
   * @param objects
   *            the serialized objects, nested objects already replaced by links
   * @param params
   *            query parameters such as {@code dry_run}
   * @return the response body
   */
  JsonNode submitBatch(String path, List<? extends JsonNode> objects, Map<String, String> params);

  /**
   * Starts an asynchronous deletion job.
   *
   * @param path
   *            the deletion endpoint path
   * @param body
   *            the deletion request body
   * @return the id of the submitted job
   */
  UUID submitDelete(String path, Object body);

  /**
   * Fetches the current status of a job.
   *
   * @param jobId
   *            the job id
   * @return the job status
   */
  JobStatus pollJobStatus(UUID jobId);
}
