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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.citrine.client.core.jobs.JobStatus;
import io.citrine.client.core.jobs.JobSubmissionResponse;

/**
 * HttpTransport implements {@link Transport} on top of a {@link Session},
 * scoped to one team.
 */
public class HttpTransport implements Transport {

  private static final Logger logger = LoggerFactory.getLogger(HttpTransport.class);

  private final Session session;
  private final UUID teamId;

  /**
   * Creates a new HttpTransport.
   *
   * @param session
   *            the HTTP session
   * @param teamId
   *            the team whose job-status endpoint is polled
   */
  public HttpTransport(Session session, UUID teamId) {
    if (session == null) {
      throw new IllegalArgumentException("session is required");
    }
    if (teamId == null) {
      throw new IllegalArgumentException("teamId is required");
    }
    this.session = session;
    this.teamId = teamId;
  }

  @Override
  public JsonNode submitBatch(String path, List<? extends JsonNode> objects, Map<String, String> params) {
    ObjectNode body = JsonUtils.getObjectMapper().createObjectNode();
    ArrayNode array = body.putArray("objects");
    array.addAll(objects);
    logger.debug("Submitting {} objects to {}", objects.size(), path);
    return session.putResource(path, body, params);
  }

  @Override
  public UUID submitDelete(String path, Object body) {
    JsonNode response = session.postResource(path, body, Map.of());
    JobSubmissionResponse submission = JsonUtils.fromJsonNode(response, JobSubmissionResponse.class);
    if (submission == null || submission.getJobId() == null) {
      throw new CitrineException("Deletion request to " + path + " did not return a job id");
    }
    logger.info("Submitted deletion job {}", submission.getJobId());
    return submission.getJobId();
  }

  @Override
  public JobStatus pollJobStatus(UUID jobId) {
    String path = "teams/" + teamId + "/execution/job-status";
    JsonNode response = session.getResource(path, Map.of("job_id", jobId.toString()));
    return JsonUtils.fromJsonNode(response, JobStatus.class);
  }

  public UUID getTeamId() {
    return teamId;
  }
}
