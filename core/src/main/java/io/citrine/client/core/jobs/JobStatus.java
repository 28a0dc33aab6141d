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
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * JobStatus summarizes the state of an asynchronous platform job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class JobStatus {

  public static final String SUCCESS = "Success";
  public static final String FAILURE = "Failure";
  public static final String RUNNING = "Running";

  @JsonProperty("job_type")
  private String jobType;

  @JsonProperty("status")
  private String status;

  @JsonProperty("tasks")
  private List<TaskNode> tasks = new ArrayList<>();

  @JsonProperty("output")
  private Map<String, String> output = new HashMap<>();

  public JobStatus() {
  }

  public JobStatus(String status) {
    this.status = status;
  }

  /**
   * Whether the job has reached a terminal state.
   *
   * @return true for "Success" or "Failure"
   */
  @JsonIgnore
  public boolean isTerminal() {
    return SUCCESS.equals(status) || FAILURE.equals(status);
  }

  public String getJobType() {
    return jobType;
  }

  public void setJobType(String jobType) {
    this.jobType = jobType;
  }

  public String getStatus() {
    return status;
  }

  public void setStatus(String status) {
    this.status = status;
  }

  public List<TaskNode> getTasks() {
    return tasks;
  }

  public void setTasks(List<TaskNode> tasks) {
    this.tasks = tasks != null ? tasks : new ArrayList<>();
  }

  public Map<String, String> getOutput() {
    return output;
  }

  public void setOutput(Map<String, String> output) {
    this.output = output;
  }

  @Override
  public String toString() {
    return "JobStatus{jobType='" + jobType + "', status='" + status + "', tasks=" + tasks.size() + "}";
  }
}
