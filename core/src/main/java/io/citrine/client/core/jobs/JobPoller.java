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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.citrine.client.core.CitrineException;
import io.citrine.client.core.Transport;

/**
 * JobPoller waits for an asynchronous platform job to finish.
 */
public class JobPoller {

  private static final Logger logger = LoggerFactory.getLogger(JobPoller.class);

  private final Transport transport;

  /**
   * Creates a new JobPoller.
   *
   * @param transport
   *            the transport used to fetch job status
   */
  public JobPoller(Transport transport) {
    this.transport = transport;
  }

  /**
   * Polls until the job reaches "Success" or "Failure", or the timeout elapses.
   *
   * @param jobId
   *            the job to wait for
   * @param timeout
   *            how long to wait before giving up; the job on the platform is
   *            unaffected
   * @param pollingDelay
   *            delay between status requests
   * @param raiseErrors
   *            whether a "Failure" job raises {@link JobFailureException}
   * @return the terminal job status
   * @throws PollingTimeoutException
   *             if the job is still running when the timeout elapses
   */
  public JobStatus poll(UUID jobId, Duration timeout, Duration pollingDelay, boolean raiseErrors) {
    long start = System.nanoTime();
    JobStatus status;
    while (true) {
      status = transport.pollJobStatus(jobId);
      if (status.isTerminal()) {
        break;
      }
      if (System.nanoTime() - start < timeout.toNanos()) {
        logger.info("Job {} still in progress, polling status again in {} ms", jobId, pollingDelay.toMillis());
        sleep(pollingDelay);
      } else {
        logger.error("Job {} exceeded user timeout of {} seconds. Note job on server is unaffected by this timeout.",
            jobId, timeout.toSeconds());
        logger.debug("Last status: {}", status);
        throw new PollingTimeoutException(jobId);
      }
    }

    if (JobStatus.FAILURE.equals(status.getStatus())) {
      logger.debug("Job {} terminated with Failure status: {}", jobId, status);
      if (raiseErrors) {
        List<String> reasons = new ArrayList<>();
        for (TaskNode task : status.getTasks()) {
          if (JobStatus.FAILURE.equals(task.getStatus())) {
            logger.error("Task {} failed with reason \"{}\"", task.getId(), task.getFailureReason());
            reasons.add(task.getFailureReason());
          }
        }
        throw new JobFailureException(jobId, reasons);
      }
    }
    return status;
  }

  private static void sleep(Duration delay) {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new CitrineException("Interrupted while polling for job completion", e);
    }
  }
}
