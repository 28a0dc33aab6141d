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

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.citrine.client.core.Transport;

/**
 * Unit tests for JobPoller.
 */
@ExtendWith(MockitoExtension.class)
class JobPollerTest {

  private static final Duration TIMEOUT = Duration.ofSeconds(5);
  private static final Duration NO_DELAY = Duration.ZERO;

  @Mock
  private Transport transport;

  private JobPoller poller;
  private UUID jobId;

  @BeforeEach
  void setUp() {
    poller = new JobPoller(transport);
    jobId = UUID.randomUUID();
  }

  @Test
  void testPollsUntilTerminal() {
    when(transport.pollJobStatus(jobId)).thenReturn(new JobStatus(JobStatus.RUNNING),
        new JobStatus(JobStatus.RUNNING), new JobStatus(JobStatus.SUCCESS));

    JobStatus status = poller.poll(jobId, TIMEOUT, NO_DELAY, true);

    assertEquals(JobStatus.SUCCESS, status.getStatus());
    verify(transport, times(3)).pollJobStatus(jobId);
  }

  @Test
  void testTimeout() {
    when(transport.pollJobStatus(jobId)).thenReturn(new JobStatus(JobStatus.RUNNING));

    PollingTimeoutException exception = assertThrows(PollingTimeoutException.class,
        () -> poller.poll(jobId, Duration.ZERO, NO_DELAY, true));

    assertEquals(jobId, exception.getJobId());
  }

  @Test
  void testFailureRaisesWithReasons() {
    when(transport.pollJobStatus(jobId)).thenReturn(failedJob());

    JobFailureException exception = assertThrows(JobFailureException.class,
        () -> poller.poll(jobId, TIMEOUT, NO_DELAY, true));

    assertEquals(jobId, exception.getJobId());
    assertEquals(List.of("Object is referenced"), exception.getFailureReasons());
  }

  @Test
  void testFailureReturnedWhenNotRaising() {
    JobStatus failed = failedJob();
    when(transport.pollJobStatus(jobId)).thenReturn(failed);

    JobStatus status = poller.poll(jobId, TIMEOUT, NO_DELAY, false);

    assertSame(failed, status);
    assertEquals("[]", status.getOutput().get("failures"));
  }

  private static JobStatus failedJob() {
    TaskNode ok = new TaskNode();
    ok.setId("task-1");
    ok.setStatus(JobStatus.SUCCESS);
    TaskNode failed = new TaskNode();
    failed.setId("task-2");
    failed.setStatus(JobStatus.FAILURE);
    failed.setFailureReason("Object is referenced");

    JobStatus status = new JobStatus(JobStatus.FAILURE);
    status.setTasks(List.of(ok, failed));
    status.setOutput(Map.of("failures", "[]"));
    return status;
  }
}
