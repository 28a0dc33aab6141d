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

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.citrine.client.core.CitrineException;
import io.citrine.client.core.JsonUtils;
import io.citrine.client.core.Transport;
import io.citrine.client.core.jobs.JobPoller;
import io.citrine.client.core.jobs.JobStatus;
import io.citrine.client.core.tracing.Tracer;
import io.citrine.client.gemd.batch.Batcher;
import io.citrine.client.gemd.batch.IdentityIndex;
import io.citrine.client.gemd.entity.BaseEntity;
import io.citrine.client.gemd.entity.LinkByUid;
import io.citrine.client.gemd.json.GemdJson;
import io.citrine.client.gemd.util.Flattener;

/**
 * GemdResourceCollection registers and deletes GEMD objects of one dataset in
 * bulk.
 *
 * <p>
 * Registration splits the objects into batches and writes them one at a time.
 * Real writes use {@link Batcher#byType()} so that every batch only references
 * objects already written; dry runs use {@link Batcher#byDependency()} since
 * nothing is stored between batches and each batch must validate on its own.
 */
public class GemdResourceCollection {

  private static final Logger logger = LoggerFactory.getLogger(GemdResourceCollection.class);

  /** Default time to wait for a deletion job. */
  public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(2);

  /** Default delay between job status requests. */
  public static final Duration DEFAULT_POLLING_DELAY = Duration.ofSeconds(1);

  private final Transport transport;
  private final UUID teamId;
  private final UUID datasetId;
  private final JobPoller jobPoller;

  /**
   * Creates a new GemdResourceCollection.
   *
   * @param transport
   *            the transport used for every call
   * @param teamId
   *            the team owning the dataset
   * @param datasetId
   *            the dataset to write into; may be null for deletion only
   */
  public GemdResourceCollection(Transport transport, UUID teamId, UUID datasetId) {
    if (transport == null) {
      throw new IllegalArgumentException("transport is required");
    }
    if (teamId == null) {
      throw new IllegalArgumentException("teamId is required");
    }
    this.transport = transport;
    this.teamId = teamId;
    this.datasetId = datasetId;
    this.jobPoller = new JobPoller(transport);
  }

  public RegistrationResult registerAll(List<? extends BaseEntity> models) {
    return registerAll(models, RegistrationOptions.defaults());
  }

  public RegistrationResult registerAll(List<? extends BaseEntity> models, boolean dryRun) {
    return registerAll(models, RegistrationOptions.builder().dryRun(dryRun).build());
  }

  public RegistrationResult registerAll(List<? extends BaseEntity> models, boolean dryRun, boolean includeNested) {
    return registerAll(models, RegistrationOptions.builder().dryRun(dryRun).includeNested(includeNested).build());
  }

  /**
   * Registers a list of objects.
   *
   * <p>
   * Every object reachable from {@code models} that has no platform id is given
   * one, in place, so that references between objects can be written as links.
   * On a dry run the ids are created in a temporary scope that is removed again
   * before this method returns, whether or not registration succeeded.
   *
   * @param models
   *            the objects to register
   * @param options
   *            registration options
   * @return the registered objects and their mapping to the inputs
   * @throws IllegalStateException
   *             if this collection has no dataset
   * @throws io.citrine.client.gemd.batch.ObjectCollisionException
   *             if two objects share a uid but differ in content
   * @throws io.citrine.client.gemd.batch.OversizedDependencyException
   *             if a dry run cannot fit an object and its dependencies in one
   *             batch
   */
  public RegistrationResult registerAll(List<? extends BaseEntity> models, RegistrationOptions options) {
    if (datasetId == null) {
      throw new IllegalStateException("Must specify a dataset in order to register a data model object.");
    }
    if (models.isEmpty()) {
      return RegistrationResult.empty(options.isDryRun());
    }

    List<BaseEntity> reachable = Flattener.flatten(models);
    List<BaseEntity> objects = options.isIncludeNested() ? reachable : new ArrayList<>(models);
    String scope = options.isDryRun() ? UUID.randomUUID().toString() : BaseEntity.CITRINE_SCOPE;
    for (BaseEntity object : reachable) {
      if (!object.getUids().containsKey(BaseEntity.CITRINE_SCOPE)) {
        object.addUid(scope, UUID.randomUUID().toString());
      }
    }

    try {
      Batcher batcher = options.isDryRun() ? Batcher.byDependency() : Batcher.byType();
      List<List<BaseEntity>> batches = batcher.batch(objects, options.getBatchSize());
      return submit(objects, batches, options.isDryRun(), options.isDryRun() ? scope : null);
    } finally {
      if (options.isDryRun()) {
        for (BaseEntity object : reachable) {
          object.removeUid(scope);
        }
      }
    }
  }

  /**
   * Registers a single object.
   *
   * @param model
   *            the object to register
   * @param dryRun
   *            whether to only validate the object
   * @param <T>
   *            the object type
   * @return the object as returned by the platform
   */
  public <T extends BaseEntity> T register(T model, boolean dryRun) {
    RegistrationResult result = registerAll(Collections.singletonList(model), dryRun);
    BaseEntity registered = result.serverVersionOf(model);
    if (registered == null) {
      throw new CitrineException("Registration of " + model + " returned no matching object");
    }
    @SuppressWarnings("unchecked")
    T typed = (T) model.getClass().cast(registered);
    return typed;
  }

  public <T extends BaseEntity> T register(T model) {
    return register(model, false);
  }

  private RegistrationResult submit(List<BaseEntity> objects, List<List<BaseEntity>> batches, boolean dryRun,
      String temporaryScope) {
    IdentityIndex index = IdentityIndex.of(objects);
    String path = "teams/" + teamId + "/datasets/" + datasetId + "/gemd/batch";
    Map<String, String> params = Map.of("dry_run", String.valueOf(dryRun));

    Map<BaseEntity, BaseEntity> byCanonical = new IdentityHashMap<>();
    List<BaseEntity> registered = new ArrayList<>();
    for (int i = 0; i < batches.size(); i++) {
      List<BaseEntity> batch = batches.get(i);
      Map<String, Object> attributes = new LinkedHashMap<>();
      attributes.put("citrine:batch", i + 1);
      attributes.put("citrine:batchCount", batches.size());
      attributes.put("citrine:batchSize", batch.size());
      attributes.put("citrine:dryRun", dryRun);
      JsonNode response = Tracer.runInSpan("gemd/batch", attributes, () -> {
        JsonNode accepted = transport.submitBatch(path, GemdJson.toWire(batch), params);
        Tracer.addEvent("gemd/batch/accepted", Map.of("objects", String.valueOf(accepted.path("objects").size())));
        return accepted;
      });
      logger.info("Submitted batch {}/{} of {} objects (dry run: {})", i + 1, batches.size(), batch.size(), dryRun);

      for (JsonNode node : response.path("objects")) {
        BaseEntity server = GemdJson.build(node);
        BaseEntity original = match(server, index);
        if (temporaryScope != null) {
          server.removeUid(temporaryScope);
        }
        if (original == null) {
          logger.warn("Platform returned {} which matches no submitted object", server);
          registered.add(server);
        } else if (!byCanonical.containsKey(original)) {
          byCanonical.put(original, server);
          registered.add(server);
        }
      }
    }

    Map<BaseEntity, BaseEntity> serverVersions = new IdentityHashMap<>();
    for (BaseEntity object : objects) {
      BaseEntity server = byCanonical.get(index.resolve(object));
      if (server != null) {
        serverVersions.put(object, server);
      }
    }
    return new RegistrationResult(registered, serverVersions, dryRun);
  }

  private static BaseEntity match(BaseEntity server, IdentityIndex index) {
    for (LinkByUid key : server.identityKeys()) {
      BaseEntity original = index.get(key);
      if (original != null) {
        return original;
      }
    }
    return null;
  }

  public List<DeletionFailure> batchDelete(List<?> ids) {
    return batchDelete(ids, DEFAULT_TIMEOUT, DEFAULT_POLLING_DELAY);
  }

  /**
   * Deletes a list of objects in one asynchronous job and waits for it.
   *
   * <p>
   * Objects that could not be deleted, typically because something else still
   * references them, are reported in the returned list rather than thrown.
   *
   * @param ids
   *            the objects to delete, each a {@link UUID} or {@link String}
   *            platform id, a {@link LinkByUid} or a {@link BaseEntity}
   * @param timeout
   *            how long to wait for the job
   * @param pollingDelay
   *            delay between job status requests
   * @return the objects that failed to delete, empty if all were deleted
   * @throws IllegalArgumentException
   *             if an id cannot be turned into a link
   * @throws io.citrine.client.core.jobs.PollingTimeoutException
   *             if the job does not finish within the timeout
   */
  public List<DeletionFailure> batchDelete(List<?> ids, Duration timeout, Duration pollingDelay) {
    ObjectNode body = JsonUtils.getObjectMapper().createObjectNode();
    ArrayNode idArray = body.putArray("ids");
    for (Object id : ids) {
      LinkByUid link = toLink(id);
      idArray.addObject().put("scope", link.getScope()).put("id", link.getId());
    }
    if (datasetId != null) {
      body.put("dataset_id", datasetId.toString());
    }

    String path = "teams/" + teamId + "/gemd/async-batch-delete";
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("citrine:deleteCount", ids.size());
    JobStatus status = Tracer.runInSpan("gemd/batchDelete", attributes, () -> {
      UUID jobId = transport.submitDelete(path, body);
      Tracer.addEvent("gemd/batchDelete/submitted", Map.of("jobId", jobId.toString()));
      return jobPoller.poll(jobId, timeout, pollingDelay, false);
    });

    List<DeletionFailure> failures = parseFailures(status);
    if (failures.isEmpty()) {
      logger.info("Deleted {} objects", ids.size());
    } else {
      logger.warn("Failed to delete {} of {} objects", failures.size(), ids.size());
    }
    return failures;
  }

  private static List<DeletionFailure> parseFailures(JobStatus status) {
    if (status.getOutput() == null || status.getOutput().get("failures") == null) {
      return Collections.emptyList();
    }
    JsonNode parsed = JsonUtils.parseJson(status.getOutput().get("failures"));
    List<DeletionFailure> failures = new ArrayList<>();
    for (JsonNode entry : parsed) {
      failures.add(DeletionFailure.fromJson(entry));
    }
    return failures;
  }

  private static LinkByUid toLink(Object id) {
    if (id instanceof LinkByUid) {
      return (LinkByUid) id;
    }
    if (id instanceof UUID || id instanceof String) {
      return new LinkByUid(BaseEntity.CITRINE_SCOPE, id.toString());
    }
    if (id instanceof BaseEntity) {
      BaseEntity entity = (BaseEntity) id;
      if (entity.getUids().isEmpty()) {
        throw new IllegalArgumentException("Cannot delete " + entity + ": it has no uids");
      }
      return entity.toLink();
    }
    throw new IllegalArgumentException(
        "Cannot delete " + id + ": expected a UUID, String, LinkByUid or BaseEntity");
  }

  public UUID getTeamId() {
    return teamId;
  }

  public UUID getDatasetId() {
    return datasetId;
  }
}
