/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to you under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.daktela.extractor.extract;

import io.daktela.extractor.config.EndpointSpec;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.checkerframework.checker.nullness.qual.Nullable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds concurrent work of one run with two independent limits.
 *
 * <p>The request limiter caps in-flight HTTP requests across the whole run
 * and is acquired around every single request by the fetcher. The endpoint
 * limiter caps endpoints extracted at once and is held for an endpoint's
 * whole extraction. {@link #runPhase} returns only when every task of the
 * phase finished, which makes consecutive phases strictly ordered.
 */
public class ConcurrencyScheduler implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConcurrencyScheduler.class);

  private final int maxConcurrentRequests;
  private final Semaphore requestLimiter;
  private final Semaphore endpointLimiter;
  private final ExecutorService executor;

  public ConcurrencyScheduler(int maxConcurrentRequests, int maxConcurrentEndpoints) {
    if (maxConcurrentRequests <= 0 || maxConcurrentEndpoints <= 0) {
      throw new IllegalArgumentException("Concurrency limits must be positive");
    }
    this.maxConcurrentRequests = maxConcurrentRequests;
    this.requestLimiter = new Semaphore(maxConcurrentRequests, true);
    this.endpointLimiter = new Semaphore(maxConcurrentEndpoints, true);
    this.executor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
        .setNameFormat("daktela-extract-%d")
        .setDaemon(true)
        .build());
  }

  public Semaphore getRequestLimiter() {
    return requestLimiter;
  }

  public int getMaxConcurrentRequests() {
    return maxConcurrentRequests;
  }

  /**
   * Submits a unit of work, such as one page request, to the shared pool.
   */
  public <T> Future<T> submit(Callable<T> task) {
    return executor.submit(task);
  }

  /**
   * Runs one task per endpoint and waits for all of them.
   *
   * <p>An endpoint whose parent is part of the same phase first waits for the
   * parent's task to finish, without holding an endpoint permit.
   *
   * @param phase Phase name for logging
   * @param endpoints Endpoints in plan order, parents before children
   * @param task Extraction of one endpoint; must report failures in its outcome
   * @return Outcomes keyed by endpoint name, in plan order
   */
  public Map<String, ExtractionOutcome> runPhase(String phase, List<EndpointSpec> endpoints,
      EndpointTask task) {
    if (endpoints.isEmpty()) {
      LOGGER.debug("{}: nothing to extract", phase);
      return new LinkedHashMap<String, ExtractionOutcome>();
    }
    LOGGER.info("{}: extracting {} endpoints", phase, endpoints.size());
    Map<String, CompletableFuture<ExtractionOutcome>> futures =
        new LinkedHashMap<String, CompletableFuture<ExtractionOutcome>>();
    for (EndpointSpec spec : endpoints) {
      CompletableFuture<ExtractionOutcome> parent =
          spec.isDependent() ? futures.get(spec.getParentEndpoint()) : null;
      futures.put(spec.getName(),
          CompletableFuture.supplyAsync(() -> runEndpoint(spec, parent, task), executor));
    }
    CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0])).join();

    Map<String, ExtractionOutcome> outcomes = new LinkedHashMap<String, ExtractionOutcome>();
    for (Map.Entry<String, CompletableFuture<ExtractionOutcome>> e : futures.entrySet()) {
      outcomes.put(e.getKey(), e.getValue().join());
    }
    LOGGER.info("{}: completed", phase);
    return outcomes;
  }

  private ExtractionOutcome runEndpoint(EndpointSpec spec,
      @Nullable CompletableFuture<ExtractionOutcome> parent, EndpointTask task) {
    if (parent != null) {
      try {
        parent.join();
      } catch (CompletionException e) {
        LOGGER.warn("Parent of {} ended abnormally: {}", spec.getName(), e.getMessage());
      }
    }
    try {
      endpointLimiter.acquire();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return ExtractionOutcome.failure(spec.getName(), spec.getName(), 0,
          "Interrupted while waiting for an endpoint slot");
    }
    try {
      return task.extract(spec);
    } catch (RuntimeException e) {
      LOGGER.error("Extraction of {} failed", spec.getName(), e);
      return ExtractionOutcome.failure(spec.getName(), spec.getName(), 0, e.getMessage());
    } finally {
      endpointLimiter.release();
    }
  }

  @Override public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Extraction of one endpoint.
   */
  @FunctionalInterface
  public interface EndpointTask {
    ExtractionOutcome extract(EndpointSpec spec);
  }
}
