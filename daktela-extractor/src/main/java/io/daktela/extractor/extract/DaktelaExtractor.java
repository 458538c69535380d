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

import io.daktela.extractor.DaktelaException;
import io.daktela.extractor.ExtractionException;
import io.daktela.extractor.client.FilterClause;
import io.daktela.extractor.client.FilterEncoder;
import io.daktela.extractor.client.Page;
import io.daktela.extractor.client.PageRequest;
import io.daktela.extractor.client.RecordSource;
import io.daktela.extractor.config.EndpointCatalog;
import io.daktela.extractor.config.EndpointSpec;
import io.daktela.extractor.config.ExtractorConfig;
import io.daktela.extractor.sink.IdentifierSource;
import io.daktela.extractor.sink.RowSink;
import io.daktela.extractor.transform.RecordTransformer;
import io.daktela.extractor.transform.TransformResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Extracts the configured endpoints into output tables.
 *
 * <p>Endpoints are resolved against the {@link EndpointCatalog} and run in the
 * two phases of an {@link ExtractionPlan}. An independent endpoint is read
 * page by page: the first page reports the total, the remaining offsets are
 * fetched concurrently within a window the size of the request limit and
 * consumed in offset order. A dependent endpoint is read per parent
 * identifier through the {@link DependentTableResolver}.
 *
 * <p>A failed endpoint does not stop its siblings; once both phases
 * completed, any failure ends the run with an {@link ExtractionException}.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * try (ConcurrencyScheduler scheduler = new ConcurrencyScheduler(10, 3)) {
 *   DaktelaExtractor extractor = new DaktelaExtractor(config, catalog, fetcher, scheduler,
 *       sink, sink, context, dateFrom, dateTo);
 *   List<ExtractionOutcome> outcomes = extractor.extractAll();
 * }
 * }</pre>
 */
public class DaktelaExtractor {

  private static final Logger LOGGER = LoggerFactory.getLogger(DaktelaExtractor.class);

  private final ExtractorConfig config;
  private final EndpointCatalog catalog;
  private final RecordSource source;
  private final ConcurrencyScheduler scheduler;
  private final RowSink sink;
  private final ExtractionContext context;
  private final DependentTableResolver resolver;
  private final String dateFrom;
  private final String dateTo;

  public DaktelaExtractor(ExtractorConfig config, EndpointCatalog catalog, RecordSource source,
      ConcurrencyScheduler scheduler, RowSink sink, IdentifierSource identifiers,
      ExtractionContext context, String dateFrom, String dateTo) {
    this.config = config;
    this.catalog = catalog;
    this.source = source;
    this.scheduler = scheduler;
    this.sink = sink;
    this.context = context;
    this.resolver =
        new DependentTableResolver(source, identifiers, context, config.getPageLimit());
    this.dateFrom = dateFrom;
    this.dateTo = dateTo;
  }

  /**
   * Extracts every requested endpoint.
   *
   * @return Outcomes in plan order
   * @throws io.daktela.extractor.ConfigurationException If no requested endpoint is known
   * @throws ExtractionException If any endpoint failed
   */
  public List<ExtractionOutcome> extractAll() {
    Map<String, EndpointSpec> endpoints =
        catalog.resolve(config.getEndpointNames(), config.getFieldsByEndpoint());
    ExtractionPlan plan = ExtractionPlan.of(endpoints, context.getIdentitySource());
    LOGGER.info("Extracting data from {} to {}", dateFrom, dateTo);
    LOGGER.info("Phase 1: {} independent endpoints. Phase 2: {} identity-source and dependent "
        + "endpoints", plan.getPhaseOne().size(), plan.getPhaseTwo().size());

    Map<String, ExtractionOutcome> outcomes = new LinkedHashMap<String, ExtractionOutcome>();
    outcomes.putAll(scheduler.runPhase("Phase 1", plan.getPhaseOne(),
        spec -> extractEndpoint(spec, endpoints)));
    outcomes.putAll(scheduler.runPhase("Phase 2", plan.getPhaseTwo(),
        spec -> extractEndpoint(spec, endpoints)));

    List<String> failures = new ArrayList<String>();
    for (ExtractionOutcome outcome : outcomes.values()) {
      LOGGER.info("{}", outcome);
      if (!outcome.isSuccessful()) {
        failures.add(outcome.getEndpoint() + " (" + outcome.getFailureMessage() + ")");
      }
    }
    if (!failures.isEmpty()) {
      throw new ExtractionException("Extraction failed for endpoints: "
          + String.join(", ", failures));
    }
    return new ArrayList<ExtractionOutcome>(outcomes.values());
  }

  ExtractionOutcome extractEndpoint(EndpointSpec spec, Map<String, EndpointSpec> endpoints) {
    String table = context.tableName(spec.getName());
    TableBatchWriter writer = new TableBatchWriter(spec.getName(), table, sink, context,
        config.getBatchSize(), config.isIncremental());
    RecordTransformer transformer =
        new RecordTransformer(spec, context.isIdentitySource(spec.getName()));
    Set<String> invalid = new LinkedHashSet<String>();
    try {
      if (spec.isDependent()) {
        LOGGER.info("Extracting dependent endpoint: {} (parent: {}, parent id field: {})",
            spec.getName(), spec.getParentEndpoint(), spec.getParentIdField());
        resolver.resolve(parentOf(spec, endpoints), spec, transformer, writer);
      } else {
        LOGGER.info("Extracting endpoint: {}", spec.getName());
        extractIndependent(spec, transformer, writer, invalid);
      }
      long rows = writer.finish();
      return ExtractionOutcome.success(spec.getName(), table, rows, invalid);
    } catch (IOException | DaktelaException e) {
      LOGGER.error("Failed to extract endpoint {}: {}", spec.getName(), e.getMessage(), e);
      return ExtractionOutcome.failure(spec.getName(), table, writer.getRowsWritten(),
          e.getMessage());
    }
  }

  private EndpointSpec parentOf(EndpointSpec spec, Map<String, EndpointSpec> endpoints) {
    EndpointSpec parent = endpoints.get(spec.getParentEndpoint());
    if (parent == null) {
      parent = catalog.get(spec.getParentEndpoint());
    }
    if (parent == null) {
      throw new ExtractionException("Parent endpoint '" + spec.getParentEndpoint()
          + "' of '" + spec.getName() + "' is not configured");
    }
    return parent;
  }

  private void extractIndependent(EndpointSpec spec, RecordTransformer transformer,
      TableBatchWriter writer, Set<String> invalid) throws IOException {
    int limit = config.getPageLimit();
    List<FilterClause> filters =
        FilterEncoder.dateRange(spec.getFilterField(), dateFrom, dateTo);
    PageRequest first = new PageRequest(spec.getEndpoint(), 0, limit, filters, spec.getFields(),
        spec.isFilterFragile());
    Page firstPage = source.fetchPage(first);
    int total = firstPage.getTotal();
    LOGGER.info("{}: {} records reported", spec.getName(), total);
    consume(firstPage, transformer, writer, invalid);

    PageRequest template = firstPage.isFiltersApplied() ? first : first.withoutFilters();
    Deque<Future<Page>> window = new ArrayDeque<Future<Page>>();
    int next = limit;
    try {
      while (next < total || !window.isEmpty()) {
        while (next < total && window.size() < scheduler.getMaxConcurrentRequests()) {
          PageRequest request = template.atOffset(next);
          window.add(scheduler.submit(() -> source.fetchPage(request)));
          next += limit;
        }
        consume(await(window.poll(), spec), transformer, writer, invalid);
      }
    } finally {
      for (Future<Page> pending : window) {
        pending.cancel(true);
      }
    }
  }

  private void consume(Page page, RecordTransformer transformer, TableBatchWriter writer,
      Set<String> invalid) throws IOException {
    if (page.size() == 0) {
      return;
    }
    TransformResult result = transformer.transform(page.getRecords());
    if (!result.getInvalidIdentifiers().isEmpty()) {
      invalid.addAll(result.getInvalidIdentifiers());
      context.addInvalidIdentifiers(result.getInvalidIdentifiers());
    }
    writer.add(result.getRows());
  }

  private static Page await(Future<Page> future, EndpointSpec spec) throws IOException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new ExtractionException("Interrupted while fetching " + spec.getName(), e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof IOException) {
        throw (IOException) cause;
      }
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new ExtractionException("Page fetch of " + spec.getName() + " failed: "
          + cause, cause);
    }
  }
}
