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
package io.daktela.extractor;

import io.daktela.extractor.client.DaktelaAuthenticator;
import io.daktela.extractor.client.DaktelaHttpClients;
import io.daktela.extractor.client.Page;
import io.daktela.extractor.client.PageFetcher;
import io.daktela.extractor.client.PageRequest;
import io.daktela.extractor.client.RecordSource;
import io.daktela.extractor.client.RetryExecutor;
import io.daktela.extractor.config.DateRangeResolver;
import io.daktela.extractor.config.EndpointCatalog;
import io.daktela.extractor.config.EndpointSpec;
import io.daktela.extractor.config.ExtractorConfig;
import io.daktela.extractor.extract.ConcurrencyScheduler;
import io.daktela.extractor.extract.DaktelaExtractor;
import io.daktela.extractor.extract.ExtractionContext;
import io.daktela.extractor.extract.ExtractionOutcome;
import io.daktela.extractor.sink.CsvTableSink;
import io.daktela.extractor.state.RunState;
import io.daktela.extractor.state.StateStore;
import io.daktela.extractor.transform.RecordTransformer;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Semaphore;

/**
 * Runs one action of the extractor against a data directory.
 *
 * <p>The data directory holds {@code config.json}, the input state
 * {@code in/state.json} and receives {@code out/tables/} and
 * {@code out/state.json}.
 *
 * <ul>
 *   <li>{@code run}: load state, authenticate, extract every requested
 *       endpoint, save state;</li>
 *   <li>{@code listFields}: print the field names of one record per endpoint
 *       as JSON.</li>
 * </ul>
 */
public class ExtractorComponent {

  private static final Logger LOGGER = LoggerFactory.getLogger(ExtractorComponent.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  public static final String ACTION_RUN = "run";
  public static final String ACTION_LIST_FIELDS = "listFields";

  private final Path dataDir;
  private final EndpointCatalog catalog;
  private final PrintStream out;
  private final Clock clock;

  public ExtractorComponent(Path dataDir) {
    this(dataDir, EndpointCatalog.loadDefault(), System.out, Clock.systemDefaultZone());
  }

  public ExtractorComponent(Path dataDir, EndpointCatalog catalog, PrintStream out, Clock clock) {
    this.dataDir = dataDir;
    this.catalog = catalog;
    this.out = out;
    this.clock = clock;
  }

  /**
   * Executes an action.
   *
   * @param actionOverride Action to run instead of the configured one, or null
   * @throws DaktelaException On configuration, authentication or extraction failures
   */
  public void execute(@Nullable String actionOverride) {
    ExtractorConfig config = ExtractorConfig.load(dataDir.resolve("config.json"));
    if (config.isDebug()) {
      Configurator.setLevel("io.daktela", Level.DEBUG);
      LOGGER.debug("Debug logging enabled");
    }
    if (!config.isVerifySsl()) {
      DaktelaHttpClients.disableHostnameVerification();
    }
    String action = actionOverride != null ? actionOverride : config.getAction();
    LOGGER.info("Running action '{}'", action);
    if (ACTION_RUN.equals(action)) {
      run(config);
    } else if (ACTION_LIST_FIELDS.equals(action)) {
      listFields(config);
    } else {
      throw new ConfigurationException("Unknown action: " + action);
    }
  }

  void run(ExtractorConfig config) {
    StateStore stateStore = new StateStore(dataDir);
    RunState state = stateStore.load();
    DateRangeResolver dates = new DateRangeResolver(clock);
    String dateFrom = dates.resolveFrom(config.getDateFrom(), state.getLastUpdated());
    String dateTo = dates.resolveTo(config.getDateTo());

    HttpClient httpClient = DaktelaHttpClients.create(config.isVerifySsl());
    String token = new DaktelaAuthenticator(httpClient, config.getUrl(), config.getUsername(),
        config.getPassword()).authenticate();

    ExtractionContext context = new ExtractionContext(config.getServerName(),
        catalog.getIdentitySource(), catalog.getIdentitySourceAlias(), state.getColumns());
    CsvTableSink sink = new CsvTableSink(dataDir.resolve("out").resolve("tables"));
    List<ExtractionOutcome> outcomes;
    try (ConcurrencyScheduler scheduler = new ConcurrencyScheduler(
        config.getMaxConcurrentRequests(), config.getMaxConcurrentEndpoints())) {
      PageFetcher fetcher = new PageFetcher(httpClient, config.getUrl(), token,
          new RetryExecutor(config.getMaxAttempts(), config.getRetryBackoffMs()),
          scheduler.getRequestLimiter());
      outcomes = new DaktelaExtractor(config, catalog, fetcher, scheduler, sink, sink, context,
          dateFrom, dateTo).extractAll();
    }

    String timestamp = OffsetDateTime.now(clock).withNano(0)
        .format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    try {
      stateStore.save(state.afterRun(timestamp, context.getWrittenColumns()));
    } catch (IOException e) {
      throw new ExtractionException("Failed to save state: " + e.getMessage(), e);
    }
    long rows = 0;
    for (ExtractionOutcome outcome : outcomes) {
      rows += outcome.getRowsWritten();
    }
    LOGGER.info("Extraction finished: {} endpoints, {} rows", outcomes.size(), rows);
  }

  void listFields(ExtractorConfig config) {
    HttpClient httpClient = DaktelaHttpClients.create(config.isVerifySsl());
    String token = new DaktelaAuthenticator(httpClient, config.getUrl(), config.getUsername(),
        config.getPassword()).authenticate();
    RecordSource source = new PageFetcher(httpClient, config.getUrl(), token,
        new RetryExecutor(config.getMaxAttempts(), config.getRetryBackoffMs()),
        new Semaphore(config.getMaxConcurrentRequests()));

    Map<String, EndpointSpec> endpoints =
        catalog.resolve(config.getEndpointNames(), config.getFieldsByEndpoint());
    Map<String, List<String>> fields = new LinkedHashMap<String, List<String>>();
    for (EndpointSpec spec : endpoints.values()) {
      fields.put(spec.getName(), sampleFields(source, spec));
    }
    try {
      out.println(MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(fields));
    } catch (IOException e) {
      throw new ExtractionException("Failed to render field list: " + e.getMessage(), e);
    }
  }

  static List<String> sampleFields(RecordSource source, EndpointSpec spec) {
    if (spec.isDependent()) {
      LOGGER.info("Skipping field listing for dependent endpoint {}", spec.getName());
      return Collections.emptyList();
    }
    try {
      Page page = source.fetchPage(new PageRequest(spec.getEndpoint(), 0, 1, null,
          spec.getFields(), false));
      if (page.size() == 0) {
        return Collections.emptyList();
      }
      RecordTransformer transformer = new RecordTransformer(spec, false);
      TreeSet<String> names = new TreeSet<String>();
      for (Map<String, Object> row : transformer.transformRecord(page.getRecords().get(0))) {
        names.addAll(row.keySet());
      }
      return new ArrayList<String>(names);
    } catch (IOException | DaktelaException e) {
      LOGGER.warn("Could not list fields of {}: {}", spec.getName(), e.getMessage());
      return Collections.emptyList();
    }
  }
}
