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
package io.daktela.extractor.config;

import io.daktela.extractor.ConfigurationException;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run configuration of the extractor.
 *
 * <p>Bound from the {@code config.json} file of the component data directory:
 *
 * <pre>{@code
 * {
 *   "action": "run",
 *   "parameters": {
 *     "connection": {"url": "https://acme.daktela.com", "username": "u", "#password": "p"},
 *     "data_selection": {"date_from": "7 days ago", "date_to": "today",
 *                        "endpoints": ["contacts", {"endpoint": "tickets", "fields": ["name"]}]},
 *     "destination": {"incremental": true},
 *     "advanced": {"batch_size": 1000, "max_concurrent_requests": 10,
 *                  "max_concurrent_endpoints": 3}
 *   }
 * }
 * }</pre>
 *
 * <p>Validation failures are reported as {@link ConfigurationException}.
 */
public class ExtractorConfig {

  public static final int DEFAULT_BATCH_SIZE = 1000;
  public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 10;
  public static final int DEFAULT_MAX_CONCURRENT_ENDPOINTS = 3;
  public static final int DEFAULT_PAGE_LIMIT = 1000;
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final long DEFAULT_RETRY_BACKOFF_MS = 1000;

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final String action;
  private final String url;
  private final String username;
  private final String password;
  private final boolean verifySsl;
  private final String dateFrom;
  private final String dateTo;
  private final List<EndpointSelection> endpoints;
  private final boolean incremental;
  private final int batchSize;
  private final int maxConcurrentRequests;
  private final int maxConcurrentEndpoints;
  private final int pageLimit;
  private final int maxAttempts;
  private final long retryBackoffMs;
  private final boolean debug;

  private ExtractorConfig(Builder builder) {
    this.action = builder.action != null ? builder.action : "run";
    this.url = stripTrailingSlash(builder.url);
    this.username = builder.username;
    this.password = builder.password;
    this.verifySsl = builder.verifySsl;
    this.dateFrom = builder.dateFrom;
    this.dateTo = builder.dateTo;
    this.endpoints = builder.endpoints != null
        ? Collections.unmodifiableList(new ArrayList<EndpointSelection>(builder.endpoints))
        : Collections.<EndpointSelection>emptyList();
    this.incremental = builder.incremental;
    this.batchSize = builder.batchSize;
    this.maxConcurrentRequests = builder.maxConcurrentRequests;
    this.maxConcurrentEndpoints = builder.maxConcurrentEndpoints;
    this.pageLimit = builder.pageLimit;
    this.maxAttempts = builder.maxAttempts;
    this.retryBackoffMs = builder.retryBackoffMs;
    this.debug = builder.debug;
  }

  private static String stripTrailingSlash(String value) {
    String result = value.trim();
    while (result.endsWith("/")) {
      result = result.substring(0, result.length() - 1);
    }
    return result;
  }

  public String getAction() {
    return action;
  }

  public String getUrl() {
    return url;
  }

  public String getUsername() {
    return username;
  }

  public String getPassword() {
    return password;
  }

  public boolean isVerifySsl() {
    return verifySsl;
  }

  public String getDateFrom() {
    return dateFrom;
  }

  public String getDateTo() {
    return dateTo;
  }

  public List<EndpointSelection> getEndpoints() {
    return endpoints;
  }

  public List<String> getEndpointNames() {
    List<String> names = new ArrayList<String>();
    for (EndpointSelection selection : endpoints) {
      names.add(selection.getName());
    }
    return names;
  }

  /**
   * Returns the explicit field lists keyed by endpoint name; endpoints
   * without a field list are absent.
   */
  public Map<String, List<String>> getFieldsByEndpoint() {
    Map<String, List<String>> result = new LinkedHashMap<String, List<String>>();
    for (EndpointSelection selection : endpoints) {
      if (!selection.getFields().isEmpty()) {
        result.put(selection.getName(), selection.getFields());
      }
    }
    return result;
  }

  public boolean isIncremental() {
    return incremental;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public int getMaxConcurrentRequests() {
    return maxConcurrentRequests;
  }

  public int getMaxConcurrentEndpoints() {
    return maxConcurrentEndpoints;
  }

  public int getPageLimit() {
    return pageLimit;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long getRetryBackoffMs() {
    return retryBackoffMs;
  }

  public boolean isDebug() {
    return debug;
  }

  /**
   * Returns the first host label of the API URL, e.g. {@code acme} for
   * {@code https://acme.daktela.com}. Used to name output tables.
   */
  public String getServerName() {
    String host = null;
    try {
      host = URI.create(url).getHost();
    } catch (IllegalArgumentException e) {
      throw new ConfigurationException("Invalid connection.url: " + url, e);
    }
    if (host == null || host.isEmpty()) {
      throw new ConfigurationException("connection.url has no host: " + url);
    }
    int dot = host.indexOf('.');
    return dot > 0 ? host.substring(0, dot) : host;
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads and validates {@code config.json}.
   *
   * @param configFile Path of the configuration file
   * @return Validated configuration
   * @throws ConfigurationException If the file is missing, unreadable or invalid
   */
  public static ExtractorConfig load(Path configFile) {
    if (!Files.exists(configFile)) {
      throw new ConfigurationException("Configuration file not found: " + configFile);
    }
    Map<String, Object> root;
    try {
      root = MAPPER.readValue(configFile.toFile(), new TypeReference<Map<String, Object>>() { });
    } catch (IOException e) {
      throw new ConfigurationException("Unable to parse " + configFile + ": " + e.getMessage(), e);
    }
    return fromMap(root);
  }

  /**
   * Binds the full configuration document: an optional {@code action} and the
   * {@code parameters} object.
   */
  @SuppressWarnings("unchecked")
  public static ExtractorConfig fromMap(Map<String, Object> root) {
    if (root == null) {
      throw new ConfigurationException("Configuration is empty");
    }
    Object params = root.get("parameters");
    if (!(params instanceof Map)) {
      throw new ConfigurationException("Validation Error: parameters: field required");
    }
    Builder builder = fromParameters((Map<String, Object>) params);
    Object action = root.get("action");
    if (action instanceof String && !((String) action).isEmpty()) {
      builder.action((String) action);
    }
    return builder.build();
  }

  @SuppressWarnings("unchecked")
  static Builder fromParameters(Map<String, Object> params) {
    List<String> errors = new ArrayList<String>();
    Builder builder = builder();

    Map<String, Object> connection = section(params, "connection", true, errors);
    if (connection != null) {
      builder.url(requiredString(connection, "connection", "url", errors));
      builder.username(requiredString(connection, "connection", "username", errors));
      builder.password(requiredString(connection, "connection", "#password", errors));
      builder.verifySsl(booleanValue(connection.get("verify_ssl"), true));
    }

    Map<String, Object> selection = section(params, "data_selection", true, errors);
    if (selection != null) {
      builder.dateFrom(requiredString(selection, "data_selection", "date_from", errors));
      builder.dateTo(requiredString(selection, "data_selection", "date_to", errors));
      Object endpoints = selection.get("endpoints");
      if (!(endpoints instanceof List)) {
        errors.add("data_selection.endpoints: field required");
      } else {
        builder.endpoints(parseEndpoints((List<Object>) endpoints, errors));
      }
    }

    Map<String, Object> destination = section(params, "destination", false, errors);
    Map<String, Object> advanced = section(params, "advanced", false, errors);
    if (destination != null) {
      builder.incremental(booleanValue(destination.get("incremental"), false));
    }
    builder.batchSize(intSetting(advanced, destination, "batch_size", DEFAULT_BATCH_SIZE, errors));
    builder.maxConcurrentRequests(intSetting(advanced, destination, "max_concurrent_requests",
        DEFAULT_MAX_CONCURRENT_REQUESTS, errors));
    builder.maxConcurrentEndpoints(intSetting(advanced, destination, "max_concurrent_endpoints",
        DEFAULT_MAX_CONCURRENT_ENDPOINTS, errors));
    builder.pageLimit(intSetting(advanced, null, "page_limit", DEFAULT_PAGE_LIMIT, errors));
    builder.maxAttempts(intSetting(advanced, null, "max_attempts", DEFAULT_MAX_ATTEMPTS, errors));
    builder.retryBackoffMs(
        intSetting(advanced, null, "retry_backoff_ms", (int) DEFAULT_RETRY_BACKOFF_MS, errors));
    builder.debug(booleanValue(params.get("debug"), false));

    if (!errors.isEmpty()) {
      throw new ConfigurationException("Validation Error: " + String.join(", ", errors));
    }
    return builder;
  }

  @SuppressWarnings("unchecked")
  private static @Nullable Map<String, Object> section(Map<String, Object> params, String key,
      boolean required, List<String> errors) {
    Object value = params.get(key);
    if (value instanceof Map) {
      return (Map<String, Object>) value;
    }
    if (value != null) {
      errors.add(key + ": must be an object");
    } else if (required) {
      errors.add(key + ": field required");
    }
    return null;
  }

  private static @Nullable String requiredString(Map<String, Object> section, String sectionName,
      String key, List<String> errors) {
    Object value = section.get(key);
    if (value == null || String.valueOf(value).trim().isEmpty()) {
      errors.add(sectionName + "." + key + ": field required");
      return null;
    }
    return String.valueOf(value);
  }

  private static boolean booleanValue(@Nullable Object value, boolean defaultValue) {
    if (value instanceof Boolean) {
      return (Boolean) value;
    }
    if (value instanceof Number) {
      return ((Number) value).intValue() != 0;
    }
    if (value instanceof String) {
      return Boolean.parseBoolean((String) value);
    }
    return defaultValue;
  }

  private static int intSetting(@Nullable Map<String, Object> primary,
      @Nullable Map<String, Object> fallback, String key, int defaultValue, List<String> errors) {
    Object value = primary != null ? primary.get(key) : null;
    if (value == null && fallback != null) {
      value = fallback.get(key);
    }
    if (value == null) {
      return defaultValue;
    }
    try {
      return value instanceof Number
          ? ((Number) value).intValue()
          : Integer.parseInt(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      errors.add(key + ": value is not a valid integer");
      return defaultValue;
    }
  }

  @SuppressWarnings("unchecked")
  private static List<EndpointSelection> parseEndpoints(List<Object> raw, List<String> errors) {
    List<EndpointSelection> result = new ArrayList<EndpointSelection>();
    for (Object item : raw) {
      if (item instanceof String) {
        result.add(new EndpointSelection((String) item, null));
      } else if (item instanceof Map) {
        Map<String, Object> map = (Map<String, Object>) item;
        Object name = map.get("endpoint");
        if (name == null) {
          errors.add("data_selection.endpoints: entry without 'endpoint'");
          continue;
        }
        result.add(new EndpointSelection(String.valueOf(name),
            EndpointSpec.stringList(map.get("fields"))));
      } else {
        errors.add("data_selection.endpoints: unsupported entry " + item);
      }
    }
    return result;
  }

  /**
   * One requested endpoint with its optional field selection.
   */
  public static class EndpointSelection {
    private final String name;
    private final List<String> fields;

    public EndpointSelection(String name, @Nullable List<String> fields) {
      this.name = name;
      this.fields = fields != null
          ? Collections.unmodifiableList(new ArrayList<String>(fields))
          : Collections.<String>emptyList();
    }

    public String getName() {
      return name;
    }

    public List<String> getFields() {
      return fields;
    }
  }

  /**
   * Builder for ExtractorConfig.
   */
  public static class Builder {
    private String action;
    private String url;
    private String username;
    private String password;
    private boolean verifySsl = true;
    private String dateFrom;
    private String dateTo;
    private List<EndpointSelection> endpoints;
    private boolean incremental;
    private int batchSize = DEFAULT_BATCH_SIZE;
    private int maxConcurrentRequests = DEFAULT_MAX_CONCURRENT_REQUESTS;
    private int maxConcurrentEndpoints = DEFAULT_MAX_CONCURRENT_ENDPOINTS;
    private int pageLimit = DEFAULT_PAGE_LIMIT;
    private int maxAttempts = DEFAULT_MAX_ATTEMPTS;
    private long retryBackoffMs = DEFAULT_RETRY_BACKOFF_MS;
    private boolean debug;

    public Builder action(String action) {
      this.action = action;
      return this;
    }

    public Builder url(String url) {
      this.url = url;
      return this;
    }

    public Builder username(String username) {
      this.username = username;
      return this;
    }

    public Builder password(String password) {
      this.password = password;
      return this;
    }

    public Builder verifySsl(boolean verifySsl) {
      this.verifySsl = verifySsl;
      return this;
    }

    public Builder dateFrom(String dateFrom) {
      this.dateFrom = dateFrom;
      return this;
    }

    public Builder dateTo(String dateTo) {
      this.dateTo = dateTo;
      return this;
    }

    public Builder endpoints(List<EndpointSelection> endpoints) {
      this.endpoints = endpoints;
      return this;
    }

    public Builder endpointNames(String... names) {
      List<EndpointSelection> list = new ArrayList<EndpointSelection>();
      for (String name : names) {
        list.add(new EndpointSelection(name, null));
      }
      this.endpoints = list;
      return this;
    }

    public Builder incremental(boolean incremental) {
      this.incremental = incremental;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder maxConcurrentRequests(int maxConcurrentRequests) {
      this.maxConcurrentRequests = maxConcurrentRequests;
      return this;
    }

    public Builder maxConcurrentEndpoints(int maxConcurrentEndpoints) {
      this.maxConcurrentEndpoints = maxConcurrentEndpoints;
      return this;
    }

    public Builder pageLimit(int pageLimit) {
      this.pageLimit = pageLimit;
      return this;
    }

    public Builder maxAttempts(int maxAttempts) {
      this.maxAttempts = maxAttempts;
      return this;
    }

    public Builder retryBackoffMs(long retryBackoffMs) {
      this.retryBackoffMs = retryBackoffMs;
      return this;
    }

    public Builder debug(boolean debug) {
      this.debug = debug;
      return this;
    }

    public ExtractorConfig build() {
      if (url == null || username == null || password == null) {
        throw new ConfigurationException("Connection url, username and password are required");
      }
      if (dateFrom == null || dateTo == null) {
        throw new ConfigurationException("data_selection.date_from and date_to are required");
      }
      if (batchSize <= 0) {
        throw new ConfigurationException("Batch size must be a positive integer.");
      }
      if (maxConcurrentRequests <= 0 || maxConcurrentEndpoints <= 0) {
        throw new ConfigurationException("Concurrency limits must be positive integers.");
      }
      if (pageLimit <= 0) {
        throw new ConfigurationException("Page limit must be a positive integer.");
      }
      if (maxAttempts <= 0) {
        throw new ConfigurationException("Max attempts must be a positive integer.");
      }
      if (retryBackoffMs < 0) {
        throw new ConfigurationException("Retry backoff must not be negative.");
      }
      return new ExtractorConfig(this);
    }
  }
}
