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
package io.daktela.extractor.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Semaphore;

/**
 * Fetches pages of Daktela collections over HTTP.
 *
 * <p>Each HTTP call is wrapped by the {@link RetryExecutor} and holds one
 * permit of the run-wide request limiter while it is in flight; the permit is
 * released during retry backoff.
 *
 * <p>A request flagged for filter fallback whose filters are rejected with a
 * 4xx response is repeated once without filter parameters. The returned
 * {@link Page} then reports {@code filtersApplied == false} so callers can
 * request the remaining pages the same way.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * PageFetcher fetcher = new PageFetcher(httpClient, "https://acme.daktela.com", token,
 *     new RetryExecutor(3, 1000), new Semaphore(10));
 * Page first = fetcher.fetchPage(new PageRequest("contacts", 0, 1000,
 *     FilterEncoder.dateRange("edited", from, to), fields, false));
 * }</pre>
 */
public class PageFetcher implements RecordSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(PageFetcher.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE =
      new TypeReference<LinkedHashMap<String, Object>>() { };

  static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(60);

  private final HttpClient httpClient;
  private final String baseUrl;
  private final String accessToken;
  private final RetryExecutor retryExecutor;
  private final Semaphore requestLimiter;

  public PageFetcher(HttpClient httpClient, String baseUrl, String accessToken,
      RetryExecutor retryExecutor, Semaphore requestLimiter) {
    this.httpClient = httpClient;
    this.baseUrl = baseUrl;
    this.accessToken = accessToken;
    this.retryExecutor = retryExecutor;
    this.requestLimiter = requestLimiter;
  }

  @Override public Page fetchPage(PageRequest request) throws IOException {
    try {
      return retryExecutor.execute("GET " + request, () -> send(request));
    } catch (FilterRejectedException e) {
      LOGGER.warn("Endpoint {} rejected filter parameters ({}); retrying without filters",
          request.getEndpoint(), e.getMessage());
      PageRequest unfiltered = request.withoutFilters();
      Page page = retryExecutor.execute("GET " + unfiltered, () -> send(unfiltered));
      return new Page(page.getRecords(), page.getTotal(), false);
    }
  }

  @Override public List<Map<String, Object>> fetchDependent(String parentEndpoint,
      String parentId, String childEndpoint, List<String> fields, int limit) throws IOException {
    String path = ApiUrls.dependentPath(parentEndpoint, parentId, childEndpoint);
    List<Map<String, Object>> records = new ArrayList<Map<String, Object>>();
    PageRequest request = new PageRequest(path, 0, limit, null, fields, false);
    int total = -1;
    while (true) {
      Page page = fetchPage(request);
      if (total < 0) {
        total = page.getTotal();
      }
      records.addAll(page.getRecords());
      int next = request.getOffset() + limit;
      if (page.size() == 0 || next >= total) {
        break;
      }
      request = request.atOffset(next);
    }
    LOGGER.debug("Fetched {} records from {}", records.size(), path);
    return records;
  }

  private Page send(PageRequest request) throws IOException, InterruptedException {
    URI uri = ApiUrls.build(baseUrl, ApiUrls.endpointPath(request.getEndpoint()),
        queryParameters(request));
    HttpRequest httpRequest = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(REQUEST_TIMEOUT)
        .header("Accept", "application/json")
        .GET()
        .build();

    HttpResponse<String> response;
    requestLimiter.acquire();
    try {
      LOGGER.debug("Requesting {}", request);
      response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString());
    } finally {
      requestLimiter.release();
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      ApiRequestException error = new ApiRequestException(status, abbreviate(response.body()));
      if (error.isFilterRejection() && request.isFilterFallback()
          && !request.getFilters().isEmpty()) {
        throw new FilterRejectedException(status, abbreviate(response.body()));
      }
      throw error;
    }
    return parse(response.body());
  }

  private Map<String, String> queryParameters(PageRequest request) {
    Map<String, String> params = new LinkedHashMap<String, String>();
    params.put("accessToken", accessToken);
    params.put("skip", Integer.toString(request.getOffset()));
    params.put("take", Integer.toString(request.getLimit()));
    if (!request.getFields().isEmpty()) {
      params.put("fields", String.join(",", request.getFields()));
    }
    params.putAll(FilterEncoder.encode(request.getFilters()));
    return params;
  }

  /**
   * Reads {@code result.total} and {@code result.data}. A missing result or a
   * non-array data member yields an empty page.
   */
  static Page parse(String body) throws IOException {
    JsonNode root = MAPPER.readTree(body);
    JsonNode result = root != null ? root.get("result") : null;
    if (result == null || !result.isObject()) {
      return new Page(Collections.<Map<String, Object>>emptyList(), 0, true);
    }
    int total = result.path("total").asInt(0);
    JsonNode data = result.get("data");
    if (data == null || !data.isArray()) {
      return new Page(Collections.<Map<String, Object>>emptyList(), total, true);
    }
    List<Map<String, Object>> records = new ArrayList<Map<String, Object>>(data.size());
    for (JsonNode node : data) {
      if (node.isObject()) {
        records.add(MAPPER.convertValue(node, RECORD_TYPE));
      }
    }
    return new Page(records, total, true);
  }

  private static String abbreviate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() > 200 ? body.substring(0, 200) : body;
  }
}
