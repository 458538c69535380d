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

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * URL building for the Daktela REST API v6.
 */
final class ApiUrls {

  static final String API_PREFIX = "api/v6/";

  private ApiUrls() {
  }

  /**
   * Normalizes an endpoint into an API path: strips leading slashes, appends
   * {@code .json} and prefixes {@code api/v6/} unless already under {@code api/}.
   */
  static String endpointPath(String endpoint) {
    String cleaned = endpoint;
    while (cleaned.startsWith("/")) {
      cleaned = cleaned.substring(1);
    }
    if (!cleaned.endsWith(".json")) {
      cleaned = cleaned + ".json";
    }
    if (!cleaned.startsWith("api/")) {
      cleaned = API_PREFIX + cleaned;
    }
    return cleaned;
  }

  /**
   * Path of a child collection scoped to one parent record.
   */
  static String dependentPath(String parentEndpoint, String parentId, String childEndpoint) {
    return stripJson(parentEndpoint) + "/" + encodeSegment(parentId) + "/" + stripJson(childEndpoint);
  }

  private static String stripJson(String endpoint) {
    String cleaned = endpoint;
    while (cleaned.startsWith("/")) {
      cleaned = cleaned.substring(1);
    }
    return cleaned.endsWith(".json") ? cleaned.substring(0, cleaned.length() - 5) : cleaned;
  }

  private static String encodeSegment(String segment) {
    return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
  }

  /**
   * Builds an absolute URI from the base URL, a path and query parameters.
   */
  static URI build(String baseUrl, String path, Map<String, String> params) {
    StringBuilder url = new StringBuilder(baseUrl);
    if (!baseUrl.endsWith("/")) {
      url.append('/');
    }
    url.append(path);
    char separator = path.contains("?") ? '&' : '?';
    for (Map.Entry<String, String> e : params.entrySet()) {
      url.append(separator)
          .append(URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8))
          .append('=')
          .append(URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8));
      separator = '&';
    }
    return URI.create(url.toString());
  }
}
