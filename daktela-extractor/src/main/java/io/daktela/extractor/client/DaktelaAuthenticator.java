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

import io.daktela.extractor.AuthenticationException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exchanges Daktela credentials for an access token.
 *
 * <p>Authentication happens once per run, before any paginated request, with
 * {@code POST <base>/api/v6/login.json?username=..&password=..&only_token=1}.
 * The token is read from {@code result.accessToken}; older API versions return
 * the token string directly as {@code result}.
 *
 * <p>Every failure is fatal and reported as {@link AuthenticationException};
 * login is not retried because bad input fails deterministically.
 */
public class DaktelaAuthenticator {

  private static final Logger LOGGER = LoggerFactory.getLogger(DaktelaAuthenticator.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  static final Duration AUTH_TIMEOUT = Duration.ofSeconds(30);
  private static final int MAX_BODY_IN_MESSAGE = 200;

  private final HttpClient httpClient;
  private final String baseUrl;
  private final String username;
  private final String password;

  public DaktelaAuthenticator(HttpClient httpClient, String baseUrl, String username,
      String password) {
    this.httpClient = httpClient;
    this.baseUrl = baseUrl;
    this.username = username;
    this.password = password;
  }

  /**
   * Performs the credential exchange.
   *
   * @return Access token
   * @throws AuthenticationException On any failure
   */
  public String authenticate() {
    Map<String, String> params = new LinkedHashMap<String, String>();
    params.put("username", username);
    params.put("password", password);
    params.put("only_token", "1");
    URI uri = ApiUrls.build(baseUrl, ApiUrls.endpointPath("login"), params);

    HttpRequest request = HttpRequest.newBuilder()
        .uri(uri)
        .timeout(AUTH_TIMEOUT)
        .header("Accept", "application/json")
        .POST(HttpRequest.BodyPublishers.noBody())
        .build();

    LOGGER.info("Attempting to authenticate with Daktela API at {}", baseUrl);
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (HttpTimeoutException e) {
      throw new AuthenticationException(
          "Connection timeout when connecting to " + baseUrl + ": " + e.getMessage(), e);
    } catch (ConnectException e) {
      throw new AuthenticationException(
          "Server not responding. Failed to connect to " + baseUrl + ": " + e.getMessage(), e);
    } catch (IOException e) {
      throw new AuthenticationException("Request failed: " + e.getMessage(), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AuthenticationException("Authentication interrupted", e);
    }

    String body = response.body() != null ? response.body() : "";
    if (response.statusCode() != 200) {
      throw new AuthenticationException("Invalid response from Daktela API. Status code: "
          + response.statusCode() + ". Response: " + abbreviate(body));
    }

    JsonNode root;
    try {
      root = MAPPER.readTree(body);
    } catch (IOException e) {
      throw new AuthenticationException(
          "Failed to parse authentication response: " + e.getMessage(), e);
    }

    JsonNode result = root != null ? root.get("result") : null;
    if (result == null || result.isNull() || (result.isTextual() && result.asText().isEmpty())
        || (result.isObject() && result.size() == 0)) {
      throw new AuthenticationException(
          "Invalid token in authentication response. Response: " + abbreviate(body));
    }

    String token;
    if (result.isObject()) {
      JsonNode accessToken = result.get("accessToken");
      if (accessToken == null || accessToken.isNull() || accessToken.asText().isEmpty()) {
        throw new AuthenticationException(
            "Invalid token in authentication response. Response: " + abbreviate(body));
      }
      token = accessToken.asText();
    } else {
      token = result.asText();
    }

    LOGGER.info("Successfully authenticated with Daktela API");
    return token;
  }

  private static String abbreviate(String body) {
    return body.length() > MAX_BODY_IN_MESSAGE ? body.substring(0, MAX_BODY_IN_MESSAGE) : body;
  }
}
