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

import com.github.tomakehurst.wiremock.WireMockServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.net.http.HttpClient;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link DaktelaAuthenticator}.
 */
@Tag("integration")
public class DaktelaAuthenticatorTest {

  private WireMockServer server;

  @BeforeEach void setUp() {
    server = new WireMockServer(options().dynamicPort());
    server.start();
  }

  @AfterEach void tearDown() {
    server.stop();
  }

  private DaktelaAuthenticator authenticator(String baseUrl) {
    return new DaktelaAuthenticator(HttpClient.newHttpClient(), baseUrl, "api", "secret");
  }

  @Test void testTokenFromResultObject() {
    server.stubFor(post(urlPathEqualTo("/api/v6/login.json"))
        .willReturn(okJson("{\"result\":{\"accessToken\":\"abc123\"}}")));

    assertEquals("abc123", authenticator(server.baseUrl()).authenticate());
    server.verify(postRequestedFor(urlPathEqualTo("/api/v6/login.json"))
        .withQueryParam("username", equalTo("api"))
        .withQueryParam("password", equalTo("secret"))
        .withQueryParam("only_token", equalTo("1")));
  }

  @Test void testTokenAsPlainResult() {
    server.stubFor(post(urlPathEqualTo("/api/v6/login.json"))
        .willReturn(okJson("{\"result\":\"legacy-token\"}")));

    assertEquals("legacy-token", authenticator(server.baseUrl()).authenticate());
  }

  @Test void testNonSuccessStatus() {
    server.stubFor(post(urlPathEqualTo("/api/v6/login.json"))
        .willReturn(aResponse().withStatus(401).withBody("Unauthorized")));

    AuthenticationException e = assertThrows(AuthenticationException.class,
        () -> authenticator(server.baseUrl()).authenticate());
    assertThat(e.getMessage(), containsString("401"));
    assertThat(e.getMessage(), containsString("Unauthorized"));
    server.verify(1, postRequestedFor(urlPathEqualTo("/api/v6/login.json")));
  }

  @Test void testUnparsableBody() {
    server.stubFor(post(urlPathEqualTo("/api/v6/login.json"))
        .willReturn(aResponse().withStatus(200).withBody("<html>oops</html>")));

    assertThrows(AuthenticationException.class,
        () -> authenticator(server.baseUrl()).authenticate());
  }

  @Test void testMissingToken() {
    server.stubFor(post(urlPathEqualTo("/api/v6/login.json"))
        .willReturn(okJson("{\"result\":{}}")));

    AuthenticationException e = assertThrows(AuthenticationException.class,
        () -> authenticator(server.baseUrl()).authenticate());
    assertThat(e.getMessage(), containsString("Invalid token"));
  }

  @Test void testServerNotResponding() throws Exception {
    int port;
    try (ServerSocket socket = new ServerSocket(0)) {
      port = socket.getLocalPort();
    }

    assertThrows(AuthenticationException.class,
        () -> authenticator("http://localhost:" + port).authenticate());
  }
}
