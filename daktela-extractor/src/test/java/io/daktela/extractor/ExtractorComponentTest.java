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

import io.daktela.extractor.config.EndpointCatalog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.tomakehurst.wiremock.WireMockServer;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.okJson;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end tests of {@link ExtractorComponent} against a stub Daktela API.
 */
@Tag("integration")
public class ExtractorComponentTest {

  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2024-05-15T12:34:56Z"), ZoneOffset.UTC);

  private WireMockServer server;

  @TempDir Path dataDir;

  @BeforeEach void setUp() {
    server = new WireMockServer(options().dynamicPort());
    server.start();
    server.stubFor(post(urlPathEqualTo("/api/v6/login.json"))
        .willReturn(okJson("{\"result\":{\"accessToken\":\"tok\"}}")));
    server.stubFor(get(urlPathEqualTo("/api/v6/users.json"))
        .willReturn(okJson("{\"result\":{\"total\":2,\"data\":["
            + "{\"name\":\"alice\",\"title\":\"<b>Alice</b>\"},"
            + "{\"name\":\"bob\",\"title\":\"Bob\"}]}}")));
    server.stubFor(get(urlPathEqualTo("/api/v6/tickets.json"))
        .willReturn(okJson("{\"result\":{\"total\":1,\"data\":["
            + "{\"name\":\"TCK-1\",\"title\":\"Broken\",\"statuses\":[]}]}}")));
    server.stubFor(get(urlPathEqualTo("/api/v6/tickets/TCK-1/activities.json"))
        .willReturn(okJson("{\"result\":{\"total\":1,\"data\":["
            + "{\"name\":\"activity_7\",\"type\":\"CALL\"}]}}")));
  }

  @AfterEach void tearDown() {
    server.stop();
  }

  private void writeConfig(String action, String endpoints) throws Exception {
    String json = "{\"action\": \"" + action + "\", \"parameters\": {"
        + "\"connection\": {\"url\": \"" + server.baseUrl() + "\", \"username\": \"api\","
        + " \"#password\": \"secret\"},"
        + "\"data_selection\": {\"date_from\": \"2024-01-01\", \"date_to\": \"2024-02-01\","
        + " \"endpoints\": " + endpoints + "},"
        + "\"advanced\": {\"retry_backoff_ms\": 0, \"max_attempts\": 2}}}";
    Files.write(dataDir.resolve("config.json"), json.getBytes(StandardCharsets.UTF_8));
  }

  private ExtractorComponent component(PrintStream out) {
    return new ExtractorComponent(dataDir, EndpointCatalog.loadDefault(), out, CLOCK);
  }

  @Test void testRunWritesTablesManifestsAndState() throws Exception {
    writeConfig("run", "[\"users\", \"ticketsActivities\"]");

    component(System.out).execute(null);

    Path tables = dataDir.resolve("out/tables");
    List<String> users = Files.readAllLines(tables.resolve("localhost_users.csv"));
    assertEquals(3, users.size());
    assertEquals("\"id\",\"name\",\"title\"", users.get(0));
    assertEquals("\"alice\",\"alice\",\"Alice\"", users.get(1));
    assertTrue(Files.exists(tables.resolve("localhost_users.csv.manifest")));
    assertTrue(Files.exists(tables.resolve("localhost_tickets.csv.manifest")));

    List<String> children = Files.readAllLines(tables.resolve("localhost_ticketsActivities.csv"));
    assertEquals(2, children.size());
    assertTrue(children.get(1).startsWith("\"activity_7\""));

    server.verify(getRequestedFor(urlPathEqualTo("/api/v6/tickets.json"))
        .withQueryParam("accessToken", equalTo("tok"))
        .withQueryParam("filter[logic]", equalTo("and"))
        .withQueryParam("filter[filters][0][value]", equalTo("2024-01-01 00:00:00")));

    JsonNode state = MAPPER.readTree(dataDir.resolve("out/state.json").toFile());
    assertEquals("2024-05-15T12:34:56Z", state.get("last_updated").asText());
    assertEquals("id", state.get("schema").get("users").get("columns").get(0).asText());
  }

  @Test void testListFieldsPrintsSortedFields() throws Exception {
    writeConfig("listFields", "[\"users\"]");
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    component(new PrintStream(buffer, true, "UTF-8")).execute(null);

    JsonNode fields = MAPPER.readTree(buffer.toString("UTF-8"));
    assertEquals("[\"id\",\"name\",\"title\"]", fields.get("users").toString());
    assertFalse(Files.exists(dataDir.resolve("out/tables")));
  }

  @Test void testActionOverride() throws Exception {
    writeConfig("run", "[\"users\"]");
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    component(new PrintStream(buffer, true, "UTF-8")).execute("listFields");

    assertTrue(buffer.toString("UTF-8").contains("users"));
    assertFalse(Files.exists(dataDir.resolve("out/state.json")));
  }

  @Test void testUnknownAction() throws Exception {
    writeConfig("explode", "[\"users\"]");

    assertThrows(ConfigurationException.class, () -> component(System.out).execute(null));
  }

  @Test void testAuthenticationFailureStopsRun() throws Exception {
    server.stubFor(post(urlPathEqualTo("/api/v6/login.json"))
        .willReturn(aResponse().withStatus(403).withBody("denied")));
    writeConfig("run", "[\"users\"]");

    assertThrows(AuthenticationException.class, () -> component(System.out).execute(null));
    server.verify(0, getRequestedFor(urlPathEqualTo("/api/v6/users.json")));
  }

  @Test void testEndpointFailureFailsRunWithoutState() throws Exception {
    server.stubFor(get(urlPathEqualTo("/api/v6/users.json"))
        .willReturn(aResponse().withStatus(500)));
    writeConfig("run", "[\"users\"]");

    assertThrows(ExtractionException.class, () -> component(System.out).execute(null));
    server.verify(2, getRequestedFor(urlPathEqualTo("/api/v6/users.json")));
    assertFalse(Files.exists(dataDir.resolve("out/state.json")));
  }
}
