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
package io.daktela.extractor.state;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads run state from {@code <dataDir>/in/state.json} and writes it to
 * {@code <dataDir>/out/state.json}.
 *
 * <p>File layout:
 * <pre>{@code
 * {
 *   "last_updated": "2024-05-01T10:00:00+02:00",
 *   "schema": {
 *     "contacts": {"columns": ["id", "name", ...], "last_updated": "..."}
 *   }
 * }
 * }</pre>
 */
public class StateStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(StateStore.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Path inputFile;
  private final Path outputFile;

  public StateStore(Path dataDir) {
    this(dataDir.resolve("in").resolve("state.json"), dataDir.resolve("out").resolve("state.json"));
  }

  public StateStore(Path inputFile, Path outputFile) {
    this.inputFile = inputFile;
    this.outputFile = outputFile;
  }

  /**
   * Loads the previous state. A missing or unreadable file yields an empty
   * state, since the extraction works from a cold start.
   */
  public RunState load() {
    if (!Files.exists(inputFile)) {
      LOGGER.info("No state file found at {}, starting from an empty state", inputFile);
      return RunState.empty();
    }
    JsonNode root;
    try {
      root = MAPPER.readTree(inputFile.toFile());
    } catch (IOException e) {
      LOGGER.warn("Could not read state file {}: {}. Starting from an empty state",
          inputFile, e.getMessage());
      return RunState.empty();
    }
    if (root == null || !root.isObject()) {
      return RunState.empty();
    }
    String lastUpdated = root.hasNonNull("last_updated")
        ? root.get("last_updated").asText()
        : null;
    Map<String, List<String>> columns = new LinkedHashMap<String, List<String>>();
    Map<String, String> updated = new LinkedHashMap<String, String>();
    JsonNode schema = root.path("schema");
    Iterator<Map.Entry<String, JsonNode>> it = schema.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      List<String> names = new ArrayList<String>();
      for (JsonNode column : entry.getValue().path("columns")) {
        names.add(column.asText());
      }
      columns.put(entry.getKey(), names);
      if (entry.getValue().hasNonNull("last_updated")) {
        updated.put(entry.getKey(), entry.getValue().get("last_updated").asText());
      }
    }
    LOGGER.debug("Loaded state: last_updated={}, {} stored schemas", lastUpdated, columns.size());
    return new RunState(lastUpdated, columns, updated);
  }

  public void save(RunState state) throws IOException {
    ObjectNode root = MAPPER.createObjectNode();
    if (state.getLastUpdated() != null) {
      root.put("last_updated", state.getLastUpdated());
    }
    ObjectNode schema = root.putObject("schema");
    for (Map.Entry<String, List<String>> entry : state.getColumns().entrySet()) {
      ObjectNode endpoint = schema.putObject(entry.getKey());
      ArrayNode columns = endpoint.putArray("columns");
      for (String column : entry.getValue()) {
        columns.add(column);
      }
      String updated = state.getColumnsUpdated().get(entry.getKey());
      if (updated != null) {
        endpoint.put("last_updated", updated);
      }
    }
    Files.createDirectories(outputFile.getParent());
    MAPPER.writerWithDefaultPrettyPrinter().writeValue(outputFile.toFile(), root);
    LOGGER.info("State saved to {}", outputFile);
  }
}
