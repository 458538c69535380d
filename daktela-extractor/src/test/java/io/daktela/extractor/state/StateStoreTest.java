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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link StateStore} and {@link RunState}.
 */
@Tag("unit")
public class StateStoreTest {

  @Test void testColdStart(@TempDir Path dir) {
    RunState state = new StateStore(dir).load();

    assertNull(state.getLastUpdated());
    assertTrue(state.getColumns().isEmpty());
  }

  @Test void testCorruptFileIsIgnored(@TempDir Path dir) throws Exception {
    Files.createDirectories(dir.resolve("in"));
    Files.write(dir.resolve("in/state.json"), "{not json".getBytes(StandardCharsets.UTF_8));

    assertNull(new StateStore(dir).load().getLastUpdated());
  }

  @Test void testSaveThenLoad(@TempDir Path dir) throws Exception {
    Map<String, List<String>> columns = new LinkedHashMap<String, List<String>>();
    columns.put("contacts", Arrays.asList("id", "name"));
    RunState previous = new RunState("2024-05-01T10:00:00+02:00", columns,
        new LinkedHashMap<String, String>());

    Map<String, List<String>> written = new LinkedHashMap<String, List<String>>();
    written.put("tickets", Arrays.asList("id", "title"));
    RunState next = previous.afterRun("2024-05-02T10:00:00+02:00", written);

    StateStore store = new StateStore(dir);
    store.save(next);
    Files.createDirectories(dir.resolve("in"));
    Files.copy(dir.resolve("out/state.json"), dir.resolve("in/state.json"));
    RunState loaded = store.load();

    assertEquals("2024-05-02T10:00:00+02:00", loaded.getLastUpdated());
    assertEquals(Arrays.asList("id", "name"), loaded.getColumns().get("contacts"));
    assertEquals(Arrays.asList("id", "title"), loaded.getColumns().get("tickets"));
    assertEquals("2024-05-02T10:00:00+02:00", loaded.getColumnsUpdated().get("tickets"));
    assertNull(loaded.getColumnsUpdated().get("contacts"));
  }
}
