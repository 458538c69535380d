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

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * State carried between runs: the timestamp of the last successful run and
 * the column order last written per endpoint.
 */
public class RunState {

  private final @Nullable String lastUpdated;
  private final Map<String, List<String>> columns;
  private final Map<String, String> columnsUpdated;

  public RunState(@Nullable String lastUpdated, Map<String, List<String>> columns,
      Map<String, String> columnsUpdated) {
    this.lastUpdated = lastUpdated;
    Map<String, List<String>> copy = new LinkedHashMap<String, List<String>>();
    for (Map.Entry<String, List<String>> e : columns.entrySet()) {
      copy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<String>(e.getValue())));
    }
    this.columns = Collections.unmodifiableMap(copy);
    this.columnsUpdated = Collections.unmodifiableMap(
        new LinkedHashMap<String, String>(columnsUpdated));
  }

  public static RunState empty() {
    return new RunState(null, Collections.<String, List<String>>emptyMap(),
        Collections.<String, String>emptyMap());
  }

  /** Timestamp of the last successful run, null on a cold start. */
  public @Nullable String getLastUpdated() {
    return lastUpdated;
  }

  /** Stored column order per endpoint name. */
  public Map<String, List<String>> getColumns() {
    return columns;
  }

  public Map<String, String> getColumnsUpdated() {
    return columnsUpdated;
  }

  /**
   * Returns the state after a successful run at {@code timestamp}. Endpoints
   * written in the run replace their stored columns; others are kept.
   */
  public RunState afterRun(String timestamp, Map<String, List<String>> written) {
    Map<String, List<String>> mergedColumns = new LinkedHashMap<String, List<String>>(columns);
    Map<String, String> mergedUpdated = new LinkedHashMap<String, String>(columnsUpdated);
    for (Map.Entry<String, List<String>> e : written.entrySet()) {
      mergedColumns.put(e.getKey(), e.getValue());
      mergedUpdated.put(e.getKey(), timestamp);
    }
    return new RunState(timestamp, mergedColumns, mergedUpdated);
  }
}
