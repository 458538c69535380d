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
package io.daktela.extractor.extract;

import io.daktela.extractor.sink.IdentifierSource;
import io.daktela.extractor.sink.RowSink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Sink keeping rows in memory, readable back as an identifier source.
 */
class InMemorySink implements RowSink, IdentifierSource {

  final Map<String, List<Map<String, Object>>> rows =
      new LinkedHashMap<String, List<Map<String, Object>>>();
  final Map<String, List<String>> columns = new LinkedHashMap<String, List<String>>();
  final Map<String, List<Integer>> batchSizes = new LinkedHashMap<String, List<Integer>>();
  final Set<String> finalized = new LinkedHashSet<String>();

  @Override public synchronized void writeRows(String table, List<Map<String, Object>> batch,
      List<String> columnOrder, List<String> primaryKeys, boolean incremental) {
    if (finalized.contains(table)) {
      throw new IllegalStateException(table + " already finalized");
    }
    rows.computeIfAbsent(table, k -> new ArrayList<Map<String, Object>>()).addAll(batch);
    batchSizes.computeIfAbsent(table, k -> new ArrayList<Integer>()).add(batch.size());
    columns.put(table, new ArrayList<String>(columnOrder));
  }

  @Override public synchronized void finalizeTable(String table) {
    if (!finalized.add(table)) {
      throw new IllegalStateException(table + " finalized twice");
    }
  }

  @Override public synchronized List<String> readColumnValues(String table, String column) {
    List<Map<String, Object>> tableRows = rows.get(table);
    if (tableRows == null) {
      return Collections.emptyList();
    }
    List<String> values = new ArrayList<String>();
    for (Map<String, Object> row : tableRows) {
      Object value = row.get(column);
      if (value != null && !String.valueOf(value).isEmpty()) {
        values.add(String.valueOf(value));
      }
    }
    return values;
  }

  synchronized List<Map<String, Object>> rows(String table) {
    List<Map<String, Object>> tableRows = rows.get(table);
    return tableRows != null
        ? new ArrayList<Map<String, Object>>(tableRows)
        : Collections.<Map<String, Object>>emptyList();
  }
}
