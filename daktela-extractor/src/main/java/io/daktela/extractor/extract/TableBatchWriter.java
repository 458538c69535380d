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

import io.daktela.extractor.sink.RowSink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Buffers rows of one table and hands them to the sink in fixed-size batches.
 *
 * <p>The column order is fixed on the first flush: {@code id}, then the
 * columns stored by previous runs, then new columns of the first row. The
 * table is finalized by {@link #finish()} only when at least one row was
 * written.
 */
public class TableBatchWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TableBatchWriter.class);

  static final List<String> PRIMARY_KEY = Collections.singletonList("id");

  private final String endpoint;
  private final String table;
  private final RowSink sink;
  private final ExtractionContext context;
  private final int batchSize;
  private final boolean incremental;

  private final List<Map<String, Object>> buffer = new ArrayList<Map<String, Object>>();
  private List<String> columns;
  private long rowsWritten;

  public TableBatchWriter(String endpoint, String table, RowSink sink, ExtractionContext context,
      int batchSize, boolean incremental) {
    this.endpoint = endpoint;
    this.table = table;
    this.sink = sink;
    this.context = context;
    this.batchSize = batchSize;
    this.incremental = incremental;
  }

  public void add(List<Map<String, Object>> rows) throws IOException {
    buffer.addAll(rows);
    while (buffer.size() >= batchSize) {
      List<Map<String, Object>> batch =
          new ArrayList<Map<String, Object>>(buffer.subList(0, batchSize));
      buffer.subList(0, batchSize).clear();
      write(batch);
    }
  }

  /**
   * Writes buffered rows and finalizes the table.
   *
   * @return Number of rows written
   */
  public long finish() throws IOException {
    if (!buffer.isEmpty()) {
      List<Map<String, Object>> batch = new ArrayList<Map<String, Object>>(buffer);
      buffer.clear();
      write(batch);
    }
    if (rowsWritten == 0) {
      LOGGER.warn("No data found for endpoint: {}", endpoint);
      return 0;
    }
    sink.finalizeTable(table);
    context.recordColumns(endpoint, columns);
    LOGGER.info("Completed extraction for endpoint {}: {} rows", endpoint, rowsWritten);
    return rowsWritten;
  }

  public long getRowsWritten() {
    return rowsWritten;
  }

  private void write(List<Map<String, Object>> batch) throws IOException {
    if (columns == null) {
      columns = columnOrder(context.getStoredColumns(endpoint), batch.get(0));
    }
    sink.writeRows(table, batch, columns, PRIMARY_KEY, incremental);
    rowsWritten += batch.size();
    LOGGER.debug("Wrote batch of {} rows for endpoint {}", batch.size(), endpoint);
  }

  static List<String> columnOrder(List<String> stored, Map<String, Object> firstRow) {
    Set<String> order = new LinkedHashSet<String>();
    order.add("id");
    order.addAll(stored);
    order.addAll(firstRow.keySet());
    return new ArrayList<String>(order);
  }
}
