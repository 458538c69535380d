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
package io.daktela.extractor.sink;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Destination of transformed rows.
 *
 * <p>{@link #writeRows} is called repeatedly with batches of one table;
 * {@link #finalizeTable} is called exactly once after the last batch.
 * Implementations must accept concurrent calls for different tables.
 */
public interface RowSink {

  /**
   * Appends a batch of rows.
   *
   * @param table Output table name
   * @param rows Rows keyed by column name
   * @param columns Column order of the table; row keys outside it are dropped
   * @param primaryKeys Primary key columns of the table
   * @param incremental Whether the destination loads incrementally
   * @throws IOException If the rows cannot be written
   */
  void writeRows(String table, List<Map<String, Object>> rows, List<String> columns,
      List<String> primaryKeys, boolean incremental) throws IOException;

  /**
   * Signals that no further rows will be written to the table.
   */
  void finalizeTable(String table) throws IOException;
}
