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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes tables as CSV files with a JSON manifest.
 *
 * <p>For table {@code t} the sink writes {@code <dir>/t.csv}, with a header
 * row on the first batch of the run, and on finalization
 * {@code <dir>/t.csv.manifest} holding {@code incremental},
 * {@code primary_key}, {@code columns} and {@code has_header}.
 *
 * <p>Null values are written as empty strings; lists and objects that
 * survived the transformation are written as JSON.
 */
public class CsvTableSink implements RowSink, IdentifierSource {

  private static final Logger LOGGER = LoggerFactory.getLogger(CsvTableSink.class);
  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final Path tablesDir;
  private final Set<String> started = new HashSet<String>();
  private final Map<String, TableMetadata> metadata = new LinkedHashMap<String, TableMetadata>();

  public CsvTableSink(Path tablesDir) {
    this.tablesDir = tablesDir;
  }

  public Path getTablesDir() {
    return tablesDir;
  }

  Path csvPath(String table) {
    return tablesDir.resolve(table + ".csv");
  }

  Path manifestPath(String table) {
    return tablesDir.resolve(table + ".csv.manifest");
  }

  @Override public synchronized void writeRows(String table, List<Map<String, Object>> rows,
      List<String> columns, List<String> primaryKeys, boolean incremental) throws IOException {
    Files.createDirectories(tablesDir);
    boolean first = started.add(table);
    StandardOpenOption mode = first
        ? StandardOpenOption.TRUNCATE_EXISTING
        : StandardOpenOption.APPEND;
    try (Writer out = Files.newBufferedWriter(csvPath(table), StandardCharsets.UTF_8,
        StandardOpenOption.CREATE, StandardOpenOption.WRITE, mode);
         CSVWriter writer = new CSVWriter(out)) {
      if (first) {
        writer.writeNext(columns.toArray(new String[0]));
      }
      for (Map<String, Object> row : rows) {
        String[] line = new String[columns.size()];
        for (int i = 0; i < columns.size(); i++) {
          line[i] = render(row.get(columns.get(i)));
        }
        writer.writeNext(line);
      }
    }
    metadata.put(table, new TableMetadata(columns, primaryKeys, incremental));
    LOGGER.debug("Wrote {} rows to {}", rows.size(), csvPath(table));
  }

  @Override public synchronized void finalizeTable(String table) throws IOException {
    TableMetadata meta = metadata.get(table);
    if (meta == null) {
      throw new IllegalStateException("Table " + table + " was never written");
    }
    Map<String, Object> manifest = new LinkedHashMap<String, Object>();
    manifest.put("incremental", meta.incremental);
    manifest.put("primary_key", meta.primaryKeys);
    manifest.put("columns", meta.columns);
    manifest.put("has_header", true);
    MAPPER.writerWithDefaultPrettyPrinter().writeValue(manifestPath(table).toFile(), manifest);
    LOGGER.info("Finalized table {}", table);
  }

  @Override public synchronized List<String> readColumnValues(String table, String column)
      throws IOException {
    Path file = csvPath(table);
    if (!Files.exists(file)) {
      return Collections.emptyList();
    }
    List<String> values = new ArrayList<String>();
    try (Reader in = Files.newBufferedReader(file, StandardCharsets.UTF_8);
         CSVReader reader = new CSVReader(in)) {
      String[] header = reader.readNext();
      if (header == null) {
        return values;
      }
      int index = -1;
      for (int i = 0; i < header.length; i++) {
        if (column.equals(header[i])) {
          index = i;
          break;
        }
      }
      if (index < 0) {
        LOGGER.warn("Column '{}' not found in table {}", column, table);
        return values;
      }
      String[] line;
      while ((line = reader.readNext()) != null) {
        if (index < line.length && !line[index].isEmpty()) {
          values.add(line[index]);
        }
      }
    } catch (CsvValidationException e) {
      throw new IOException("Malformed CSV in " + file + ": " + e.getMessage(), e);
    }
    return values;
  }

  private static String render(Object value) throws JsonProcessingException {
    if (value == null) {
      return "";
    }
    if (value instanceof Map || value instanceof List) {
      return MAPPER.writeValueAsString(value);
    }
    return String.valueOf(value);
  }

  /** Manifest content recorded on the latest write. */
  private static class TableMetadata {
    final List<String> columns;
    final List<String> primaryKeys;
    final boolean incremental;

    TableMetadata(List<String> columns, List<String> primaryKeys, boolean incremental) {
      this.columns = new ArrayList<String>(columns);
      this.primaryKeys = new ArrayList<String>(primaryKeys);
      this.incremental = incremental;
    }
  }
}
