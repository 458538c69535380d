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
package io.daktela.extractor.transform;

import io.daktela.extractor.config.EndpointSpec;

import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Converts raw Daktela records into flat rows.
 *
 * <p>Each record goes through a fixed sequence of steps:
 * <ol>
 *   <li>flatten nested objects into {@code parent_child} keys, merging at most
 *       two levels of nesting;</li>
 *   <li>strip HTML tags from string values, turning blank results into null;</li>
 *   <li>explode the configured list columns into one row per element;</li>
 *   <li>explode the configured list-of-object columns into one row per element,
 *       replacing the column with {@code <column>_<key>} columns;</li>
 *   <li>normalize column names with {@link ColumnNameNormalizer};</li>
 *   <li>put the synthesized {@code id} first: the primary then secondary key
 *       values joined with {@code _}, absent keys skipped.</li>
 * </ol>
 *
 * <p>With validation enabled a record missing any required field produces no
 * rows; its raw identifier field value is reported instead.
 *
 * <h3>Usage Example</h3>
 * <pre>{@code
 * RecordTransformer transformer = new RecordTransformer(spec, false);
 * TransformResult result = transformer.transform(page.getRecords());
 * sinkWriter.add(result.getRows());
 * }</pre>
 */
public class RecordTransformer {

  private static final Logger LOGGER = LoggerFactory.getLogger(RecordTransformer.class);

  /** Nested objects at this depth or deeper are kept as values. */
  static final int MAX_FLATTEN_DEPTH = 2;

  private static final Pattern HTML_TAG = Pattern.compile("<.*?>");

  private final EndpointSpec spec;
  private final boolean validate;

  public RecordTransformer(EndpointSpec spec, boolean validate) {
    this.spec = spec;
    this.validate = validate;
  }

  /**
   * Transforms a batch of records.
   */
  public TransformResult transform(List<Map<String, Object>> records) {
    List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>();
    List<String> invalid = new ArrayList<String>();
    int rejected = 0;
    for (Map<String, Object> record : records) {
      if (validate) {
        Map<String, Object> cleaned = clean(flatten(record));
        if (!hasRequiredFields(cleaned)) {
          rejected++;
          Object identifier = record.get(spec.getIdentifierField());
          if (identifier != null) {
            invalid.add(String.valueOf(identifier));
          }
          continue;
        }
      }
      rows.addAll(transformRecord(record));
    }
    if (rejected > 0) {
      LOGGER.warn("{}: dropped {} records missing required fields {}",
          spec.getName(), rejected, spec.getRequiredFields());
    }
    LOGGER.info("{}: transformed {} records into {} rows", spec.getName(), records.size(),
        rows.size());
    return new TransformResult(rows, invalid);
  }

  /**
   * Transforms one record, without the validity rule.
   *
   * @return Zero or more rows, each with {@code id} as its first column
   */
  public List<Map<String, Object>> transformRecord(Map<String, Object> record) {
    List<Map<String, Object>> rows = Collections.singletonList(clean(flatten(record)));
    for (String column : spec.getListColumns()) {
      rows = explodeList(rows, column);
    }
    for (String column : spec.getListOfDictsColumns()) {
      rows = explodeListOfDicts(rows, column);
    }
    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>(rows.size());
    for (Map<String, Object> row : rows) {
      result.add(withIdentifier(ColumnNameNormalizer.normalizeKeys(row)));
    }
    return result;
  }

  static Map<String, Object> flatten(Map<String, Object> record) {
    Map<String, Object> flat = new LinkedHashMap<String, Object>();
    flattenInto(flat, "", record, 0);
    return flat;
  }

  @SuppressWarnings("unchecked")
  private static void flattenInto(Map<String, Object> target, String prefix,
      Map<String, Object> source, int depth) {
    for (Map.Entry<String, Object> entry : source.entrySet()) {
      String key = prefix.isEmpty() ? entry.getKey() : prefix + "_" + entry.getKey();
      Object value = entry.getValue();
      if (value instanceof Map && depth < MAX_FLATTEN_DEPTH) {
        flattenInto(target, key, (Map<String, Object>) value, depth + 1);
      } else {
        target.put(key, value);
      }
    }
  }

  static Map<String, Object> clean(Map<String, Object> row) {
    Map<String, Object> cleaned = new LinkedHashMap<String, Object>(row.size() * 2);
    for (Map.Entry<String, Object> entry : row.entrySet()) {
      Object value = entry.getValue();
      if (value instanceof String) {
        value = cleanText((String) value);
      }
      cleaned.put(entry.getKey(), value);
    }
    return cleaned;
  }

  static @Nullable String cleanText(String text) {
    String stripped = HTML_TAG.matcher(text).replaceAll("");
    return isBlank(stripped) ? null : stripped;
  }

  private static boolean isBlank(String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (!Character.isWhitespace(c) && !Character.isSpaceChar(c)) {
        return false;
      }
    }
    return true;
  }

  static List<Map<String, Object>> explodeList(List<Map<String, Object>> rows, String column) {
    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>();
    for (Map<String, Object> row : rows) {
      Object value = row.get(column);
      if (!(value instanceof List) || ((List<?>) value).isEmpty()) {
        result.add(row);
        continue;
      }
      for (Object element : (List<?>) value) {
        Map<String, Object> copy = new LinkedHashMap<String, Object>(row);
        copy.put(column, element);
        result.add(copy);
      }
    }
    return result;
  }

  static List<Map<String, Object>> explodeListOfDicts(List<Map<String, Object>> rows,
      String column) {
    List<Map<String, Object>> result = new ArrayList<Map<String, Object>>();
    for (Map<String, Object> row : rows) {
      Object value = row.get(column);
      if (!(value instanceof List)) {
        result.add(row);
        continue;
      }
      Map<String, Object> base = new LinkedHashMap<String, Object>(row);
      base.remove(column);
      List<?> elements = (List<?>) value;
      if (elements.isEmpty()) {
        result.add(base);
        continue;
      }
      for (Object element : elements) {
        Map<String, Object> copy = new LinkedHashMap<String, Object>(base);
        if (element instanceof Map) {
          for (Map.Entry<?, ?> entry : ((Map<?, ?>) element).entrySet()) {
            copy.put(column + "_" + entry.getKey(), entry.getValue());
          }
        }
        result.add(copy);
      }
    }
    return result;
  }

  private Map<String, Object> withIdentifier(Map<String, Object> row) {
    List<String> parts = new ArrayList<String>();
    for (String key : spec.getKeyFields()) {
      Object value = row.get(ColumnNameNormalizer.normalize(key));
      if (value != null) {
        parts.add(String.valueOf(value));
      }
    }
    Map<String, Object> result = new LinkedHashMap<String, Object>(row.size() * 2 + 1);
    result.put("id", String.join("_", parts));
    for (Map.Entry<String, Object> entry : row.entrySet()) {
      if (!"id".equals(entry.getKey())) {
        result.put(entry.getKey(), entry.getValue());
      }
    }
    return result;
  }

  private boolean hasRequiredFields(Map<String, Object> cleaned) {
    for (String field : spec.getRequiredFields()) {
      Object value = cleaned.get(field);
      if (value == null || (value instanceof String && ((String) value).isEmpty())) {
        return false;
      }
    }
    return true;
  }
}
