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

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Normalizes record keys into storage-safe column names.
 *
 * <p>Diacritics are stripped, every character outside {@code [A-Za-z0-9_]}
 * becomes {@code _}, and names that are empty or start with a digit get a
 * leading {@code _}. The mapping is a pure function of the input string.
 */
public final class ColumnNameNormalizer {

  private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
  private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_]");

  private ColumnNameNormalizer() {
  }

  public static String normalize(String name) {
    String decomposed = Normalizer.normalize(name, Normalizer.Form.NFKD);
    String ascii = COMBINING_MARKS.matcher(decomposed).replaceAll("");
    String safe = UNSAFE.matcher(ascii).replaceAll("_");
    if (safe.isEmpty() || Character.isDigit(safe.charAt(0))) {
      safe = "_" + safe;
    }
    return safe;
  }

  /**
   * Normalizes every key of a row, keeping insertion order. When two keys map
   * to the same column name the later one is suffixed {@code _2}, {@code _3}, ...
   */
  public static Map<String, Object> normalizeKeys(Map<String, Object> row) {
    Map<String, Object> result = new LinkedHashMap<String, Object>(row.size() * 2);
    for (Map.Entry<String, Object> entry : row.entrySet()) {
      String column = normalize(entry.getKey());
      if (result.containsKey(column)) {
        int suffix = 2;
        while (result.containsKey(column + "_" + suffix)) {
          suffix++;
        }
        column = column + "_" + suffix;
      }
      result.put(column, entry.getValue());
    }
    return result;
  }
}
