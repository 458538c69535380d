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
package io.daktela.extractor.client;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes filter clauses into Daktela query parameters.
 *
 * <p>Two encodings are used:
 * <ul>
 *   <li>a single clause is sent as the simple triplet
 *       {@code filter[field]}, {@code filter[operator]}, {@code filter[value]};</li>
 *   <li>several clauses are sent as an indexed array combined with AND logic:
 *       {@code filter[logic]=and}, {@code filter[filters][0][field]}, ...</li>
 * </ul>
 * No clauses produce no parameters.
 */
public final class FilterEncoder {

  private FilterEncoder() {
  }

  /**
   * Builds the date-range clauses for a filter field.
   *
   * @param filterField Field to filter on, or null when the endpoint takes no filter
   * @param from Lower bound, or null
   * @param to Upper bound, or null
   * @return Zero, one or two clauses
   */
  public static List<FilterClause> dateRange(@Nullable String filterField, @Nullable String from,
      @Nullable String to) {
    if (filterField == null || filterField.isEmpty()) {
      return Collections.emptyList();
    }
    List<FilterClause> clauses = new ArrayList<FilterClause>(2);
    if (from != null && !from.isEmpty()) {
      clauses.add(FilterClause.gte(filterField, from));
    }
    if (to != null && !to.isEmpty()) {
      clauses.add(FilterClause.lte(filterField, to));
    }
    return clauses;
  }

  /**
   * Encodes clauses as ordered query parameters.
   */
  public static Map<String, String> encode(List<FilterClause> clauses) {
    Map<String, String> params = new LinkedHashMap<String, String>();
    if (clauses == null || clauses.isEmpty()) {
      return params;
    }
    if (clauses.size() == 1) {
      FilterClause clause = clauses.get(0);
      params.put("filter[field]", clause.getField());
      params.put("filter[operator]", clause.getOperator());
      params.put("filter[value]", clause.getValue());
      return params;
    }
    params.put("filter[logic]", "and");
    for (int i = 0; i < clauses.size(); i++) {
      FilterClause clause = clauses.get(i);
      String prefix = "filter[filters][" + i + "]";
      params.put(prefix + "[field]", clause.getField());
      params.put(prefix + "[operator]", clause.getOperator());
      params.put(prefix + "[value]", clause.getValue());
    }
    return params;
  }
}
