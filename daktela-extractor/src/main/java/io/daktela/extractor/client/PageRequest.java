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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parameters of one list request: endpoint path, window and selections.
 */
public final class PageRequest {

  private final String endpoint;
  private final int offset;
  private final int limit;
  private final List<FilterClause> filters;
  private final List<String> fields;
  private final boolean filterFallback;

  public PageRequest(String endpoint, int offset, int limit, List<FilterClause> filters,
      List<String> fields, boolean filterFallback) {
    if (offset < 0 || limit <= 0) {
      throw new IllegalArgumentException("Invalid window: offset=" + offset + ", limit=" + limit);
    }
    this.endpoint = endpoint;
    this.offset = offset;
    this.limit = limit;
    this.filters = filters != null
        ? Collections.unmodifiableList(new ArrayList<FilterClause>(filters))
        : Collections.<FilterClause>emptyList();
    this.fields = fields != null
        ? Collections.unmodifiableList(new ArrayList<String>(fields))
        : Collections.<String>emptyList();
    this.filterFallback = filterFallback;
  }

  public String getEndpoint() {
    return endpoint;
  }

  public int getOffset() {
    return offset;
  }

  public int getLimit() {
    return limit;
  }

  public List<FilterClause> getFilters() {
    return filters;
  }

  public List<String> getFields() {
    return fields;
  }

  /** Whether a filter rejection may be recovered by a filterless retry. */
  public boolean isFilterFallback() {
    return filterFallback;
  }

  /** Same request at another offset. */
  public PageRequest atOffset(int newOffset) {
    return new PageRequest(endpoint, newOffset, limit, filters, fields, filterFallback);
  }

  /** Same request without filter parameters. */
  public PageRequest withoutFilters() {
    return new PageRequest(endpoint, offset, limit, Collections.<FilterClause>emptyList(), fields,
        false);
  }

  @Override public String toString() {
    return endpoint + "[skip=" + offset + ", take=" + limit
        + (filters.isEmpty() ? "" : ", filters=" + filters) + "]";
  }
}
