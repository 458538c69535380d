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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Records returned by one offset/limit request.
 *
 * <p>{@link #getTotal()} is the collection size reported by the API; it is only
 * relied upon for the first request of a sequence.
 */
public class Page {

  private final List<Map<String, Object>> records;
  private final int total;
  private final boolean filtersApplied;

  public Page(List<Map<String, Object>> records, int total, boolean filtersApplied) {
    this.records = Collections.unmodifiableList(records);
    this.total = total;
    this.filtersApplied = filtersApplied;
  }

  public static Page empty() {
    return new Page(Collections.<Map<String, Object>>emptyList(), 0, true);
  }

  public List<Map<String, Object>> getRecords() {
    return records;
  }

  public int size() {
    return records.size();
  }

  public int getTotal() {
    return total;
  }

  /**
   * Returns false when the endpoint rejected the filters and the page was
   * served by the filterless fallback request.
   */
  public boolean isFiltersApplied() {
    return filtersApplied;
  }
}
