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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Tests for {@link FilterEncoder}.
 */
@Tag("unit")
public class FilterEncoderTest {

  @Test void testNoBoundsNoParameters() {
    List<FilterClause> clauses = FilterEncoder.dateRange("edited", null, null);

    assertTrue(clauses.isEmpty());
    assertTrue(FilterEncoder.encode(clauses).isEmpty());
  }

  @Test void testNoFilterFieldNoParameters() {
    assertTrue(FilterEncoder.dateRange(null, "2024-01-01 00:00:00", "2024-02-01 00:00:00")
        .isEmpty());
  }

  @Test void testLowerBoundOnlyUsesTriplet() {
    Map<String, String> params = FilterEncoder.encode(
        FilterEncoder.dateRange("edited", "2024-01-01 00:00:00", null));

    assertEquals(3, params.size());
    assertEquals("edited", params.get("filter[field]"));
    assertEquals("gte", params.get("filter[operator]"));
    assertEquals("2024-01-01 00:00:00", params.get("filter[value]"));
    assertFalse(params.containsKey("filter[logic]"));
  }

  @Test void testBothBoundsUseIndexedArray() {
    Map<String, String> params = FilterEncoder.encode(
        FilterEncoder.dateRange("time", "2024-01-01 00:00:00", "2024-02-01 00:00:00"));

    assertEquals(Arrays.asList(
        "filter[logic]",
        "filter[filters][0][field]", "filter[filters][0][operator]", "filter[filters][0][value]",
        "filter[filters][1][field]", "filter[filters][1][operator]", "filter[filters][1][value]"),
        new ArrayList<String>(params.keySet()));
    assertEquals("and", params.get("filter[logic]"));
    assertEquals("time", params.get("filter[filters][0][field]"));
    assertEquals("gte", params.get("filter[filters][0][operator]"));
    assertEquals("lte", params.get("filter[filters][1][operator]"));
    assertEquals("2024-02-01 00:00:00", params.get("filter[filters][1][value]"));
    assertFalse(params.containsKey("filter[field]"));
    assertFalse(params.containsKey("filter[filters][2][field]"));
  }
}
