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

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

/**
 * Tests for {@link ColumnNameNormalizer}.
 */
@Tag("unit")
public class ColumnNameNormalizerTest {

  @Test void testNormalize() {
    assertEquals("customFields_email", ColumnNameNormalizer.normalize("customFields_email"));
    assertEquals("Prilezitost", ColumnNameNormalizer.normalize("Příležitost"));
    assertEquals("a_b_c", ColumnNameNormalizer.normalize("a.b c"));
    assertEquals("_2fa", ColumnNameNormalizer.normalize("2fa"));
    assertEquals("_", ColumnNameNormalizer.normalize(""));
  }

  @Test void testStable() {
    assertEquals(ColumnNameNormalizer.normalize("Čas hovoru"),
        ColumnNameNormalizer.normalize("Čas hovoru"));
  }

  @Test void testCollisionsGetSuffixes() {
    Map<String, Object> row = new LinkedHashMap<String, Object>();
    row.put("a b", 1);
    row.put("a-b", 2);
    row.put("a.b", 3);

    Map<String, Object> normalized = ColumnNameNormalizer.normalizeKeys(row);

    assertEquals(1, normalized.get("a_b"));
    assertEquals(2, normalized.get("a_b_2"));
    assertEquals(3, normalized.get("a_b_3"));
  }
}
