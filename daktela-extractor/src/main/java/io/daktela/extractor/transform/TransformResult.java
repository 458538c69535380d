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

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Rows produced from a batch of raw records plus the identifiers of records
 * rejected by the validity rule.
 */
public class TransformResult {

  private final List<Map<String, Object>> rows;
  private final List<String> invalidIdentifiers;

  public TransformResult(List<Map<String, Object>> rows, List<String> invalidIdentifiers) {
    this.rows = Collections.unmodifiableList(rows);
    this.invalidIdentifiers = Collections.unmodifiableList(invalidIdentifiers);
  }

  public List<Map<String, Object>> getRows() {
    return rows;
  }

  public List<String> getInvalidIdentifiers() {
    return invalidIdentifiers;
  }
}
