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
package io.daktela.extractor.extract;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Result of extracting one endpoint.
 */
public class ExtractionOutcome {

  private final String endpoint;
  private final String table;
  private final long rowsWritten;
  private final boolean successful;
  private final @Nullable String failureMessage;
  private final Set<String> invalidIdentifiers;

  private ExtractionOutcome(String endpoint, String table, long rowsWritten, boolean successful,
      @Nullable String failureMessage, Set<String> invalidIdentifiers) {
    this.endpoint = endpoint;
    this.table = table;
    this.rowsWritten = rowsWritten;
    this.successful = successful;
    this.failureMessage = failureMessage;
    this.invalidIdentifiers =
        Collections.unmodifiableSet(new LinkedHashSet<String>(invalidIdentifiers));
  }

  public static ExtractionOutcome success(String endpoint, String table, long rowsWritten,
      Set<String> invalidIdentifiers) {
    return new ExtractionOutcome(endpoint, table, rowsWritten, true, null, invalidIdentifiers);
  }

  public static ExtractionOutcome failure(String endpoint, String table, long rowsWritten,
      String message) {
    return new ExtractionOutcome(endpoint, table, rowsWritten, false, message,
        Collections.<String>emptySet());
  }

  public String getEndpoint() {
    return endpoint;
  }

  public String getTable() {
    return table;
  }

  public long getRowsWritten() {
    return rowsWritten;
  }

  public boolean isSuccessful() {
    return successful;
  }

  public @Nullable String getFailureMessage() {
    return failureMessage;
  }

  /**
   * Identifiers of records rejected by the validity rule. Only populated for
   * the identity-source endpoint.
   */
  public Set<String> getInvalidIdentifiers() {
    return invalidIdentifiers;
  }

  @Override public String toString() {
    return successful
        ? endpoint + ": " + rowsWritten + " rows -> " + table
        : endpoint + ": FAILED (" + failureMessage + ")";
  }
}
