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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-run state shared by the extraction tasks.
 *
 * <p>Holds the run-scoped table prefix, the identity-source names, the
 * invalid identifiers collected while extracting the identity source, the
 * column order stored by previous runs and the column order written in this
 * run. Mutable members are concurrent collections; the invalid set is
 * written in phase 2 by the identity-source task before any of its
 * dependents read it.
 */
public class ExtractionContext {

  private final String serverName;
  private final String identitySource;
  private final String identitySourceAlias;
  private final Map<String, List<String>> storedColumns;
  private final Set<String> invalidIdentifiers = ConcurrentHashMap.newKeySet();
  private final Map<String, List<String>> writtenColumns =
      new ConcurrentHashMap<String, List<String>>();

  public ExtractionContext(String serverName, String identitySource, String identitySourceAlias,
      Map<String, List<String>> storedColumns) {
    this.serverName = serverName;
    this.identitySource = identitySource;
    this.identitySourceAlias = identitySourceAlias;
    this.storedColumns = new LinkedHashMap<String, List<String>>(storedColumns);
  }

  public String getServerName() {
    return serverName;
  }

  /** Prefix of every output table and of identifiers read back from them. */
  public String getRunPrefix() {
    return serverName + "_";
  }

  public String tableName(String endpoint) {
    return getRunPrefix() + endpoint;
  }

  public String getIdentitySource() {
    return identitySource;
  }

  public String getIdentitySourceAlias() {
    return identitySourceAlias;
  }

  public boolean isIdentitySource(String endpoint) {
    return identitySource.equals(endpoint);
  }

  public List<String> getStoredColumns(String endpoint) {
    List<String> columns = storedColumns.get(endpoint);
    return columns != null ? columns : Collections.<String>emptyList();
  }

  public void addInvalidIdentifiers(Iterable<String> identifiers) {
    for (String identifier : identifiers) {
      invalidIdentifiers.add(identifier);
    }
  }

  public Set<String> getInvalidIdentifiers() {
    return Collections.unmodifiableSet(invalidIdentifiers);
  }

  void recordColumns(String endpoint, List<String> columns) {
    writtenColumns.put(endpoint, columns);
  }

  /** Column order written per endpoint in this run. */
  public Map<String, List<String>> getWrittenColumns() {
    return new LinkedHashMap<String, List<String>>(writtenColumns);
  }
}
