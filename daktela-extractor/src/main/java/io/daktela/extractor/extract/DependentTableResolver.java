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

import io.daktela.extractor.ExtractionException;
import io.daktela.extractor.client.RecordSource;
import io.daktela.extractor.config.EndpointSpec;
import io.daktela.extractor.sink.IdentifierSource;
import io.daktela.extractor.transform.RecordTransformer;
import io.daktela.extractor.transform.TransformResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Extracts a child endpoint one parent identifier at a time.
 *
 * <p>Parent identifiers are read back from the parent's output table and
 * normalized before use:
 * <ol>
 *   <li>the run prefix ({@code <server>_}) is stripped;</li>
 *   <li>for the identity source, identifiers in the invalid set are dropped,
 *       checked with and without the run prefix;</li>
 *   <li>one table prefix is stripped: {@code <parent>_}, then the identity
 *       source alias or the singular form ({@code <stem>y_} for names ending
 *       in {@code ies}, {@code <stem>_} for names ending in {@code s}).</li>
 * </ol>
 *
 * <p>A failure for one identifier is logged and skipped. Child requests carry
 * no date filter.
 */
public class DependentTableResolver {

  private static final Logger LOGGER = LoggerFactory.getLogger(DependentTableResolver.class);

  private final RecordSource source;
  private final IdentifierSource identifiers;
  private final ExtractionContext context;
  private final int pageLimit;

  public DependentTableResolver(RecordSource source, IdentifierSource identifiers,
      ExtractionContext context, int pageLimit) {
    this.source = source;
    this.identifiers = identifiers;
    this.context = context;
    this.pageLimit = pageLimit;
  }

  /**
   * Fetches, transforms and writes the child records of every parent.
   *
   * @param parent Parent endpoint
   * @param child Dependent endpoint
   * @param writer Writer of the child table; not finished by this method
   * @return Number of parent identifiers whose fetch failed
   * @throws IOException If the parent table cannot be read or rows cannot be written
   */
  public int resolve(EndpointSpec parent, EndpointSpec child, RecordTransformer transformer,
      TableBatchWriter writer) throws IOException {
    String parentTable = context.tableName(parent.getName());
    List<String> raw = identifiers.readColumnValues(parentTable, child.getParentIdField());
    LOGGER.info("Read {} parent IDs from column '{}' of {}", raw.size(),
        child.getParentIdField(), parentTable);
    if (raw.isEmpty()) {
      LOGGER.warn("No parent IDs found for dependent endpoint: {}", child.getName());
      return 0;
    }
    List<String> parentIds = normalizeParentIds(parent.getName(), raw);
    if (parentIds.isEmpty()) {
      LOGGER.warn("No valid parent IDs found after normalization for dependent endpoint: {}",
          child.getName());
      return 0;
    }

    int failures = 0;
    for (String parentId : parentIds) {
      List<Map<String, Object>> records;
      try {
        records = source.fetchDependent(parent.getEndpoint(), parentId, child.getChildEndpoint(),
            child.getFields(), pageLimit);
      } catch (IOException | ExtractionException e) {
        failures++;
        LOGGER.warn("Failed to fetch dependent endpoint {} for parent {}:{}: {}",
            child.getName(), parent.getName(), parentId, e.getMessage());
        continue;
      }
      if (!records.isEmpty()) {
        TransformResult result = transformer.transform(records);
        writer.add(result.getRows());
      }
    }
    if (failures > 0) {
      LOGGER.warn("{}: skipped {} of {} parent IDs after fetch failures", child.getName(),
          failures, parentIds.size());
    }
    return failures;
  }

  /**
   * Normalizes identifiers read from a parent table.
   *
   * @param parentName Parent endpoint name
   * @param rawIds Identifiers in stored order
   * @return Identifiers usable in per-parent request paths, in the same order
   */
  public List<String> normalizeParentIds(String parentName, List<String> rawIds) {
    String runPrefix = context.getRunPrefix();
    boolean identitySource = context.isIdentitySource(parentName);
    Set<String> invalid = context.getInvalidIdentifiers();
    List<String> prefixes = tablePrefixes(parentName, identitySource);

    List<String> cleaned = new ArrayList<String>(rawIds.size());
    int filtered = 0;
    for (String raw : rawIds) {
      String id = raw.startsWith(runPrefix) ? raw.substring(runPrefix.length()) : raw;
      if (identitySource && (invalid.contains(raw) || invalid.contains(id))) {
        filtered++;
        continue;
      }
      for (String prefix : prefixes) {
        if (id.startsWith(prefix)) {
          id = id.substring(prefix.length());
          break;
        }
      }
      cleaned.add(id);
    }
    if (filtered > 0) {
      LOGGER.info("Filtered out {} invalid {} IDs", filtered, parentName);
    }
    LOGGER.debug("Cleaned {} parent IDs using prefixes {}", cleaned.size(), prefixes);
    return cleaned;
  }

  private List<String> tablePrefixes(String parentName, boolean identitySource) {
    List<String> prefixes = new ArrayList<String>(2);
    prefixes.add(parentName + "_");
    if (identitySource) {
      prefixes.add(context.getIdentitySourceAlias() + "_");
    } else if (parentName.endsWith("ies")) {
      prefixes.add(parentName.substring(0, parentName.length() - 3) + "y_");
    } else if (parentName.endsWith("s")) {
      prefixes.add(parentName.substring(0, parentName.length() - 1) + "_");
    }
    return prefixes;
  }
}
