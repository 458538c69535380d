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
package io.daktela.extractor.config;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Static description of one Daktela endpoint and how its records become rows.
 *
 * <p>An EndpointSpec names the API collection, optionally overrides the API
 * path, restricts the fetched fields, marks the endpoint as a child of another
 * endpoint, and configures the record transformation (identifier keys, list
 * explosion, validity rule).
 *
 * <h3>JSON Configuration Example</h3>
 * <pre>{@code
 * {
 *   "name": "ticketsActivities",
 *   "childEndpoint": "activities",
 *   "parentEndpoint": "tickets",
 *   "parentIdField": "name",
 *   "primaryKeys": ["name"],
 *   "listOfDictsColumns": ["attachments"]
 * }
 * }</pre>
 *
 * @see EndpointCatalog
 */
public class EndpointSpec {

  private final String name;
  private final String endpoint;
  private final String childEndpoint;
  private final List<String> fields;
  private final @Nullable String parentEndpoint;
  private final String parentIdField;
  private final List<String> primaryKeys;
  private final List<String> secondaryKeys;
  private final List<String> listColumns;
  private final List<String> listOfDictsColumns;
  private final @Nullable String filterField;
  private final boolean filterFragile;
  private final List<String> requiredFields;
  private final String identifierField;

  private EndpointSpec(Builder builder) {
    this.name = builder.name;
    this.endpoint = builder.endpoint != null ? builder.endpoint : builder.name;
    this.childEndpoint = builder.childEndpoint != null ? builder.childEndpoint : builder.name;
    this.fields = copy(builder.fields);
    this.parentEndpoint = builder.parentEndpoint;
    this.parentIdField = builder.parentIdField != null ? builder.parentIdField : "id";
    this.primaryKeys = copy(builder.primaryKeys);
    this.secondaryKeys = copy(builder.secondaryKeys);
    this.listColumns = copy(builder.listColumns);
    this.listOfDictsColumns = copy(builder.listOfDictsColumns);
    this.filterField = builder.filterField;
    this.filterFragile = builder.filterFragile;
    if (builder.requiredFields != null) {
      this.requiredFields = copy(builder.requiredFields);
    } else {
      List<String> keys = new ArrayList<String>(primaryKeys);
      keys.addAll(secondaryKeys);
      this.requiredFields = Collections.unmodifiableList(keys);
    }
    this.identifierField = builder.identifierField != null ? builder.identifierField : "name";
  }

  private static List<String> copy(@Nullable List<String> values) {
    return values != null
        ? Collections.unmodifiableList(new ArrayList<String>(values))
        : Collections.<String>emptyList();
  }

  /** Logical endpoint name; also the suffix of the output table name. */
  public String getName() {
    return name;
  }

  /** API path of the collection, relative to {@code api/v6/}. */
  public String getEndpoint() {
    return endpoint;
  }

  /** Path segment used below the parent for per-parent calls. */
  public String getChildEndpoint() {
    return childEndpoint;
  }

  public List<String> getFields() {
    return fields;
  }

  public @Nullable String getParentEndpoint() {
    return parentEndpoint;
  }

  public String getParentIdField() {
    return parentIdField;
  }

  public boolean isDependent() {
    return parentEndpoint != null && !parentEndpoint.isEmpty();
  }

  public List<String> getPrimaryKeys() {
    return primaryKeys;
  }

  public List<String> getSecondaryKeys() {
    return secondaryKeys;
  }

  /**
   * Returns primary keys followed by secondary keys, the order in which they
   * are joined into the synthesized {@code id}.
   */
  public List<String> getKeyFields() {
    List<String> keys = new ArrayList<String>(primaryKeys);
    keys.addAll(secondaryKeys);
    return keys;
  }

  public List<String> getListColumns() {
    return listColumns;
  }

  public List<String> getListOfDictsColumns() {
    return listOfDictsColumns;
  }

  /** Field the date range applies to, or null if the endpoint takes no date filter. */
  public @Nullable String getFilterField() {
    return filterField;
  }

  /** Whether the API is known to reject filter parameters on this endpoint. */
  public boolean isFilterFragile() {
    return filterFragile;
  }

  public List<String> getRequiredFields() {
    return requiredFields;
  }

  public String getIdentifierField() {
    return identifierField;
  }

  /**
   * Returns a copy of this spec with a different field selection.
   */
  public EndpointSpec withFields(List<String> newFields) {
    return toBuilder().fields(newFields).build();
  }

  public Builder toBuilder() {
    return builder()
        .name(name)
        .endpoint(endpoint)
        .childEndpoint(childEndpoint)
        .fields(fields)
        .parentEndpoint(parentEndpoint)
        .parentIdField(parentIdField)
        .primaryKeys(primaryKeys)
        .secondaryKeys(secondaryKeys)
        .listColumns(listColumns)
        .listOfDictsColumns(listOfDictsColumns)
        .filterField(filterField)
        .filterFragile(filterFragile)
        .requiredFields(requiredFields)
        .identifierField(identifierField);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates an EndpointSpec from a map, typically parsed from the endpoint
   * catalog. The {@code name} key may be absent if supplied separately.
   */
  public static EndpointSpec fromMap(String name, Map<String, Object> map) {
    Builder builder = builder().name(name);
    if (map == null) {
      return builder.build();
    }
    builder.endpoint(stringValue(map.get("endpoint")));
    builder.childEndpoint(stringValue(map.get("childEndpoint")));
    builder.fields(stringList(map.get("fields")));
    builder.parentEndpoint(stringValue(map.get("parentEndpoint")));
    builder.parentIdField(stringValue(map.get("parentIdField")));
    builder.primaryKeys(stringList(map.get("primaryKeys")));
    builder.secondaryKeys(stringList(map.get("secondaryKeys")));
    builder.listColumns(stringList(map.get("listColumns")));
    builder.listOfDictsColumns(stringList(map.get("listOfDictsColumns")));
    builder.filterField(stringValue(map.get("filterField")));
    Object fragile = map.get("filterFragile");
    if (fragile instanceof Boolean) {
      builder.filterFragile((Boolean) fragile);
    }
    if (map.containsKey("requiredFields")) {
      builder.requiredFields(stringList(map.get("requiredFields")));
    }
    builder.identifierField(stringValue(map.get("identifierField")));
    return builder.build();
  }

  private static @Nullable String stringValue(@Nullable Object value) {
    return value != null ? String.valueOf(value) : null;
  }

  static @Nullable List<String> stringList(@Nullable Object value) {
    if (!(value instanceof List)) {
      return null;
    }
    List<String> result = new ArrayList<String>();
    for (Object item : (List<?>) value) {
      if (item != null) {
        result.add(String.valueOf(item));
      }
    }
    return result;
  }

  @Override public String toString() {
    return "EndpointSpec{name=" + name
        + (isDependent() ? ", parent=" + parentEndpoint : "")
        + ", keys=" + getKeyFields() + "}";
  }

  /**
   * Builder for EndpointSpec.
   */
  public static class Builder {
    private String name;
    private String endpoint;
    private String childEndpoint;
    private List<String> fields;
    private String parentEndpoint;
    private String parentIdField;
    private List<String> primaryKeys;
    private List<String> secondaryKeys;
    private List<String> listColumns;
    private List<String> listOfDictsColumns;
    private String filterField;
    private boolean filterFragile;
    private List<String> requiredFields;
    private String identifierField;

    public Builder name(String name) {
      this.name = name;
      return this;
    }

    public Builder endpoint(@Nullable String endpoint) {
      this.endpoint = endpoint;
      return this;
    }

    public Builder childEndpoint(@Nullable String childEndpoint) {
      this.childEndpoint = childEndpoint;
      return this;
    }

    public Builder fields(@Nullable List<String> fields) {
      this.fields = fields;
      return this;
    }

    public Builder parentEndpoint(@Nullable String parentEndpoint) {
      this.parentEndpoint = parentEndpoint;
      return this;
    }

    public Builder parentIdField(@Nullable String parentIdField) {
      this.parentIdField = parentIdField;
      return this;
    }

    public Builder primaryKeys(@Nullable List<String> primaryKeys) {
      this.primaryKeys = primaryKeys;
      return this;
    }

    public Builder secondaryKeys(@Nullable List<String> secondaryKeys) {
      this.secondaryKeys = secondaryKeys;
      return this;
    }

    public Builder listColumns(@Nullable List<String> listColumns) {
      this.listColumns = listColumns;
      return this;
    }

    public Builder listOfDictsColumns(@Nullable List<String> listOfDictsColumns) {
      this.listOfDictsColumns = listOfDictsColumns;
      return this;
    }

    public Builder filterField(@Nullable String filterField) {
      this.filterField = filterField;
      return this;
    }

    public Builder filterFragile(boolean filterFragile) {
      this.filterFragile = filterFragile;
      return this;
    }

    public Builder requiredFields(@Nullable List<String> requiredFields) {
      this.requiredFields = requiredFields;
      return this;
    }

    public Builder identifierField(@Nullable String identifierField) {
      this.identifierField = identifierField;
      return this;
    }

    public EndpointSpec build() {
      if (name == null || name.isEmpty()) {
        throw new IllegalArgumentException("Endpoint name is required");
      }
      return new EndpointSpec(this);
    }
  }
}
