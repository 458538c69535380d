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

import java.util.Objects;

/**
 * One {@code field operator value} filter condition.
 */
public final class FilterClause {

  private final String field;
  private final String operator;
  private final String value;

  public FilterClause(String field, String operator, String value) {
    this.field = Objects.requireNonNull(field, "field");
    this.operator = Objects.requireNonNull(operator, "operator");
    this.value = Objects.requireNonNull(value, "value");
  }

  /** Lower bound: {@code field >= value}. */
  public static FilterClause gte(String field, String value) {
    return new FilterClause(field, "gte", value);
  }

  /** Upper bound: {@code field <= value}. */
  public static FilterClause lte(String field, String value) {
    return new FilterClause(field, "lte", value);
  }

  public String getField() {
    return field;
  }

  public String getOperator() {
    return operator;
  }

  public String getValue() {
    return value;
  }

  @Override public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FilterClause)) {
      return false;
    }
    FilterClause that = (FilterClause) o;
    return field.equals(that.field) && operator.equals(that.operator) && value.equals(that.value);
  }

  @Override public int hashCode() {
    return Objects.hash(field, operator, value);
  }

  @Override public String toString() {
    return field + " " + operator + " " + value;
  }
}
