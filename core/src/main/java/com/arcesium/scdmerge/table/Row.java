/*
 * Copyright (c) 2025, Arcesium LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arcesium.scdmerge.table;

import com.arcesium.scdmerge.common.ValidationException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable row of a dimension table: an ordered mapping from column name to value. Values may
 * be null.
 */
public final class Row {
  private final Map<String, Object> values;

  private Row(Map<String, Object> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  /**
   * Creates a row holding a copy of the given values, in the map's iteration order.
   *
   * @param values The column values.
   * @return A new Row.
   */
  public static Row of(Map<String, ?> values) {
    ValidationException.checkNotNull(values, "Row values cannot be null.");
    return new Row(new LinkedHashMap<>(values));
  }

  /**
   * Creates a row from alternating column names and values, e.g. {@code Row.of("customer", "C1",
   * "credit_score", 730)}.
   *
   * @param columnsAndValues Column names at even positions, their values at odd positions.
   * @return A new Row.
   */
  public static Row of(Object... columnsAndValues) {
    ValidationException.check(
        columnsAndValues.length % 2 == 0, "Row.of expects an even number of arguments.");
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i < columnsAndValues.length; i += 2) {
      ValidationException.check(
          columnsAndValues[i] instanceof String,
          "Column name at position %d must be a string.",
          i);
      values.put((String) columnsAndValues[i], columnsAndValues[i + 1]);
    }
    return new Row(values);
  }

  /**
   * Creates a row from column names and values matched by position.
   *
   * @param columns The column names.
   * @param rowValues The values, in column order.
   * @return A new Row.
   */
  static Row ofPositional(List<String> columns, Object[] rowValues) {
    ValidationException.check(
        columns.size() == rowValues.length,
        "Expected %d values but got %d.",
        columns.size(),
        rowValues.length);
    Map<String, Object> values = new LinkedHashMap<>();
    for (int i = 0; i < rowValues.length; i++) {
      values.put(columns.get(i), rowValues[i]);
    }
    return new Row(values);
  }

  /**
   * Returns the value of a column, or null when the column is absent or holds null.
   *
   * @param column The column name.
   * @return The value.
   */
  public Object get(String column) {
    return values.get(column);
  }

  /**
   * Returns the value of a column cast to the given type.
   *
   * @param column The column name.
   * @param type The expected type.
   * @param <T> The expected type.
   * @return The value, or null.
   */
  public <T> T get(String column, Class<T> type) {
    return type.cast(values.get(column));
  }

  public boolean hasColumn(String column) {
    return values.containsKey(column);
  }

  public Set<String> columns() {
    return values.keySet();
  }

  /**
   * Returns the row as an unmodifiable map.
   *
   * @return The column values.
   */
  public Map<String, Object> asMap() {
    return values;
  }

  /**
   * Returns a copy of this row with one column set.
   *
   * @param column The column name.
   * @param value The new value.
   * @return A new Row.
   */
  public Row with(String column, Object value) {
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.put(column, value);
    return new Row(copy);
  }

  /**
   * Returns a copy of this row restricted to, and ordered by, the given columns. Columns the row
   * does not hold are filled with null.
   *
   * @param columns The columns to keep.
   * @return A new Row.
   */
  public Row project(List<String> columns) {
    Map<String, Object> projected = new LinkedHashMap<>();
    for (String column : columns) {
      projected.put(column, values.get(column));
    }
    return new Row(projected);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof Row)) {
      return false;
    }
    Row that = (Row) o;
    return Objects.equals(values, that.values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return "Row" + values;
  }
}
