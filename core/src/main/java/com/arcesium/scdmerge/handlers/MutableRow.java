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
package com.arcesium.scdmerge.handlers;

import com.arcesium.scdmerge.table.Row;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** A row under construction during the merge of one durable key. Never shared across keys. */
public final class MutableRow {
  private final Map<String, Object> values;
  private final boolean newVersion;

  private MutableRow(Map<String, Object> values, boolean newVersion) {
    this.values = values;
    this.newVersion = newVersion;
  }

  /** Copies an existing target row. */
  static MutableRow copyOf(Row row) {
    return new MutableRow(new LinkedHashMap<>(row.asMap()), false);
  }

  /** Starts a new version row carrying the values of the given row. */
  static MutableRow newVersionOf(MutableRow row) {
    return new MutableRow(new LinkedHashMap<>(row.values), true);
  }

  /** Starts a new version row holding nothing but the durable key. */
  static MutableRow newVersion(List<String> keyColumns, Row sourceRow) {
    Map<String, Object> values = new LinkedHashMap<>();
    keyColumns.forEach(k -> values.put(k, sourceRow.get(k)));
    return new MutableRow(values, true);
  }

  /** Starts the single row of a new member in a dimension without versioning. */
  static MutableRow newFlatRow(List<String> keyColumns, Row sourceRow) {
    Map<String, Object> values = new LinkedHashMap<>();
    keyColumns.forEach(k -> values.put(k, sourceRow.get(k)));
    return new MutableRow(values, false);
  }

  public Object get(String column) {
    return values.get(column);
  }

  public void set(String column, Object value) {
    values.put(column, value);
  }

  /**
   * Whether this row was created by the merge and still needs a surrogate key.
   *
   * @return true for new version rows
   */
  public boolean isNewVersion() {
    return newVersion;
  }

  /**
   * Freezes the row into the given column layout.
   *
   * @param columns The output columns.
   * @return The immutable row.
   */
  public Row toRow(List<String> columns) {
    return Row.of(values).project(columns);
  }

  @Override
  public String toString() {
    return "MutableRow{" + "values=" + values + ", newVersion=" + newVersion + '}';
  }
}
