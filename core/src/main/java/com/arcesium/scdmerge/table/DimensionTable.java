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
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * An immutable table value: an ordered list of columns and a list of rows, each row holding exactly
 * the table's columns. Source batches, target snapshots and merged snapshots are all
 * DimensionTables.
 */
public final class DimensionTable {
  private static final DimensionTable EMPTY = new DimensionTable(ImmutableList.of(), List.of());

  private final ImmutableList<String> columns;
  private final ImmutableList<Row> rows;

  private DimensionTable(List<String> columns, List<Row> rows) {
    this.columns = ImmutableList.copyOf(columns);
    this.rows = ImmutableList.copyOf(rows);
  }

  /**
   * Creates a table from columns and rows. Each row is projected onto the columns; a row holding a
   * column the table does not declare is rejected.
   *
   * @param columns The column names, in order.
   * @param rows The rows.
   * @return A new DimensionTable.
   * @throws ValidationException if columns repeat or a row carries an undeclared column
   */
  public static DimensionTable of(List<String> columns, List<Row> rows) {
    ValidationException.checkNotNull(columns, "Columns cannot be null.");
    ValidationException.checkNotNull(rows, "Rows cannot be null.");
    Set<String> columnSet = new LinkedHashSet<>(columns);
    ValidationException.check(
        columnSet.size() == columns.size(), "Duplicate column names in %s", columns);
    List<Row> projected = new ArrayList<>(rows.size());
    for (Row row : rows) {
      ValidationException.checkNotNull(row, "Rows cannot contain null.");
      for (String column : row.columns()) {
        if (!columnSet.contains(column)) {
          throw new ValidationException("Column %s does not exist.", column);
        }
      }
      projected.add(row.project(columns));
    }
    return new DimensionTable(columns, projected);
  }

  /**
   * Creates a table whose columns are the union of the rows' columns in first-seen order.
   *
   * @param rows The rows.
   * @return A new DimensionTable.
   */
  public static DimensionTable ofRows(List<Row> rows) {
    Set<String> columns = new LinkedHashSet<>();
    rows.forEach(r -> columns.addAll(r.columns()));
    return of(new ArrayList<>(columns), rows);
  }

  /**
   * Returns the table with no columns and no rows.
   *
   * @return The empty table.
   */
  public static DimensionTable empty() {
    return EMPTY;
  }

  /**
   * Starts a table with the given columns; rows are added positionally.
   *
   * @param columns The column names.
   * @return A Builder.
   */
  public static Builder builder(String... columns) {
    return new Builder(Arrays.asList(columns));
  }

  public List<String> columns() {
    return columns;
  }

  public List<Row> rows() {
    return rows;
  }

  public int size() {
    return rows.size();
  }

  public boolean isEmpty() {
    return rows.isEmpty();
  }

  public boolean hasColumn(String column) {
    return columns.contains(column);
  }

  /**
   * Applies a transform to this table. This is how merge results are chained into further named
   * transformations.
   *
   * @param transform The transform to apply.
   * @return The transformed table.
   */
  public DimensionTable transform(TableTransform transform) {
    ValidationException.checkNotNull(transform, "Transform cannot be null.");
    DimensionTable result = transform.apply(this);
    ValidationException.checkNotNull(result, "Transform %s returned null.", transform.name());
    return result;
  }

  /**
   * Keeps the rows matching a predicate.
   *
   * @param predicate The row predicate.
   * @return A new DimensionTable.
   */
  public DimensionTable filter(Predicate<Row> predicate) {
    return new DimensionTable(
        columns, rows.stream().filter(predicate).collect(Collectors.toList()));
  }

  /**
   * Adds or replaces a column computed from each row. A new column is appended at the end.
   *
   * @param column The column name.
   * @param valueFunction Computes the value of the column for a row.
   * @return A new DimensionTable.
   */
  public DimensionTable withColumn(String column, Function<Row, Object> valueFunction) {
    List<String> newColumns = new ArrayList<>(columns);
    if (!newColumns.contains(column)) {
      newColumns.add(column);
    }
    List<Row> newRows =
        rows.stream()
            .map(r -> r.with(column, valueFunction.apply(r)).project(newColumns))
            .collect(Collectors.toList());
    return new DimensionTable(newColumns, newRows);
  }

  /**
   * Keeps only the given columns, in the given order.
   *
   * @param selectedColumns The columns to keep.
   * @return A new DimensionTable.
   * @throws ValidationException if a column does not exist
   */
  public DimensionTable select(List<String> selectedColumns) {
    for (String column : selectedColumns) {
      ValidationException.check(columns.contains(column), "Column %s does not exist.", column);
    }
    return new DimensionTable(
        selectedColumns,
        rows.stream().map(r -> r.project(selectedColumns)).collect(Collectors.toList()));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof DimensionTable)) {
      return false;
    }
    DimensionTable that = (DimensionTable) o;
    return columns.equals(that.columns) && rows.equals(that.rows);
  }

  @Override
  public int hashCode() {
    return Objects.hash(columns, rows);
  }

  @Override
  public String toString() {
    return "DimensionTable{" + "columns=" + columns + ", rows=" + rows.size() + '}';
  }

  /** Positional builder for tables, mostly useful for small batches and fixtures. */
  public static class Builder {
    private final List<String> columns;
    private final List<Row> rows = new ArrayList<>();

    private Builder(List<String> columns) {
      this.columns = columns;
    }

    /**
     * Adds a row whose values follow the builder's column order.
     *
     * @param values The values.
     * @return This Builder.
     */
    public Builder addRow(Object... values) {
      rows.add(Row.ofPositional(columns, values));
      return this;
    }

    /**
     * Adds a row.
     *
     * @param row The row.
     * @return This Builder.
     */
    public Builder addRow(Row row) {
      rows.add(row);
      return this;
    }

    public DimensionTable build() {
      return DimensionTable.of(columns, rows);
    }
  }
}
