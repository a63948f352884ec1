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
import java.util.Arrays;
import java.util.List;
import java.util.function.Predicate;

/** Ready-made transforms for use in a {@link TransformPipeline}. */
public class TableTransforms {
  private TableTransforms() {}

  /**
   * Adds a column holding the same value on every row.
   *
   * @param column The column name.
   * @param value The constant value.
   * @return The transform.
   */
  public static TableTransform withColumn(String column, Object value) {
    ValidationException.checkNotNull(column, "Column name cannot be null.");
    return TableTransform.named("with_" + column, t -> t.withColumn(column, r -> value));
  }

  /**
   * Drops the rows matching a predicate.
   *
   * @param name The transform name.
   * @param predicate Rows matching this predicate are removed.
   * @return The transform.
   */
  public static TableTransform excludeWhere(String name, Predicate<Row> predicate) {
    ValidationException.checkNotNull(predicate, "Predicate cannot be null.");
    return TableTransform.named(name, t -> t.filter(predicate.negate()));
  }

  /**
   * Keeps only the given columns.
   *
   * @param columns The columns to keep, in order.
   * @return The transform.
   */
  public static TableTransform select(String... columns) {
    List<String> selected = Arrays.asList(columns);
    return TableTransform.named("select", t -> t.select(selected));
  }

  /**
   * Keeps the rows whose current flag is true.
   *
   * @param currentFlagColumn The name of the current flag column.
   * @return The transform.
   */
  public static TableTransform currentRows(String currentFlagColumn) {
    return TableTransform.named(
        "current_rows", t -> t.filter(r -> Boolean.TRUE.equals(r.get(currentFlagColumn))));
  }
}
