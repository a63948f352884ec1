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
import com.arcesium.scdmerge.keys.DurableKey;
import java.util.List;

/**
 * The two access paths of a type 7 dimension. The type 1 view holds the current row of every
 * member and is looked up by durable key, so facts joined through it see today's attributes. The
 * type 2 view holds every version and is looked up by surrogate key, so facts see the attributes
 * in effect when they were recorded.
 */
public class DimensionViews {
  private final List<String> keyColumns;
  private final String surrogateKeyColumn;
  private final String currentFlagColumn;

  /**
   * Creates the views of a dimension layout.
   *
   * @param keyColumns The durable key columns.
   * @param surrogateKeyColumn The surrogate key column.
   * @param currentFlagColumn The current flag column.
   */
  public DimensionViews(
      List<String> keyColumns, String surrogateKeyColumn, String currentFlagColumn) {
    ValidationException.check(
        keyColumns != null && !keyColumns.isEmpty(), "Key columns cannot be empty.");
    this.keyColumns = List.copyOf(keyColumns);
    this.surrogateKeyColumn =
        ValidationException.checkNotNull(
            surrogateKeyColumn, "Surrogate key column cannot be null.");
    this.currentFlagColumn =
        ValidationException.checkNotNull(currentFlagColumn, "Current flag column cannot be null.");
  }

  /** Current rows only. */
  public DimensionTable type1View(DimensionTable dimension) {
    return dimension.transform(TableTransforms.currentRows(currentFlagColumn));
  }

  /** Every version. */
  public DimensionTable type2View(DimensionTable dimension) {
    return dimension;
  }

  /**
   * Finds the current row of a member.
   *
   * @param dimension The dimension.
   * @param keyValues The durable key values, in key column order.
   * @return The current row, or null if the member has none.
   */
  public Row findCurrent(DimensionTable dimension, Object... keyValues) {
    ValidationException.check(
        keyValues.length == keyColumns.size(),
        "Expected %d durable key values, got %d.",
        keyColumns.size(),
        keyValues.length);
    DurableKey key = DurableKey.of(keyValues);
    for (Row row : dimension.rows()) {
      if (Boolean.TRUE.equals(row.get(currentFlagColumn))
          && key.equals(DurableKey.from(row, keyColumns, "dimension"))) {
        return row;
      }
    }
    return null;
  }

  /**
   * Finds the version row holding a surrogate key.
   *
   * @param dimension The dimension.
   * @param surrogateKey The surrogate key.
   * @return The row, or null if no row holds the key.
   */
  public Row findVersion(DimensionTable dimension, Object surrogateKey) {
    ValidationException.checkNotNull(surrogateKey, "Surrogate key cannot be null.");
    for (Row row : dimension.rows()) {
      if (surrogateKey.equals(row.get(surrogateKeyColumn))) {
        return row;
      }
    }
    return null;
  }
}
