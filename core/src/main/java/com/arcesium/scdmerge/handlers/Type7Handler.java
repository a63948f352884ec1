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

import com.arcesium.scdmerge.common.ValidationException;
import com.arcesium.scdmerge.policy.ScdType;
import com.arcesium.scdmerge.table.Row;
import java.util.List;

/**
 * Type 7: versions the column like type 2. Rows of a type 7 dimension are reachable both by
 * durable key and by surrogate key, so neither may be null on any row.
 */
public class Type7Handler extends Type2Handler {
  @Override
  public ScdType getType() {
    return ScdType.TYPE_7;
  }

  /**
   * Checks that every row carries its durable key and its surrogate key.
   *
   * @param rows The rows of the merged dimension.
   * @param keyColumns The durable key columns.
   * @param surrogateKeyColumn The surrogate key column.
   * @throws ValidationException if a key is null
   */
  public static void verifyKeys(
      List<Row> rows, List<String> keyColumns, String surrogateKeyColumn) {
    for (Row row : rows) {
      for (String keyColumn : keyColumns) {
        ValidationException.check(
            row.get(keyColumn) != null,
            "Durable key column %s is null in row %s of a type 7 dimension.",
            keyColumn,
            row);
      }
      ValidationException.check(
          row.get(surrogateKeyColumn) != null,
          "Surrogate key column %s is null in row %s of a type 7 dimension.",
          surrogateKeyColumn,
          row);
    }
  }
}
