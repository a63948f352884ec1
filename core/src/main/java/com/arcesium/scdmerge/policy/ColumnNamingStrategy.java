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
package com.arcesium.scdmerge.policy;

/**
 * Maps a source column to the names of the dimension columns its policy produces. Naming is a
 * presentation concern, kept apart from the historization rules.
 */
public interface ColumnNamingStrategy {
  /** Name of the type 0 column holding the original value. */
  String originalColumn(String column);

  /** Name of the type 1 column holding the latest value. */
  String currentColumn(String column);

  /** Name of the versioned column of a type 2 or type 7 attribute. */
  String versionedColumn(String column);

  /** Name of the primary column of a type 3 attribute. */
  String primaryColumn(String column);

  /**
   * Name of the alternate column of a type 3 attribute.
   *
   * @return the name, or null when the policy must supply one explicitly
   */
  String alternateColumn(String column);

  /** Name of the type 6 column repeated with the current value on every row. */
  String shadowCurrentColumn(String column);

  /** Name of the type 6 column holding the value in effect for each row. */
  String historicalColumn(String column);

  /** Name of a pass-through column. */
  default String passThroughColumn(String column) {
    return column;
  }
}
