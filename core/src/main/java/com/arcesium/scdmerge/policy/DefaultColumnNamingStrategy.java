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

import com.arcesium.scdmerge.common.ValidationException;

/**
 * Prefix/suffix based naming. The defaults are {@code original_<c>}, {@code current_<c>}, {@code
 * <c>} for type 2, 3 and 7, {@code <c>_alternate}, {@code <c>_current} and {@code <c>_historical}.
 */
public class DefaultColumnNamingStrategy implements ColumnNamingStrategy {
  public static final String ORIGINAL_PREFIX = "original_";
  public static final String CURRENT_PREFIX = "current_";
  public static final String ALTERNATE_SUFFIX = "_alternate";
  public static final String SHADOW_CURRENT_SUFFIX = "_current";
  public static final String HISTORICAL_SUFFIX = "_historical";

  private final String originalPrefix;
  private final String currentPrefix;
  private final String alternateSuffix;
  private final String shadowCurrentSuffix;
  private final String historicalSuffix;

  public DefaultColumnNamingStrategy() {
    this(
        ORIGINAL_PREFIX,
        CURRENT_PREFIX,
        ALTERNATE_SUFFIX,
        SHADOW_CURRENT_SUFFIX,
        HISTORICAL_SUFFIX);
  }

  /**
   * Creates a strategy with custom affixes. A null alternate suffix means type 3 policies must
   * name their alternate column explicitly.
   *
   * @param originalPrefix Prefix of type 0 columns.
   * @param currentPrefix Prefix of type 1 columns.
   * @param alternateSuffix Suffix of type 3 alternate columns, or null.
   * @param shadowCurrentSuffix Suffix of type 6 current columns.
   * @param historicalSuffix Suffix of type 6 historical columns.
   */
  public DefaultColumnNamingStrategy(
      String originalPrefix,
      String currentPrefix,
      String alternateSuffix,
      String shadowCurrentSuffix,
      String historicalSuffix) {
    this.originalPrefix =
        ValidationException.checkNotNull(originalPrefix, "Prefix cannot be null.");
    this.currentPrefix = ValidationException.checkNotNull(currentPrefix, "Prefix cannot be null.");
    this.alternateSuffix = alternateSuffix;
    this.shadowCurrentSuffix =
        ValidationException.checkNotNull(shadowCurrentSuffix, "Suffix cannot be null.");
    this.historicalSuffix =
        ValidationException.checkNotNull(historicalSuffix, "Suffix cannot be null.");
    ValidationException.check(
        !this.shadowCurrentSuffix.equals(this.historicalSuffix),
        "Type 6 current and historical suffixes must differ.");
  }

  @Override
  public String originalColumn(String column) {
    return originalPrefix + column;
  }

  @Override
  public String currentColumn(String column) {
    return currentPrefix + column;
  }

  @Override
  public String versionedColumn(String column) {
    return column;
  }

  @Override
  public String primaryColumn(String column) {
    return column;
  }

  @Override
  public String alternateColumn(String column) {
    return alternateSuffix == null ? null : column + alternateSuffix;
  }

  @Override
  public String shadowCurrentColumn(String column) {
    return column + shadowCurrentSuffix;
  }

  @Override
  public String historicalColumn(String column) {
    return column + historicalSuffix;
  }
}
