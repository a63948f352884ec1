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

import com.arcesium.scdmerge.common.IntervalBoundary;
import java.util.List;

/** Bookkeeping columns and interval rules of a versioned dimension. */
public final class VersioningColumns {
  private final String surrogateKeyColumn;
  private final String effectiveStartColumn;
  private final String effectiveEndColumn;
  private final String currentFlagColumn;
  private final IntervalBoundary intervalBoundary;

  public VersioningColumns(
      String surrogateKeyColumn,
      String effectiveStartColumn,
      String effectiveEndColumn,
      String currentFlagColumn,
      IntervalBoundary intervalBoundary) {
    this.surrogateKeyColumn = surrogateKeyColumn;
    this.effectiveStartColumn = effectiveStartColumn;
    this.effectiveEndColumn = effectiveEndColumn;
    this.currentFlagColumn = currentFlagColumn;
    this.intervalBoundary = intervalBoundary;
  }

  public String getSurrogateKeyColumn() {
    return surrogateKeyColumn;
  }

  public String getEffectiveStartColumn() {
    return effectiveStartColumn;
  }

  public String getEffectiveEndColumn() {
    return effectiveEndColumn;
  }

  public String getCurrentFlagColumn() {
    return currentFlagColumn;
  }

  public IntervalBoundary getIntervalBoundary() {
    return intervalBoundary;
  }

  /** The bookkeeping columns in layout order. */
  public List<String> asList() {
    return List.of(
        surrogateKeyColumn, effectiveStartColumn, effectiveEndColumn, currentFlagColumn);
  }
}
