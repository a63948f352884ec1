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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * A validated column policy with its output column names resolved. This is what the type handlers
 * work with.
 */
public final class BoundColumnPolicy {
  private final ColumnPolicy policy;
  private final String valueColumn;
  private final String alternateColumn;
  private final String shadowCurrentColumn;
  private final Type3Mode type3Mode;

  BoundColumnPolicy(
      ColumnPolicy policy,
      String valueColumn,
      String alternateColumn,
      String shadowCurrentColumn,
      Type3Mode type3Mode) {
    this.policy = policy;
    this.valueColumn = valueColumn;
    this.alternateColumn = alternateColumn;
    this.shadowCurrentColumn = shadowCurrentColumn;
    this.type3Mode = type3Mode;
  }

  public ColumnPolicy getPolicy() {
    return policy;
  }

  /** The source column feeding this policy. */
  public String getSourceColumn() {
    return policy.getColumn();
  }

  public ScdType getType() {
    return policy.getType();
  }

  /**
   * The dimension column holding the tracked value: {@code original_<c>}, {@code current_<c>}, the
   * versioned or primary column, or the type 6 historical column.
   */
  public String getValueColumn() {
    return valueColumn;
  }

  /** The type 3 alternate column, null for other types. */
  public String getAlternateColumn() {
    return alternateColumn;
  }

  /** The type 6 current column, null for other types. */
  public String getShadowCurrentColumn() {
    return shadowCurrentColumn;
  }

  /** The effective type 3 mode, null for other types. */
  public Type3Mode getType3Mode() {
    return type3Mode;
  }

  public ChangeTrackingMetadata<?> getChangeTrackingMetadata() {
    return policy.getChangeTrackingMetadata();
  }

  /**
   * Returns the dimension columns this policy writes, in layout order.
   *
   * @return The output column names.
   */
  public List<String> getOutputColumns() {
    ImmutableList.Builder<String> columns = ImmutableList.builder();
    if (getType() == ScdType.TYPE_6) {
      columns.add(shadowCurrentColumn);
    }
    columns.add(valueColumn);
    if (alternateColumn != null) {
      columns.add(alternateColumn);
    }
    return columns.build();
  }

  @Override
  public String toString() {
    return "BoundColumnPolicy{"
        + "column='"
        + getSourceColumn()
        + '\''
        + ", type="
        + getType()
        + ", outputColumns="
        + getOutputColumns()
        + ", type3Mode="
        + type3Mode
        + '}';
  }
}
