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

import java.util.Objects;

/**
 * The declared historization of one source column: its SCD type plus the parameters some types
 * need. Parameters are checked when the policies are validated against a batch, not here.
 */
public final class ColumnPolicy {
  private final String column;
  private final ScdType type;
  private final String alternateColumn;
  private final Type3Mode type3Mode;
  private final String shadowCurrentColumn;
  private final String historicalColumn;
  private final ChangeTrackingMetadata<?> changeTrackingMetadata;

  private ColumnPolicy(Builder builder) {
    this.column = builder.column;
    this.type = builder.type;
    this.alternateColumn = builder.alternateColumn;
    this.type3Mode = builder.type3Mode;
    this.shadowCurrentColumn = builder.shadowCurrentColumn;
    this.historicalColumn = builder.historicalColumn;
    this.changeTrackingMetadata = builder.changeTrackingMetadata;
  }

  /**
   * Creates a policy without type-specific parameters.
   *
   * @param column The source column.
   * @param type The SCD type.
   * @return The policy.
   */
  public static ColumnPolicy of(String column, ScdType type) {
    return builder(column, type).build();
  }

  public static Builder builder(String column, ScdType type) {
    return new Builder(column, type);
  }

  public String getColumn() {
    return column;
  }

  public ScdType getType() {
    return type;
  }

  /** Explicit type 3 alternate column name, or null to use the naming strategy. */
  public String getAlternateColumn() {
    return alternateColumn;
  }

  /** Type 3 mode, or null to use the engine default. */
  public Type3Mode getType3Mode() {
    return type3Mode;
  }

  /** Explicit type 6 current column name, or null to use the naming strategy. */
  public String getShadowCurrentColumn() {
    return shadowCurrentColumn;
  }

  /** Explicit type 6 historical column name, or null to use the naming strategy. */
  public String getHistoricalColumn() {
    return historicalColumn;
  }

  public ChangeTrackingMetadata<?> getChangeTrackingMetadata() {
    return changeTrackingMetadata;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof ColumnPolicy)) {
      return false;
    }
    ColumnPolicy that = (ColumnPolicy) o;
    return Objects.equals(column, that.column)
        && type == that.type
        && Objects.equals(alternateColumn, that.alternateColumn)
        && type3Mode == that.type3Mode
        && Objects.equals(shadowCurrentColumn, that.shadowCurrentColumn)
        && Objects.equals(historicalColumn, that.historicalColumn)
        && Objects.equals(changeTrackingMetadata, that.changeTrackingMetadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        column,
        type,
        alternateColumn,
        type3Mode,
        shadowCurrentColumn,
        historicalColumn,
        changeTrackingMetadata);
  }

  @Override
  public String toString() {
    return "ColumnPolicy{"
        + "column='"
        + column
        + '\''
        + ", type="
        + type
        + ", alternateColumn='"
        + alternateColumn
        + '\''
        + ", type3Mode="
        + type3Mode
        + ", shadowCurrentColumn='"
        + shadowCurrentColumn
        + '\''
        + ", historicalColumn='"
        + historicalColumn
        + '\''
        + ", changeTrackingMetadata="
        + changeTrackingMetadata
        + '}';
  }

  /** Builder for {@link ColumnPolicy}. */
  public static class Builder {
    private final String column;
    private final ScdType type;
    private String alternateColumn;
    private Type3Mode type3Mode;
    private String shadowCurrentColumn;
    private String historicalColumn;
    private ChangeTrackingMetadata<?> changeTrackingMetadata;

    private Builder(String column, ScdType type) {
      this.column = column;
      this.type = type;
    }

    public Builder alternateColumn(String alternateColumn) {
      this.alternateColumn = alternateColumn;
      return this;
    }

    public Builder type3Mode(Type3Mode type3Mode) {
      this.type3Mode = type3Mode;
      return this;
    }

    public Builder shadowCurrentColumn(String shadowCurrentColumn) {
      this.shadowCurrentColumn = shadowCurrentColumn;
      return this;
    }

    public Builder historicalColumn(String historicalColumn) {
      this.historicalColumn = historicalColumn;
      return this;
    }

    public Builder changeTrackingMetadata(ChangeTrackingMetadata<?> changeTrackingMetadata) {
      this.changeTrackingMetadata = changeTrackingMetadata;
      return this;
    }

    public ColumnPolicy build() {
      return new ColumnPolicy(this);
    }
  }
}
