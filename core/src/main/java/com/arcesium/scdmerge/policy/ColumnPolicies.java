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

import com.arcesium.scdmerge.common.InvalidPolicyParamsException;
import com.arcesium.scdmerge.common.ValidationException;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * The caller's declaration for a dimension: its durable key columns and the policy of each
 * attribute column. Validate it against a batch with {@link ColumnPolicyRegistry#validate}.
 */
public final class ColumnPolicies {
  private final List<String> keyColumns;
  private final ImmutableList<ColumnPolicy> policies;

  private ColumnPolicies(List<String> keyColumns, List<ColumnPolicy> policies) {
    this.keyColumns = Collections.unmodifiableList(new ArrayList<>(keyColumns));
    this.policies = ImmutableList.copyOf(policies);
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Creates policies from a column to SCD type number mapping, e.g. {@code {credit_score: 2}}.
   *
   * @param keyColumns The durable key columns.
   * @param typesByColumn SCD type number per column.
   * @return The policies.
   * @throws InvalidPolicyParamsException if a type number is not supported
   */
  public static ColumnPolicies fromTypeNumbers(
      List<String> keyColumns, Map<String, Integer> typesByColumn) {
    ValidationException.checkNotNull(typesByColumn, "Column types cannot be null.");
    Builder builder = builder().keyColumns(keyColumns);
    typesByColumn.forEach(
        (column, number) -> {
          if (number == null) {
            throw new InvalidPolicyParamsException("SCD type of column %s is missing.", column);
          }
          builder.add(ColumnPolicy.of(column, ScdType.fromNumber(number)));
        });
    return builder.build();
  }

  public List<String> getKeyColumns() {
    return keyColumns;
  }

  public List<ColumnPolicy> getPolicies() {
    return policies;
  }

  @Override
  public String toString() {
    return "ColumnPolicies{" + "keyColumns=" + keyColumns + ", policies=" + policies + '}';
  }

  /** Builder for {@link ColumnPolicies}. */
  public static class Builder {
    private List<String> keyColumns = new ArrayList<>();
    private final List<ColumnPolicy> policies = new ArrayList<>();

    private Builder() {}

    public Builder keyColumns(String... keyColumns) {
      return keyColumns(Arrays.asList(keyColumns));
    }

    public Builder keyColumns(List<String> keyColumns) {
      this.keyColumns = keyColumns == null ? new ArrayList<>() : new ArrayList<>(keyColumns);
      return this;
    }

    public Builder add(ColumnPolicy policy) {
      ValidationException.checkNotNull(policy, "Column policy cannot be null.");
      policies.add(policy);
      return this;
    }

    public Builder type0(String column) {
      return add(ColumnPolicy.of(column, ScdType.TYPE_0));
    }

    public Builder type1(String column) {
      return add(ColumnPolicy.of(column, ScdType.TYPE_1));
    }

    public Builder type2(String column) {
      return add(ColumnPolicy.of(column, ScdType.TYPE_2));
    }

    public Builder type3(String column) {
      return add(ColumnPolicy.of(column, ScdType.TYPE_3));
    }

    /**
     * Declares a type 3 column with an explicit alternate column and mode.
     *
     * @param column The source column.
     * @param alternateColumn The alternate column name.
     * @param mode The type 3 mode, or null for the engine default.
     * @return This Builder.
     */
    public Builder type3(String column, String alternateColumn, Type3Mode mode) {
      return add(
          ColumnPolicy.builder(column, ScdType.TYPE_3)
              .alternateColumn(alternateColumn)
              .type3Mode(mode)
              .build());
    }

    public Builder type6(String column) {
      return add(ColumnPolicy.of(column, ScdType.TYPE_6));
    }

    public Builder type7(String column) {
      return add(ColumnPolicy.of(column, ScdType.TYPE_7));
    }

    public Builder passThrough(String column) {
      return add(ColumnPolicy.of(column, ScdType.PASS_THROUGH));
    }

    public ColumnPolicies build() {
      return new ColumnPolicies(keyColumns, policies);
    }
  }
}
