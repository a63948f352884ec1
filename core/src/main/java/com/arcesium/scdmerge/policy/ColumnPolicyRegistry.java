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
import com.arcesium.scdmerge.common.PolicyConflictException;
import com.arcesium.scdmerge.common.UnknownColumnPolicyException;
import com.arcesium.scdmerge.common.ValidationException;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * The validated, read-only set of column policies of one merge. Built by {@link #validate}; every
 * handler looks its columns up here.
 */
public final class ColumnPolicyRegistry {
  private static final Set<ScdType> STANDALONE_TYPES =
      EnumSet.of(ScdType.TYPE_3, ScdType.TYPE_6, ScdType.PASS_THROUGH);

  private final ImmutableList<String> keyColumns;
  private final ImmutableList<BoundColumnPolicy> policies;
  private final boolean versioned;
  private final boolean dualKeyed;

  private ColumnPolicyRegistry(List<String> keyColumns, List<BoundColumnPolicy> policies) {
    this.keyColumns = ImmutableList.copyOf(keyColumns);
    this.policies = ImmutableList.copyOf(policies);
    this.versioned = policies.stream().anyMatch(p -> p.getType().isVersioned());
    this.dualKeyed = policies.stream().anyMatch(p -> p.getType() == ScdType.TYPE_7);
  }

  /**
   * Validates declared policies against the columns of a source batch.
   *
   * @param declaration The caller's key columns and policies.
   * @param sourceColumns The columns of the source batch.
   * @param namingStrategy Produces output column names.
   * @param defaultType3Mode Mode for type 3 policies that do not set one.
   * @param reservedColumns Bookkeeping column names no policy may produce.
   * @return The registry.
   * @throws InvalidPolicyParamsException if a policy lacks a required parameter or carries one its
   *     type does not accept
   * @throws PolicyConflictException if policies on one column are incompatible or output columns
   *     collide
   * @throws UnknownColumnPolicyException if a source column has no policy
   */
  public static ColumnPolicyRegistry validate(
      ColumnPolicies declaration,
      Collection<String> sourceColumns,
      ColumnNamingStrategy namingStrategy,
      Type3Mode defaultType3Mode,
      Collection<String> reservedColumns) {
    ValidationException.checkNotNull(declaration, "Column policies cannot be null.");
    ValidationException.checkNotNull(sourceColumns, "Source columns cannot be null.");
    ValidationException.checkNotNull(namingStrategy, "Column naming strategy cannot be null.");
    ValidationException.checkNotNull(defaultType3Mode, "Default type 3 mode cannot be null.");

    List<String> keyColumns = declaration.getKeyColumns();
    validateKeyColumns(keyColumns);

    Map<String, List<ColumnPolicy>> policiesByColumn = new LinkedHashMap<>();
    for (ColumnPolicy policy : declaration.getPolicies()) {
      validateParams(policy);
      if (keyColumns.contains(policy.getColumn())) {
        throw new PolicyConflictException(
            "Column %s is a durable key column and cannot have a policy.", policy.getColumn());
      }
      List<ColumnPolicy> columnPolicies =
          policiesByColumn.computeIfAbsent(policy.getColumn(), c -> new ArrayList<>());
      if (!columnPolicies.contains(policy)) {
        columnPolicies.add(policy);
      }
    }
    policiesByColumn.forEach(ColumnPolicyRegistry::validateCombination);

    List<BoundColumnPolicy> bound = new ArrayList<>();
    policiesByColumn.values().stream()
        .flatMap(List::stream)
        .forEach(p -> bound.add(bind(p, namingStrategy, defaultType3Mode)));
    validateOutputColumns(keyColumns, bound, reservedColumns);

    Set<String> sourceColumnSet = new HashSet<>(sourceColumns);
    for (String keyColumn : keyColumns) {
      ValidationException.check(
          sourceColumnSet.contains(keyColumn),
          "Durable key column %s does not exist in the source.",
          keyColumn);
    }
    for (String column : policiesByColumn.keySet()) {
      ValidationException.check(
          sourceColumnSet.contains(column),
          "Column %s has a policy but does not exist in the source.",
          column);
    }
    for (String column : sourceColumns) {
      if (!keyColumns.contains(column) && !policiesByColumn.containsKey(column)) {
        throw new UnknownColumnPolicyException(
            "Source column %s has no SCD policy. Declare a type or mark it pass-through.", column);
      }
    }
    return new ColumnPolicyRegistry(keyColumns, bound);
  }

  private static void validateKeyColumns(List<String> keyColumns) {
    if (keyColumns == null || keyColumns.isEmpty()) {
      throw new InvalidPolicyParamsException("At least one durable key column is required.");
    }
    Set<String> seen = new HashSet<>();
    for (String keyColumn : keyColumns) {
      if (StringUtils.isBlank(keyColumn)) {
        throw new InvalidPolicyParamsException("Durable key column names cannot be blank.");
      }
      if (!seen.add(keyColumn)) {
        throw new InvalidPolicyParamsException("Durable key column %s is repeated.", keyColumn);
      }
    }
  }

  private static void validateParams(ColumnPolicy policy) {
    if (StringUtils.isBlank(policy.getColumn())) {
      throw new InvalidPolicyParamsException("Policy column name cannot be blank.");
    }
    String column = policy.getColumn();
    ScdType type = policy.getType();
    if (type == null) {
      throw new InvalidPolicyParamsException("SCD type of column %s is missing.", column);
    }
    if (type != ScdType.TYPE_3
        && (policy.getAlternateColumn() != null || policy.getType3Mode() != null)) {
      throw new InvalidPolicyParamsException(
          "Column %s: alternate column and type 3 mode only apply to type 3, not %s.",
          column,
          type);
    }
    if (type != ScdType.TYPE_6
        && (policy.getShadowCurrentColumn() != null || policy.getHistoricalColumn() != null)) {
      throw new InvalidPolicyParamsException(
          "Column %s: current and historical column names only apply to type 6, not %s.",
          column,
          type);
    }
    ChangeTrackingMetadata<?> metadata = policy.getChangeTrackingMetadata();
    if (metadata != null) {
      if (!type.isChangeTracked()) {
        throw new InvalidPolicyParamsException(
            "Column %s: change tracking metadata does not apply to %s.", column, type);
      }
      if (metadata.getMaxDeltaValue() != null && metadata.getMaxDeltaValue() < 0) {
        throw new InvalidPolicyParamsException(
            "Column %s: max delta value cannot be negative.", column);
      }
    }
  }

  private static void validateCombination(String column, List<ColumnPolicy> columnPolicies) {
    if (columnPolicies.size() < 2) {
      return;
    }
    Set<ScdType> types = EnumSet.noneOf(ScdType.class);
    for (ColumnPolicy policy : columnPolicies) {
      if (!types.add(policy.getType())) {
        throw new PolicyConflictException(
            "Column %s is declared as %s more than once with different parameters.",
            column,
            policy.getType());
      }
    }
    for (ScdType type : types) {
      if (STANDALONE_TYPES.contains(type)) {
        throw new PolicyConflictException(
            "Column %s: %s cannot be combined with other types, found %s.", column, type, types);
      }
    }
    long versionedTypes = types.stream().filter(ScdType::isVersioned).count();
    if (versionedTypes > 1) {
      throw new PolicyConflictException(
          "Column %s: at most one of TYPE_2 and TYPE_7 may be declared, found %s.", column, types);
    }
  }

  private static BoundColumnPolicy bind(
      ColumnPolicy policy, ColumnNamingStrategy naming, Type3Mode defaultType3Mode) {
    String column = policy.getColumn();
    switch (policy.getType()) {
      case TYPE_0:
        return new BoundColumnPolicy(
            policy, requireName(column, naming.originalColumn(column)), null, null, null);
      case TYPE_1:
        return new BoundColumnPolicy(
            policy, requireName(column, naming.currentColumn(column)), null, null, null);
      case TYPE_2:
      case TYPE_7:
        return new BoundColumnPolicy(
            policy, requireName(column, naming.versionedColumn(column)), null, null, null);
      case TYPE_3:
        String alternate =
            policy.getAlternateColumn() != null
                ? policy.getAlternateColumn()
                : naming.alternateColumn(column);
        if (StringUtils.isBlank(alternate)) {
          throw new InvalidPolicyParamsException(
              "Type 3 column %s requires an alternate column name.", column);
        }
        return new BoundColumnPolicy(
            policy,
            requireName(column, naming.primaryColumn(column)),
            alternate,
            null,
            policy.getType3Mode() != null ? policy.getType3Mode() : defaultType3Mode);
      case TYPE_6:
        String historical =
            policy.getHistoricalColumn() != null
                ? policy.getHistoricalColumn()
                : naming.historicalColumn(column);
        String current =
            policy.getShadowCurrentColumn() != null
                ? policy.getShadowCurrentColumn()
                : naming.shadowCurrentColumn(column);
        return new BoundColumnPolicy(
            policy, requireName(column, historical), null, requireName(column, current), null);
      case PASS_THROUGH:
        return new BoundColumnPolicy(
            policy, requireName(column, naming.passThroughColumn(column)), null, null, null);
      default:
        throw new InvalidPolicyParamsException(
            "Unsupported SCD type %s for column %s", policy.getType(), column);
    }
  }

  private static String requireName(String column, String name) {
    if (StringUtils.isBlank(name)) {
      throw new InvalidPolicyParamsException(
          "Column %s: the naming strategy produced a blank output column name.", column);
    }
    return name;
  }

  private static void validateOutputColumns(
      List<String> keyColumns, List<BoundColumnPolicy> bound, Collection<String> reservedColumns) {
    Map<String, String> owners = new HashMap<>();
    keyColumns.forEach(k -> owners.put(k, "durable key"));
    if (reservedColumns != null) {
      reservedColumns.forEach(r -> owners.put(r, "bookkeeping column"));
    }
    for (BoundColumnPolicy policy : bound) {
      for (String output : policy.getOutputColumns()) {
        String owner =
            owners.putIfAbsent(output, policy.getSourceColumn() + "/" + policy.getType());
        if (owner != null) {
          throw new PolicyConflictException(
              "Output column %s of %s/%s collides with %s.",
              output,
              policy.getSourceColumn(),
              policy.getType(),
              owner);
        }
      }
    }
  }

  public List<String> getKeyColumns() {
    return keyColumns;
  }

  public List<BoundColumnPolicy> getPolicies() {
    return policies;
  }

  /**
   * Returns the policies of one SCD type, in declaration order.
   *
   * @param type The type.
   * @return The matching policies.
   */
  public List<BoundColumnPolicy> getPolicies(ScdType type) {
    return policies.stream().filter(p -> p.getType() == type).collect(Collectors.toList());
  }

  /**
   * Whether any policy versions rows, which makes the dimension carry surrogate keys, effective
   * periods and current flags.
   */
  public boolean isVersioned() {
    return versioned;
  }

  /** Whether the dimension has a type 7 column and must expose both keys on every row. */
  public boolean isDualKeyed() {
    return dualKeyed;
  }

  /**
   * Returns the output columns of all policies, in declaration order.
   *
   * @return The policy output columns.
   */
  public List<String> getOutputColumns() {
    return policies.stream()
        .flatMap(p -> p.getOutputColumns().stream())
        .collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return "ColumnPolicyRegistry{"
        + "keyColumns="
        + keyColumns
        + ", policies="
        + policies
        + ", versioned="
        + versioned
        + '}';
  }
}
