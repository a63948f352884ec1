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

import static org.assertj.core.api.Assertions.*;

import com.arcesium.scdmerge.common.IntervalBoundary;
import com.arcesium.scdmerge.common.ValidationException;
import com.arcesium.scdmerge.keys.KeyResolver;
import com.arcesium.scdmerge.keys.ResolvedKey;
import com.arcesium.scdmerge.policy.ColumnPolicies;
import com.arcesium.scdmerge.policy.ColumnPolicyRegistry;
import com.arcesium.scdmerge.policy.DefaultColumnNamingStrategy;
import com.arcesium.scdmerge.policy.Type3Mode;
import com.arcesium.scdmerge.table.DimensionTable;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class VersionManagerTest {
  private static final LocalDate D1 = LocalDate.of(2024, 1, 1);
  private static final LocalDate D2 = LocalDate.of(2024, 2, 1);
  private static final LocalDate MAX = LocalDate.of(9999, 12, 31);
  private static final List<String> KEYS = List.of("customer");

  private final VersionManager versionManager = new VersionManager("customers");

  private static ResolvedKey resolveSingle(
      ColumnPolicies policies, DimensionTable source, DimensionTable target) {
    ColumnPolicyRegistry registry =
        ColumnPolicyRegistry.validate(
            policies,
            source.columns(),
            new DefaultColumnNamingStrategy(),
            Type3Mode.FREEZE_AFTER_FIRST,
            List.of("surrogate_key", "effective_from", "effective_to", "is_current"));
    return new KeyResolver(registry, "is_current").resolve(source, target).getKeys().get(0);
  }

  private static KeyMergeContext versionedContext(
      DimensionTable source,
      DimensionTable target,
      LocalDate mergeDate,
      IntervalBoundary boundary) {
    ColumnPolicies policies =
        ColumnPolicies.builder().keyColumns("customer").type2("credit_score").build();
    return KeyMergeContext.forKey(
        resolveSingle(policies, source, target),
        KEYS,
        mergeDate,
        MAX,
        new VersioningColumns(
            "surrogate_key", "effective_from", "effective_to", "is_current", boundary));
  }

  private static DimensionTable source(int score) {
    return DimensionTable.builder("customer", "credit_score").addRow("C1", score).build();
  }

  private static DimensionTable target(LocalDate from, int score) {
    return DimensionTable.builder(
            "customer",
            "surrogate_key",
            "effective_from",
            "effective_to",
            "is_current",
            "credit_score")
        .addRow("C1", 1L, from, MAX, true, score)
        .build();
  }

  @Test
  void testNewMemberGetsOpenRow() {
    KeyMergeContext context =
        versionedContext(source(700), DimensionTable.empty(), D1, IntervalBoundary.HALF_OPEN);

    versionManager.prepare(context);

    MutableRow row = context.getCurrentRow();
    assertThat(context.getRows()).containsExactly(row);
    assertThat(row.isNewVersion()).isTrue();
    assertThat(row.get("customer")).isEqualTo("C1");
    assertThat(row.get("surrogate_key")).isNull();
    assertThat(row.get("effective_from")).isEqualTo(D1);
    assertThat(row.get("effective_to")).isEqualTo(MAX);
    assertThat(row.get("is_current")).isEqualTo(true);
    assertThat(context.getClosedRow()).isNull();
  }

  @Test
  void testVersionedChangeClosesCurrentRowAtMergeTimestamp() {
    KeyMergeContext context =
        versionedContext(source(750), target(D1, 700), D2, IntervalBoundary.HALF_OPEN);

    versionManager.prepare(context);

    MutableRow closed = context.getClosedRow();
    MutableRow successor = context.getCurrentRow();
    assertThat(context.getRows()).containsExactly(closed, successor);
    assertThat(closed.get("effective_to")).isEqualTo(D2);
    assertThat(closed.get("is_current")).isEqualTo(false);
    assertThat(closed.get("surrogate_key")).isEqualTo(1L);
    assertThat(successor.isNewVersion()).isTrue();
    assertThat(successor.get("surrogate_key")).isNull();
    assertThat(successor.get("effective_from")).isEqualTo(D2);
    assertThat(successor.get("effective_to")).isEqualTo(MAX);
    assertThat(successor.get("credit_score")).isEqualTo(700);
  }

  @Test
  void testClosedBoundaryEndsOneDayEarlier() {
    KeyMergeContext context =
        versionedContext(source(750), target(D1, 700), D2, IntervalBoundary.CLOSED);

    versionManager.prepare(context);

    assertThat(context.getClosedRow().get("effective_to")).isEqualTo(LocalDate.of(2024, 1, 31));
  }

  @Test
  void testChangeAtCurrentStartIsAbsorbed() {
    KeyMergeContext context =
        versionedContext(source(750), target(D2, 700), D2, IntervalBoundary.HALF_OPEN);

    versionManager.prepare(context);

    assertThat(context.getRows()).hasSize(1);
    assertThat(context.getClosedRow()).isNull();
    assertThat(context.getCurrentRow().isNewVersion()).isFalse();
  }

  @Test
  void testOutOfOrderMergeTimestamp() {
    KeyMergeContext context =
        versionedContext(source(750), target(D2, 700), D1, IntervalBoundary.HALF_OPEN);

    assertThatThrownBy(() -> versionManager.prepare(context))
        .isInstanceOf(ValidationException.class)
        .hasMessageStartingWith("SCD merge failed: Out-of-order records detected.")
        .hasMessageContaining("customers");
  }

  private static DimensionTable closedHistory(LocalDate to) {
    return DimensionTable.builder(
            "customer",
            "surrogate_key",
            "effective_from",
            "effective_to",
            "is_current",
            "credit_score")
        .addRow("C1", 1L, D1, to, false, 630)
        .build();
  }

  @Test
  void testReactivatedKeyOverlappingLastVersionIsOutOfOrder() {
    KeyMergeContext context =
        versionedContext(
            source(730), closedHistory(LocalDate.of(2024, 3, 1)), D2, IntervalBoundary.HALF_OPEN);

    assertThatThrownBy(() -> versionManager.prepare(context))
        .isInstanceOf(ValidationException.class)
        .hasMessageStartingWith("SCD merge failed: Out-of-order records detected.")
        .hasMessageContaining("effective_to (2024-03-01)")
        .hasMessageContaining("customers");
  }

  @Test
  void testReactivatedKeyOpensAtEndOfLastVersion() {
    KeyMergeContext context =
        versionedContext(source(730), closedHistory(D2), D2, IntervalBoundary.HALF_OPEN);

    versionManager.prepare(context);

    MutableRow row = context.getCurrentRow();
    assertThat(row.isNewVersion()).isTrue();
    assertThat(row.get("effective_from")).isEqualTo(D2);
    assertThat(row.get("effective_to")).isEqualTo(MAX);
  }

  @Test
  void testClosedBoundaryReactivationMustStartAfterLastVersionEnd() {
    KeyMergeContext overlapping =
        versionedContext(source(730), closedHistory(D2), D2, IntervalBoundary.CLOSED);
    KeyMergeContext adjacent =
        versionedContext(
            source(730), closedHistory(LocalDate.of(2024, 1, 31)), D2, IntervalBoundary.CLOSED);

    assertThatThrownBy(() -> versionManager.prepare(overlapping))
        .isInstanceOf(ValidationException.class)
        .hasMessageStartingWith("SCD merge failed: Out-of-order records detected.");
    versionManager.prepare(adjacent);
    assertThat(adjacent.getCurrentRow().get("effective_from")).isEqualTo(D2);
  }

  @Test
  void testUnchangedKeyKeepsItsRows() {
    KeyMergeContext context =
        versionedContext(source(700), target(D1, 700), D2, IntervalBoundary.HALF_OPEN);

    versionManager.prepare(context);

    assertThat(context.getRows()).hasSize(1);
    assertThat(context.getCurrentRow().get("effective_to")).isEqualTo(MAX);
  }

  @Test
  void testFlatDimensionGetsSingleRow() {
    ColumnPolicies policies =
        ColumnPolicies.builder().keyColumns("customer").type1("email").build();
    DimensionTable source =
        DimensionTable.builder("customer", "email").addRow("C1", "a@example.com").build();
    KeyMergeContext context =
        KeyMergeContext.forKey(
            resolveSingle(policies, source, DimensionTable.empty()), KEYS, D1, MAX, null);

    versionManager.prepare(context);

    assertThat(context.getRows()).hasSize(1);
    assertThat(context.getCurrentRow().isNewVersion()).isFalse();
    assertThat(context.getCurrentRow().get("customer")).isEqualTo("C1");
  }
}
