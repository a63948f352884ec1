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
package com.arcesium.scdmerge.common;

import static org.assertj.core.api.Assertions.*;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class DateTimeUtilTest {

  @Test
  void testParseEffectiveTimestampPicksTypeFromShape() {
    assertThat(DateTimeUtil.parseEffectiveTimestamp("2022-01-31"))
        .isEqualTo(LocalDate.of(2022, 1, 31));
    assertThat(DateTimeUtil.parseEffectiveTimestamp("2022-01-31T10:15:30"))
        .isEqualTo(LocalDateTime.of(2022, 1, 31, 10, 15, 30));
    assertThat(DateTimeUtil.parseEffectiveTimestamp("2022-01-31T10:15:30Z"))
        .isEqualTo(OffsetDateTime.of(2022, 1, 31, 10, 15, 30, 0, ZoneOffset.UTC));
    assertThat(DateTimeUtil.parseEffectiveTimestamp("2022-01-31T10:15:30-05:00"))
        .isEqualTo(OffsetDateTime.of(2022, 1, 31, 10, 15, 30, 0, ZoneOffset.ofHours(-5)));
  }

  @ParameterizedTest
  @ValueSource(strings = {"", "31/01/2022", "2022-13-01", "2022-01-31T25:00"})
  void testParseEffectiveTimestampRejectsInvalidStrings(String value) {
    assertThatThrownBy(() -> DateTimeUtil.parseEffectiveTimestamp(value))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void testNormalizeTruncatesToMicros() {
    LocalDateTime withNanos = LocalDateTime.of(2022, 1, 31, 10, 0, 0, 123_456_789);

    assertThat(DateTimeUtil.normalizeEffectiveTimestamp(withNanos))
        .isEqualTo(LocalDateTime.of(2022, 1, 31, 10, 0, 0, 123_456_000));
  }

  @Test
  void testNormalizeRejectsUnsupportedTypes() {
    assertThatThrownBy(() -> DateTimeUtil.normalizeEffectiveTimestamp(42))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("Integer");
    assertThatThrownBy(() -> DateTimeUtil.normalizeEffectiveTimestamp(null))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void testMaxEffectiveTimestampFollowsSampleType() {
    assertThat(DateTimeUtil.maxEffectiveTimestamp(LocalDate.of(2022, 1, 1)))
        .isEqualTo(LocalDate.of(9999, 12, 31));
    assertThat(DateTimeUtil.maxEffectiveTimestamp(LocalDateTime.of(2022, 1, 1, 0, 0)))
        .isEqualTo(LocalDateTime.of(9999, 12, 31, 0, 0));
    assertThat(DateTimeUtil.maxEffectiveTimestamp(OffsetDateTime.now(ZoneOffset.ofHours(2))))
        .isEqualTo(OffsetDateTime.of(9999, 12, 31, 0, 0, 0, 0, ZoneOffset.UTC));
  }

  @Test
  void testPreviousTick() {
    assertThat(DateTimeUtil.previousTick(LocalDate.of(2022, 1, 31)))
        .isEqualTo(LocalDate.of(2022, 1, 30));
    assertThat(DateTimeUtil.previousTick(LocalDateTime.of(2022, 1, 31, 0, 0)))
        .isEqualTo(LocalDateTime.of(2022, 1, 30, 23, 59, 59, 999_999_000));
  }

  @Test
  void testCompareUsesInstantsForOffsetValues() {
    OffsetDateTime utc = OffsetDateTime.of(2022, 1, 31, 10, 0, 0, 0, ZoneOffset.UTC);
    OffsetDateTime plusTwo = OffsetDateTime.of(2022, 1, 31, 12, 0, 0, 0, ZoneOffset.ofHours(2));

    assertThat(DateTimeUtil.compare(utc, plusTwo)).isZero();
    assertThat(DateTimeUtil.compare(LocalDate.of(2022, 1, 1), LocalDate.of(2022, 1, 2)))
        .isNegative();
  }

  @Test
  void testCompareRejectsMixedTypes() {
    assertThatThrownBy(
            () ->
                DateTimeUtil.compare(
                    LocalDate.of(2022, 1, 1), LocalDateTime.of(2022, 1, 1, 0, 0)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Cannot compare effective timestamps of types LocalDate and LocalDateTime");
  }

  @Test
  void testIntervalBoundaryClosingEnd() {
    LocalDate mergeDate = LocalDate.of(2022, 1, 31);

    assertThat(IntervalBoundary.HALF_OPEN.closingEnd(mergeDate)).isEqualTo(mergeDate);
    assertThat(IntervalBoundary.CLOSED.closingEnd(mergeDate)).isEqualTo(LocalDate.of(2022, 1, 30));
  }

  @Test
  void testFormat() {
    assertThat(DateTimeUtil.format(LocalDate.of(2022, 1, 31))).isEqualTo("2022-01-31");
    assertThat(DateTimeUtil.format(LocalDateTime.of(2022, 1, 31, 10, 15, 30)))
        .isEqualTo("2022-01-31T10:15:30");
  }
}
