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
package com.arcesium.scdmerge.keys;

import static org.assertj.core.api.Assertions.*;

import com.arcesium.scdmerge.policy.ChangeTrackingMetadata;
import java.math.BigDecimal;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ValueComparatorTest {

  @ParameterizedTest
  @MethodSource("provideComparisons")
  void testIsEqualWithoutMetadata(Object left, Object right, boolean expected) {
    assertThat(ValueComparator.isEqual(left, right, null)).isEqualTo(expected);
  }

  private static Stream<Arguments> provideComparisons() {
    return Stream.of(
        Arguments.of(null, null, true),
        Arguments.of(null, 1, false),
        Arguments.of("a", null, false),
        Arguments.of("a", "a", true),
        Arguments.of("a", "A", false),
        Arguments.of(700, 700L, true),
        Arguments.of(new BigDecimal("1.50"), 1.5d, true),
        Arguments.of(1.5d, 1.6d, false),
        Arguments.of(Double.NaN, Double.NaN, true),
        Arguments.of(1, "1", false));
  }

  @Test
  void testMaxDeltaValue() {
    ChangeTrackingMetadata<Double> metadata = new ChangeTrackingMetadata<>(0.01, null);

    assertThat(ValueComparator.isEqual(100.0, 100.005, metadata)).isTrue();
    assertThat(ValueComparator.isEqual(100.0, 100.01, metadata)).isTrue();
    assertThat(ValueComparator.isEqual(100.0, 100.02, metadata)).isFalse();
  }

  @Test
  void testNullReplacement() {
    ChangeTrackingMetadata<String> metadata = new ChangeTrackingMetadata<>(null, "N/A");

    assertThat(ValueComparator.isEqual(null, "N/A", metadata)).isTrue();
    assertThat(ValueComparator.isEqual("N/A", null, metadata)).isTrue();
    assertThat(ValueComparator.isEqual(null, "x", metadata)).isFalse();
  }
}
