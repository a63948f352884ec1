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

import com.arcesium.scdmerge.policy.ChangeTrackingMetadata;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Null-aware value comparison used for change detection. Null equals null and never equals a
 * non-null value. Numbers compare by value regardless of their boxed type.
 */
public class ValueComparator {
  private ValueComparator() {}

  /**
   * Compares a source value with a stored value.
   *
   * @param left The first value.
   * @param right The second value.
   * @param metadata Optional tolerance and null replacement, may be null.
   * @return true when the values count as equal
   */
  public static boolean isEqual(Object left, Object right, ChangeTrackingMetadata<?> metadata) {
    if (metadata != null && metadata.getNullReplacement() != null) {
      left = left == null ? metadata.getNullReplacement() : left;
      right = right == null ? metadata.getNullReplacement() : right;
    }
    if (left == null || right == null) {
      return left == right;
    }
    if (left instanceof Number && right instanceof Number) {
      BigDecimal l = toBigDecimal((Number) left);
      BigDecimal r = toBigDecimal((Number) right);
      if (l == null || r == null) {
        return Objects.equals(left, right);
      }
      if (metadata != null && metadata.getMaxDeltaValue() != null) {
        return l.subtract(r).abs().compareTo(BigDecimal.valueOf(metadata.getMaxDeltaValue())) <= 0;
      }
      return l.compareTo(r) == 0;
    }
    return Objects.equals(left, right);
  }

  private static BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal) {
      return (BigDecimal) number;
    }
    if (number instanceof Double || number instanceof Float) {
      double value = number.doubleValue();
      if (Double.isNaN(value) || Double.isInfinite(value)) {
        return null;
      }
    }
    try {
      return new BigDecimal(number.toString());
    } catch (NumberFormatException e) {
      // Number subclasses without a decimal string form
      return null;
    }
  }
}
