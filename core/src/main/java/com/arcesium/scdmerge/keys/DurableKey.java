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

import com.arcesium.scdmerge.common.ValidationException;
import com.arcesium.scdmerge.table.Row;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The natural identifier of a dimension member: the values of its durable key columns, in key
 * column order. Numeric components are matched by value, so an Integer 1 and a Long 1 identify the
 * same member.
 */
public final class DurableKey {
  private final List<Object> values;

  private DurableKey(List<Object> values) {
    this.values = Collections.unmodifiableList(values);
  }

  public static DurableKey of(Object... values) {
    List<Object> normalized = new ArrayList<>(values.length);
    for (Object value : values) {
      normalized.add(normalize(value));
    }
    return new DurableKey(normalized);
  }

  /**
   * Reads the durable key of a row.
   *
   * @param row The row.
   * @param keyColumns The durable key columns.
   * @param origin Describes where the row comes from, for error messages.
   * @return The key.
   * @throws ValidationException if a key column is null
   */
  public static DurableKey from(Row row, List<String> keyColumns, String origin) {
    List<Object> values = new ArrayList<>(keyColumns.size());
    for (String keyColumn : keyColumns) {
      Object value = row.get(keyColumn);
      if (value == null) {
        throw new ValidationException(
            "Durable key column %s cannot be null in the %s. Row: %s", keyColumn, origin, row);
      }
      values.add(normalize(value));
    }
    return new DurableKey(values);
  }

  private static Object normalize(Object value) {
    if (value instanceof Long) {
      return value;
    }
    if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    BigDecimal decimal;
    if (value instanceof BigInteger) {
      decimal = new BigDecimal((BigInteger) value);
    } else if (value instanceof BigDecimal) {
      decimal = (BigDecimal) value;
    } else {
      return value;
    }
    decimal = decimal.signum() == 0 ? BigDecimal.ZERO : decimal.stripTrailingZeros();
    if (decimal.scale() <= 0 && decimal.toBigIntegerExact().bitLength() < Long.SIZE) {
      return decimal.longValueExact();
    }
    return decimal;
  }

  public List<Object> getValues() {
    return values;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof DurableKey)) {
      return false;
    }
    return values.equals(((DurableKey) o).values);
  }

  @Override
  public int hashCode() {
    return values.hashCode();
  }

  @Override
  public String toString() {
    return values.toString();
  }
}
