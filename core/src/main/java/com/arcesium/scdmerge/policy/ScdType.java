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

/** The historization techniques a column can be declared with. */
public enum ScdType {
  /** Retain the original value. */
  TYPE_0(0, false, false),
  /** Overwrite with the latest value. */
  TYPE_1(1, false, true),
  /** Add a new row per change. */
  TYPE_2(2, true, true),
  /** Keep the previous value in an alternate column. */
  TYPE_3(3, false, true),
  /** Type 2 versioning plus a current value repeated on every row of the member. */
  TYPE_6(6, true, true),
  /** Type 2 versioning with both the durable and surrogate keys exposed for joins. */
  TYPE_7(7, true, true),
  /** Carried over from the source as is, without historization or change tracking. */
  PASS_THROUGH(-1, false, false);

  private final int number;
  private final boolean versioned;
  private final boolean changeTracked;

  ScdType(int number, boolean versioned, boolean changeTracked) {
    this.number = number;
    this.versioned = versioned;
    this.changeTracked = changeTracked;
  }

  public int getNumber() {
    return number;
  }

  /**
   * Whether a change of a column of this type adds a new version row.
   *
   * @return true for types 2, 6 and 7
   */
  public boolean isVersioned() {
    return versioned;
  }

  /**
   * Whether the stored value follows source changes, which change tracking metadata can tune.
   *
   * @return false for type 0 and pass-through columns
   */
  public boolean isChangeTracked() {
    return changeTracked;
  }

  /**
   * Looks up a type by its Kimball number.
   *
   * @param number The SCD type number.
   * @return The ScdType.
   * @throws InvalidPolicyParamsException if the number is not one of 0, 1, 2, 3, 6, 7
   */
  public static ScdType fromNumber(int number) {
    for (ScdType type : values()) {
      if (type != PASS_THROUGH && type.number == number) {
        return type;
      }
    }
    throw new InvalidPolicyParamsException(
        "SCD type %d is not supported. Supported types are 0, 1, 2, 3, 6 and 7.", number);
  }
}
