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

/** Outcome of matching a durable key of the source batch against the target snapshot. */
public enum ChangeStatus {
  /** No current target row exists for the key. */
  NEW,
  /**
   * At least one declared column differs from the current target row. Pass-through columns are
   * not compared.
   */
  CHANGED,
  /** All declared columns other than pass-through ones equal the current target row. */
  UNCHANGED,
  /** The key only exists in the target; its rows are carried over untouched. */
  ABSENT
}
