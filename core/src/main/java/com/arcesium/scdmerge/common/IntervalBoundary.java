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

/** How the effective end of a superseded version relates to the start of its successor. */
public enum IntervalBoundary {
  /**
   * Versions cover {@code [from, to)}: a superseded row ends exactly where its successor starts.
   */
  HALF_OPEN {
    @Override
    public Comparable<?> closingEnd(Object mergeTimestamp) {
      return (Comparable<?>) mergeTimestamp;
    }
  },
  /**
   * Versions cover {@code [from, to]}: a superseded row ends one tick (a day, or a microsecond for
   * date-times) before its successor starts.
   */
  CLOSED {
    @Override
    public Comparable<?> closingEnd(Object mergeTimestamp) {
      return DateTimeUtil.previousTick(mergeTimestamp);
    }
  };

  /**
   * Returns the effective end given to a row superseded at the merge timestamp.
   *
   * @param mergeTimestamp The merge timestamp.
   * @return The effective end of the superseded row.
   */
  public abstract Comparable<?> closingEnd(Object mergeTimestamp);
}
