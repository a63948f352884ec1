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
package com.arcesium.scdmerge.metrics;

import java.time.Duration;

/** Represents metrics for one merge of a source batch into a dimension. */
public class MergeMetrics implements Metrics {
  private final String dimensionName;
  private final Duration totalDuration;
  private final int newKeysCount;
  private final int changedKeysCount;
  private final int unchangedKeysCount;
  private final int absentKeysCount;
  private final long insertedRowsCount;
  private final long closedRowsCount;

  /**
   * Constructs a MergeMetrics object for a merge that changed nothing.
   *
   * @param dimensionName The name of the dimension.
   */
  public MergeMetrics(String dimensionName) {
    this(dimensionName, Duration.ZERO, 0, 0, 0, 0, 0, 0);
  }

  /**
   * Constructs a MergeMetrics object with all metrics.
   *
   * @param dimensionName The name of the dimension.
   * @param totalDuration Total duration of the merge.
   * @param newKeysCount Number of durable keys new to the dimension.
   * @param changedKeysCount Number of durable keys with a changed tracked column.
   * @param unchangedKeysCount Number of durable keys present in the batch without changes.
   * @param absentKeysCount Number of durable keys of the dimension missing from the batch.
   * @param insertedRowsCount Number of rows added to the dimension.
   * @param closedRowsCount Number of current rows closed by the merge.
   */
  public MergeMetrics(
      String dimensionName,
      Duration totalDuration,
      int newKeysCount,
      int changedKeysCount,
      int unchangedKeysCount,
      int absentKeysCount,
      long insertedRowsCount,
      long closedRowsCount) {
    this.dimensionName = dimensionName;
    this.totalDuration = totalDuration;
    this.newKeysCount = newKeysCount;
    this.changedKeysCount = changedKeysCount;
    this.unchangedKeysCount = unchangedKeysCount;
    this.absentKeysCount = absentKeysCount;
    this.insertedRowsCount = insertedRowsCount;
    this.closedRowsCount = closedRowsCount;
  }

  public String getDimensionName() {
    return dimensionName;
  }

  public Duration getTotalDuration() {
    return totalDuration;
  }

  public int getNewKeysCount() {
    return newKeysCount;
  }

  public int getChangedKeysCount() {
    return changedKeysCount;
  }

  public int getUnchangedKeysCount() {
    return unchangedKeysCount;
  }

  public int getAbsentKeysCount() {
    return absentKeysCount;
  }

  public long getInsertedRowsCount() {
    return insertedRowsCount;
  }

  public long getClosedRowsCount() {
    return closedRowsCount;
  }

  /**
   * Returns a string representation of the MergeMetrics object.
   *
   * @return A string representation of the object.
   */
  @Override
  public String toString() {
    return "MergeMetrics{"
        + "dimensionName='"
        + dimensionName
        + '\''
        + ", totalDuration="
        + totalDuration
        + ", newKeysCount="
        + newKeysCount
        + ", changedKeysCount="
        + changedKeysCount
        + ", unchangedKeysCount="
        + unchangedKeysCount
        + ", absentKeysCount="
        + absentKeysCount
        + ", insertedRowsCount="
        + insertedRowsCount
        + ", closedRowsCount="
        + closedRowsCount
        + '}';
  }
}
