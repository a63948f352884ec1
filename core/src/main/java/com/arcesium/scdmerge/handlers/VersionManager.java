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

import com.arcesium.scdmerge.common.DateTimeUtil;
import com.arcesium.scdmerge.common.ValidationException;
import com.arcesium.scdmerge.keys.ChangeStatus;
import com.arcesium.scdmerge.keys.ResolvedKey;
import com.arcesium.scdmerge.table.Row;

/**
 * Settles which rows a key has before its columns are handled: inserts the row of a new member,
 * and closes the current row and opens its successor when a versioned column changed.
 */
public class VersionManager {
  private final String dimensionName;

  /**
   * Creates a version manager.
   *
   * @param dimensionName Name of the dimension, used in error messages.
   */
  public VersionManager(String dimensionName) {
    this.dimensionName = dimensionName;
  }

  /**
   * Prepares the rows of one key present in the source batch.
   *
   * @param context The key's merge state.
   * @throws ValidationException if the current row starts after the merge timestamp
   */
  public void prepare(KeyMergeContext context) {
    if (!context.isVersioned()) {
      context.ensureFlatRow();
      return;
    }

    ResolvedKey key = context.getResolvedKey();
    VersioningColumns columns = context.getVersioningColumns();
    if (key.getStatus() == ChangeStatus.NEW) {
      checkHistoryEnded(context);
      MutableRow row = MutableRow.newVersion(context.getKeyColumns(), context.getSourceRow());
      openRow(row, context);
      context.appendCurrentRow(row);
      return;
    }
    if (key.getStatus() != ChangeStatus.CHANGED || !key.hasVersionedChange()) {
      return;
    }

    MutableRow current = context.getCurrentRow();
    Object currentStart = current.get(columns.getEffectiveStartColumn());
    int order = DateTimeUtil.compare(currentStart, context.getMergeTimestamp());
    if (order > 0) {
      throw new ValidationException(
          "SCD merge failed: Out-of-order records detected. Found records in dimension '%s' with %s (%s) greater than the current merge timestamp (%s) for durable key %s.",
          dimensionName,
          columns.getEffectiveStartColumn(),
          DateTimeUtil.format(currentStart),
          DateTimeUtil.format(context.getMergeTimestamp()),
          key.getKey());
    }
    if (order == 0) {
      // Same timestamp: the current version absorbs the change.
      return;
    }

    MutableRow successor = MutableRow.newVersionOf(current);
    successor.set(columns.getSurrogateKeyColumn(), null);
    openRow(successor, context);

    current.set(
        columns.getEffectiveEndColumn(),
        columns.getIntervalBoundary().closingEnd(context.getMergeTimestamp()));
    current.set(columns.getCurrentFlagColumn(), false);
    context.setClosedRow(current);
    context.appendCurrentRow(successor);
  }

  /** A reactivated key must not reopen before its last version ended. */
  private void checkHistoryEnded(KeyMergeContext context) {
    VersioningColumns columns = context.getVersioningColumns();
    Comparable<?> latestAllowedEnd =
        columns.getIntervalBoundary().closingEnd(context.getMergeTimestamp());
    for (Row row : context.getResolvedKey().getHistory()) {
      Object end = row.get(columns.getEffectiveEndColumn());
      ValidationException.checkNotNull(
          end,
          "Column %s cannot be null in dimension '%s' for durable key %s.",
          columns.getEffectiveEndColumn(),
          dimensionName,
          context.getResolvedKey().getKey());
      if (DateTimeUtil.compare(end, latestAllowedEnd) > 0) {
        throw new ValidationException(
            "SCD merge failed: Out-of-order records detected. Found records in dimension '%s' with %s (%s) overlapping the current merge timestamp (%s) for durable key %s.",
            dimensionName,
            columns.getEffectiveEndColumn(),
            DateTimeUtil.format(end),
            DateTimeUtil.format(context.getMergeTimestamp()),
            context.getResolvedKey().getKey());
      }
    }
  }

  private static void openRow(MutableRow row, KeyMergeContext context) {
    VersioningColumns columns = context.getVersioningColumns();
    row.set(columns.getSurrogateKeyColumn(), null);
    row.set(columns.getEffectiveStartColumn(), context.getMergeTimestamp());
    row.set(columns.getEffectiveEndColumn(), context.getMaxEffectiveTimestamp());
    row.set(columns.getCurrentFlagColumn(), true);
  }
}
