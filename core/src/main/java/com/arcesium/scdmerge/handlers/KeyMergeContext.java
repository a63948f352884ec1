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

import com.arcesium.scdmerge.keys.ChangeStatus;
import com.arcesium.scdmerge.keys.ResolvedKey;
import com.arcesium.scdmerge.policy.BoundColumnPolicy;
import com.arcesium.scdmerge.table.Row;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Working state of the merge of one durable key: copies of its target rows, the rows added by
 * versioning, and which row is current. Handlers of the key's columns read and write it in turn.
 * A context is confined to one thread.
 */
public final class KeyMergeContext {
  private final ResolvedKey resolvedKey;
  private final List<String> keyColumns;
  private final Comparable<?> mergeTimestamp;
  private final Comparable<?> maxEffectiveTimestamp;
  private final VersioningColumns versioningColumns;
  private final List<MutableRow> rows = new ArrayList<>();
  private MutableRow currentRow;
  private MutableRow closedRow;

  private KeyMergeContext(
      ResolvedKey resolvedKey,
      List<String> keyColumns,
      Comparable<?> mergeTimestamp,
      Comparable<?> maxEffectiveTimestamp,
      VersioningColumns versioningColumns) {
    this.resolvedKey = resolvedKey;
    this.keyColumns = keyColumns;
    this.mergeTimestamp = mergeTimestamp;
    this.maxEffectiveTimestamp = maxEffectiveTimestamp;
    this.versioningColumns = versioningColumns;
    List<Row> history = resolvedKey.getHistory();
    for (Row row : history) {
      MutableRow copy = MutableRow.copyOf(row);
      rows.add(copy);
      if (row == resolvedKey.getCurrentRow()) {
        currentRow = copy;
      }
    }
  }

  /**
   * Creates the context of one key.
   *
   * @param resolvedKey The resolved key.
   * @param keyColumns The durable key columns.
   * @param mergeTimestamp The merge timestamp.
   * @param maxEffectiveTimestamp The effective end of current rows.
   * @param versioningColumns Bookkeeping columns, or null for a dimension without versioning.
   * @return The context.
   */
  public static KeyMergeContext forKey(
      ResolvedKey resolvedKey,
      List<String> keyColumns,
      Comparable<?> mergeTimestamp,
      Comparable<?> maxEffectiveTimestamp,
      VersioningColumns versioningColumns) {
    return new KeyMergeContext(
        resolvedKey, keyColumns, mergeTimestamp, maxEffectiveTimestamp, versioningColumns);
  }

  public ResolvedKey getResolvedKey() {
    return resolvedKey;
  }

  public ChangeStatus getStatus() {
    return resolvedKey.getStatus();
  }

  public List<String> getKeyColumns() {
    return keyColumns;
  }

  public Comparable<?> getMergeTimestamp() {
    return mergeTimestamp;
  }

  public Comparable<?> getMaxEffectiveTimestamp() {
    return maxEffectiveTimestamp;
  }

  /** Bookkeeping columns, null when the dimension is not versioned. */
  public VersioningColumns getVersioningColumns() {
    return versioningColumns;
  }

  public boolean isVersioned() {
    return versioningColumns != null;
  }

  public Row getSourceRow() {
    return resolvedKey.getSourceRow();
  }

  public Object getSourceValue(BoundColumnPolicy policy) {
    return resolvedKey.getSourceRow().get(policy.getSourceColumn());
  }

  /**
   * The target row whose key-level values the merge starts from: the current row, or the latest
   * row of a member without a current row. Null for a member the target does not hold.
   */
  public Row getReferenceRow() {
    if (resolvedKey.getCurrentRow() != null) {
      return resolvedKey.getCurrentRow();
    }
    List<Row> history = resolvedKey.getHistory();
    return history.isEmpty() ? null : history.get(history.size() - 1);
  }

  /**
   * Whether a policy's column takes the source value on the current row: for new members and for
   * columns whose value changed.
   *
   * @param policy The policy.
   * @return true if the source value must be written
   */
  public boolean takesSourceValue(BoundColumnPolicy policy) {
    return getStatus() == ChangeStatus.NEW || resolvedKey.isChanged(policy);
  }

  /** All rows of the key, target rows first, in target order. */
  public List<MutableRow> getRows() {
    return Collections.unmodifiableList(rows);
  }

  /** The row that is current once the merge completes. */
  public MutableRow getCurrentRow() {
    return currentRow;
  }

  /** The row closed by this merge, or null. */
  public MutableRow getClosedRow() {
    return closedRow;
  }

  /**
   * Writes a key-level value on every row of the key.
   *
   * @param column The column.
   * @param value The value.
   */
  public void setOnAllRows(String column, Object value) {
    rows.forEach(r -> r.set(column, value));
  }

  void appendCurrentRow(MutableRow row) {
    rows.add(row);
    currentRow = row;
  }

  void setClosedRow(MutableRow row) {
    closedRow = row;
  }

  /** Creates the single row of a new member of a dimension without versioning. */
  public void ensureFlatRow() {
    if (currentRow == null) {
      appendCurrentRow(MutableRow.newFlatRow(keyColumns, getSourceRow()));
    }
  }
}
