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

import com.arcesium.scdmerge.policy.BoundColumnPolicy;
import com.arcesium.scdmerge.table.Row;
import com.google.common.collect.ImmutableList;
import java.util.List;

/** A durable key together with its source row, its target history and its change status. */
public final class ResolvedKey {
  private final DurableKey key;
  private final ChangeStatus status;
  private final Row sourceRow;
  private final Row currentRow;
  private final ImmutableList<Row> history;
  private final ImmutableList<BoundColumnPolicy> changedPolicies;

  ResolvedKey(
      DurableKey key,
      ChangeStatus status,
      Row sourceRow,
      Row currentRow,
      List<Row> history,
      List<BoundColumnPolicy> changedPolicies) {
    this.key = key;
    this.status = status;
    this.sourceRow = sourceRow;
    this.currentRow = currentRow;
    this.history = ImmutableList.copyOf(history);
    this.changedPolicies = ImmutableList.copyOf(changedPolicies);
  }

  public DurableKey getKey() {
    return key;
  }

  public ChangeStatus getStatus() {
    return status;
  }

  /** The batch row of the key, null when the status is ABSENT. */
  public Row getSourceRow() {
    return sourceRow;
  }

  /** The current target row of the key, null when the status is NEW or there is none. */
  public Row getCurrentRow() {
    return currentRow;
  }

  /** All target rows of the key, in target order. */
  public List<Row> getHistory() {
    return history;
  }

  /** The change-tracked policies whose value differs from the current target row. */
  public List<BoundColumnPolicy> getChangedPolicies() {
    return changedPolicies;
  }

  /**
   * Whether the change touches a versioned column, which is what adds a new version row.
   *
   * @return true when a type 2, 6 or 7 column changed
   */
  public boolean hasVersionedChange() {
    return changedPolicies.stream().anyMatch(p -> p.getType().isVersioned());
  }

  /**
   * Whether a given policy's column changed.
   *
   * @param policy The policy.
   * @return true if it is among the changed policies
   */
  public boolean isChanged(BoundColumnPolicy policy) {
    return changedPolicies.contains(policy);
  }

  @Override
  public String toString() {
    return "ResolvedKey{"
        + "key="
        + key
        + ", status="
        + status
        + ", historySize="
        + history.size()
        + ", changedPolicies="
        + changedPolicies
        + '}';
  }
}
