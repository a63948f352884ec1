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

import com.arcesium.scdmerge.common.DuplicateCurrentRowException;
import com.arcesium.scdmerge.common.DuplicateSourceKeyException;
import com.arcesium.scdmerge.common.ValidationException;
import com.arcesium.scdmerge.policy.BoundColumnPolicy;
import com.arcesium.scdmerge.policy.ColumnPolicyRegistry;
import com.arcesium.scdmerge.policy.ScdType;
import com.arcesium.scdmerge.table.DimensionTable;
import com.arcesium.scdmerge.table.Row;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches source rows to the current target row of their durable key and classifies every key as
 * NEW, CHANGED, UNCHANGED or ABSENT.
 */
public class KeyResolver {
  private static final Logger LOGGER = LoggerFactory.getLogger(KeyResolver.class);
  private final ColumnPolicyRegistry registry;
  private final String currentFlagColumn;

  /**
   * Creates a resolver.
   *
   * @param registry The validated policies.
   * @param currentFlagColumn The current flag column of a versioned dimension. Ignored for flat
   *     dimensions, where the single row of a key is its current row.
   */
  public KeyResolver(ColumnPolicyRegistry registry, String currentFlagColumn) {
    this.registry = registry;
    this.currentFlagColumn = currentFlagColumn;
  }

  /**
   * Resolves the keys of a batch against a target snapshot.
   *
   * @param source The source batch.
   * @param target The target snapshot.
   * @return The resolution.
   * @throws DuplicateSourceKeyException if the batch holds two rows for one key
   * @throws DuplicateCurrentRowException if the target holds two current rows for one key
   */
  public KeyResolution resolve(DimensionTable source, DimensionTable target) {
    List<String> keyColumns = registry.getKeyColumns();
    Map<DurableKey, Row> sourceRows = indexSource(source, keyColumns);
    Map<DurableKey, List<Row>> targetRows = new LinkedHashMap<>();
    for (Row row : target.rows()) {
      targetRows
          .computeIfAbsent(DurableKey.from(row, keyColumns, "target"), k -> new ArrayList<>())
          .add(row);
    }

    List<ResolvedKey> resolved = new ArrayList<>(targetRows.size() + sourceRows.size());
    for (Map.Entry<DurableKey, List<Row>> entry : targetRows.entrySet()) {
      DurableKey key = entry.getKey();
      Row currentRow = findCurrentRow(key, entry.getValue());
      Row sourceRow = sourceRows.get(key);
      if (sourceRow == null) {
        resolved.add(
            new ResolvedKey(
                key, ChangeStatus.ABSENT, null, currentRow, entry.getValue(), List.of()));
      } else {
        resolved.add(classify(key, sourceRow, currentRow, entry.getValue()));
      }
    }
    for (Map.Entry<DurableKey, Row> entry : sourceRows.entrySet()) {
      if (!targetRows.containsKey(entry.getKey())) {
        resolved.add(classify(entry.getKey(), entry.getValue(), null, List.of()));
      }
    }
    KeyResolution resolution = new KeyResolution(resolved);
    LOGGER.debug("Resolved durable keys: {}", resolution.countByStatus());
    return resolution;
  }

  private Map<DurableKey, Row> indexSource(DimensionTable source, List<String> keyColumns) {
    Map<DurableKey, Row> sourceRows = new LinkedHashMap<>();
    for (Row row : source.rows()) {
      DurableKey key = DurableKey.from(row, keyColumns, "source");
      if (sourceRows.putIfAbsent(key, row) != null) {
        throw new DuplicateSourceKeyException(
            "Source batch contains more than one row for durable key %s on columns %s.",
            key,
            keyColumns);
      }
    }
    return sourceRows;
  }

  private Row findCurrentRow(DurableKey key, List<Row> history) {
    if (!registry.isVersioned()) {
      if (history.size() > 1) {
        throw new DuplicateCurrentRowException(
            "Target contains %d rows for durable key %s of a dimension without versioned columns.",
            history.size(),
            key);
      }
      return history.get(0);
    }
    Row current = null;
    for (Row row : history) {
      Object flag = row.get(currentFlagColumn);
      ValidationException.check(
          flag == null || flag instanceof Boolean,
          "Column %s must hold boolean values, found %s for durable key %s.",
          currentFlagColumn,
          flag,
          key);
      if (Boolean.TRUE.equals(flag)) {
        if (current != null) {
          throw new DuplicateCurrentRowException(
              "Target contains more than one current row for durable key %s.", key);
        }
        current = row;
      }
    }
    return current;
  }

  private ResolvedKey classify(DurableKey key, Row sourceRow, Row currentRow, List<Row> history) {
    if (currentRow == null) {
      return new ResolvedKey(key, ChangeStatus.NEW, sourceRow, null, history, List.of());
    }
    List<BoundColumnPolicy> changed = new ArrayList<>();
    for (BoundColumnPolicy policy : registry.getPolicies()) {
      // Type 0 takes part in classification although its stored value never changes.
      if (policy.getType() == ScdType.PASS_THROUGH) {
        continue;
      }
      Object sourceValue = sourceRow.get(policy.getSourceColumn());
      Object targetValue = currentRow.get(policy.getValueColumn());
      if (!ValueComparator.isEqual(sourceValue, targetValue, policy.getChangeTrackingMetadata())) {
        changed.add(policy);
      }
    }
    ChangeStatus status = changed.isEmpty() ? ChangeStatus.UNCHANGED : ChangeStatus.CHANGED;
    return new ResolvedKey(key, status, sourceRow, currentRow, history, changed);
  }
}
