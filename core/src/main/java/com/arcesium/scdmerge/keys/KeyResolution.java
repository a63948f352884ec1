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

import com.google.common.collect.ImmutableList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * The partition of all durable keys of a merge. Keys are ordered by first appearance in the target,
 * then by appearance in the source for keys the target does not hold.
 */
public final class KeyResolution {
  private final ImmutableList<ResolvedKey> keys;

  KeyResolution(List<ResolvedKey> keys) {
    this.keys = ImmutableList.copyOf(keys);
  }

  public List<ResolvedKey> getKeys() {
    return keys;
  }

  /**
   * Returns the keys with the given status, in resolution order.
   *
   * @param status The status.
   * @return The matching keys.
   */
  public List<ResolvedKey> getKeys(ChangeStatus status) {
    return keys.stream().filter(k -> k.getStatus() == status).collect(Collectors.toList());
  }

  /**
   * Counts keys per status.
   *
   * @return The count of each status.
   */
  public Map<ChangeStatus, Integer> countByStatus() {
    Map<ChangeStatus, Integer> counts = new EnumMap<>(ChangeStatus.class);
    for (ChangeStatus status : ChangeStatus.values()) {
      counts.put(status, 0);
    }
    keys.forEach(k -> counts.merge(k.getStatus(), 1, Integer::sum));
    return counts;
  }
}
