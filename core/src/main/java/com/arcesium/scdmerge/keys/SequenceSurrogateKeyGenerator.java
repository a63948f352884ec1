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

import com.arcesium.scdmerge.common.SurrogateKeyCollisionException;
import com.arcesium.scdmerge.common.ValidationException;
import java.util.Collection;
import java.util.concurrent.atomic.AtomicLong;

/** Monotonic long surrogate keys backed by an atomic counter. */
public class SequenceSurrogateKeyGenerator implements SurrogateKeyGenerator {
  private final AtomicLong lastIssued;

  /**
   * Creates a sequence whose first key is {@code lastIssued + 1}.
   *
   * @param lastIssued The last key considered used.
   */
  public SequenceSurrogateKeyGenerator(long lastIssued) {
    this.lastIssued = new AtomicLong(lastIssued);
  }

  /**
   * Creates a sequence continuing after the largest of the given keys, or starting at 1.
   *
   * @param existingKeys Keys already in use; must be integral numbers.
   * @return The generator.
   */
  public static SequenceSurrogateKeyGenerator startingAfter(Collection<Object> existingKeys) {
    return new SequenceSurrogateKeyGenerator(maxKey(existingKeys));
  }

  /**
   * Moves the sequence past the given keys if it is behind them.
   *
   * @param existingKeys Keys already in use; must be integral numbers.
   */
  public void advancePast(Collection<Object> existingKeys) {
    long max = maxKey(existingKeys);
    lastIssued.accumulateAndGet(max, Math::max);
  }

  @Override
  public Long nextKey() {
    long next = lastIssued.incrementAndGet();
    if (next == Long.MIN_VALUE) {
      throw new SurrogateKeyCollisionException("Surrogate key sequence is exhausted.");
    }
    return next;
  }

  /**
   * Returns the last key handed out or skipped.
   *
   * @return The last issued key.
   */
  public long getLastIssued() {
    return lastIssued.get();
  }

  private static long maxKey(Collection<Object> existingKeys) {
    long max = 0L;
    if (existingKeys == null) {
      return max;
    }
    for (Object key : existingKeys) {
      if (key == null) {
        continue;
      }
      ValidationException.check(
          key instanceof Long || key instanceof Integer || key instanceof Short,
          "Sequence surrogate keys must be integral numbers, found %s (%s).",
          key,
          key.getClass().getSimpleName());
      max = Math.max(max, ((Number) key).longValue());
    }
    return max;
  }
}
