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

import java.util.Objects;

/**
 * Describes how values of a change-tracked column are compared when detecting changes.
 *
 * @param <T> The type of the null replacement value
 */
public class ChangeTrackingMetadata<T> {
  private final Double maxDeltaValue; // Numeric tolerance for value comparisons
  private final T nullReplacement; // Value to use for NULL during comparison

  /**
   * Constructs a new ChangeTrackingMetadata instance.
   *
   * @param maxDeltaValue The maximum difference under which two numbers count as equal
   * @param nullReplacement The value substituted for null before comparing
   */
  public ChangeTrackingMetadata(Double maxDeltaValue, T nullReplacement) {
    this.maxDeltaValue = maxDeltaValue;
    this.nullReplacement = nullReplacement;
  }

  public Double getMaxDeltaValue() {
    return maxDeltaValue;
  }

  public T getNullReplacement() {
    return nullReplacement;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof ChangeTrackingMetadata)) {
      return false;
    }
    ChangeTrackingMetadata<?> that = (ChangeTrackingMetadata<?>) o;
    return Objects.equals(maxDeltaValue, that.maxDeltaValue)
        && Objects.equals(nullReplacement, that.nullReplacement);
  }

  @Override
  public int hashCode() {
    return Objects.hash(maxDeltaValue, nullReplacement);
  }

  @Override
  public String toString() {
    return "ChangeTrackingMetadata{"
        + "maxDeltaValue="
        + maxDeltaValue
        + ", nullReplacement="
        + nullReplacement
        + '}';
  }
}
