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

import com.arcesium.scdmerge.policy.BoundColumnPolicy;
import com.arcesium.scdmerge.policy.ScdType;

/**
 * Applies the historization technique of one SCD type to one column of one durable key. Handlers
 * run after versioning has settled which rows exist, and are only called for keys present in the
 * source batch.
 */
public interface ScdTypeHandler {
  /**
   * The SCD type handled.
   *
   * @return The type.
   */
  ScdType getType();

  /**
   * Writes the policy's output columns for one key.
   *
   * @param policy The bound policy.
   * @param context The key's merge state.
   */
  void apply(BoundColumnPolicy policy, KeyMergeContext context);
}
