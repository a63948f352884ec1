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
 * Type 2: the versioned column takes the source value on the current row only. Closed rows keep
 * the value they held, so history stays intact. The rows themselves are opened and closed by
 * {@link VersionManager}.
 */
public class Type2Handler implements ScdTypeHandler {
  @Override
  public ScdType getType() {
    return ScdType.TYPE_2;
  }

  @Override
  public void apply(BoundColumnPolicy policy, KeyMergeContext context) {
    if (context.takesSourceValue(policy)) {
      context.getCurrentRow().set(policy.getValueColumn(), context.getSourceValue(policy));
    }
  }
}
