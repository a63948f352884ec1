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

/** Type 1: the latest source value overwrites the column on every row of the member. */
public class Type1Handler implements ScdTypeHandler {
  @Override
  public ScdType getType() {
    return ScdType.TYPE_1;
  }

  @Override
  public void apply(BoundColumnPolicy policy, KeyMergeContext context) {
    Object value =
        context.takesSourceValue(policy)
            ? context.getSourceValue(policy)
            : context.getReferenceRow().get(policy.getValueColumn());
    context.setOnAllRows(policy.getValueColumn(), value);
  }
}
