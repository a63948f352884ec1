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
 * Type 6: versions the historical column like type 2, then writes the latest source value into
 * the current column of every row of the member.
 */
public class Type6Handler extends Type2Handler {
  @Override
  public ScdType getType() {
    return ScdType.TYPE_6;
  }

  @Override
  public void apply(BoundColumnPolicy policy, KeyMergeContext context) {
    super.apply(policy, context);
    context.setOnAllRows(policy.getShadowCurrentColumn(), context.getSourceValue(policy));
  }
}
