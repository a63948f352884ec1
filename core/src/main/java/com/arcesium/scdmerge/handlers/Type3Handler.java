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
import com.arcesium.scdmerge.policy.Type3Mode;
import com.arcesium.scdmerge.table.Row;

/**
 * Type 3: the primary column takes the new value and the alternate column keeps the previous one.
 * In {@link Type3Mode#FREEZE_AFTER_FIRST} the alternate column is only written while it is null.
 */
public class Type3Handler implements ScdTypeHandler {
  @Override
  public ScdType getType() {
    return ScdType.TYPE_3;
  }

  @Override
  public void apply(BoundColumnPolicy policy, KeyMergeContext context) {
    String primaryColumn = policy.getValueColumn();
    String alternateColumn = policy.getAlternateColumn();
    Row reference = context.getReferenceRow();
    if (reference == null) {
      context.setOnAllRows(primaryColumn, context.getSourceValue(policy));
      context.setOnAllRows(alternateColumn, null);
      return;
    }

    Object previousPrimary = reference.get(primaryColumn);
    Object previousAlternate = reference.get(alternateColumn);
    if (!context.takesSourceValue(policy)) {
      context.setOnAllRows(primaryColumn, previousPrimary);
      context.setOnAllRows(alternateColumn, previousAlternate);
      return;
    }

    Object alternate;
    if (policy.getType3Mode() == Type3Mode.CASCADING || previousAlternate == null) {
      alternate = previousPrimary;
    } else {
      alternate = previousAlternate;
    }
    context.setOnAllRows(primaryColumn, context.getSourceValue(policy));
    context.setOnAllRows(alternateColumn, alternate);
  }
}
