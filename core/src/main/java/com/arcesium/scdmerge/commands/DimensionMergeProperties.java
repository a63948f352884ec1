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
package com.arcesium.scdmerge.commands;

import com.arcesium.scdmerge.common.IntervalBoundary;
import com.arcesium.scdmerge.keys.SurrogateKeyGeneratorFactory;
import com.arcesium.scdmerge.policy.ColumnNamingStrategy;
import com.arcesium.scdmerge.policy.ColumnPolicies;
import com.arcesium.scdmerge.policy.Type3Mode;
import com.arcesium.scdmerge.table.DimensionTable;

/** Represents properties of one merge of a source batch into a dimension. */
public class DimensionMergeProperties {
  private String dimensionName;
  private DimensionTable source;
  private DimensionTable target;
  private Comparable<?> mergeTimestamp;
  private ColumnPolicies columnPolicies;
  private ColumnNamingStrategy namingStrategy;
  private String surrogateKeyColumn;
  private String effectiveStartColumn;
  private String effectiveEndColumn;
  private String currentFlagColumn;
  private Type3Mode defaultType3Mode;
  private IntervalBoundary intervalBoundary;
  private Comparable<?> maxEffectiveTimestamp;
  private SurrogateKeyGeneratorFactory surrogateKeyGeneratorFactory;
  private boolean skipEmptySource;

  public DimensionMergeProperties() {}

  public String getDimensionName() {
    return dimensionName;
  }

  public void setDimensionName(String dimensionName) {
    this.dimensionName = dimensionName;
  }

  public DimensionTable getSource() {
    return source;
  }

  public void setSource(DimensionTable source) {
    this.source = source;
  }

  public DimensionTable getTarget() {
    return target;
  }

  public void setTarget(DimensionTable target) {
    this.target = target;
  }

  public Comparable<?> getMergeTimestamp() {
    return mergeTimestamp;
  }

  public void setMergeTimestamp(Comparable<?> mergeTimestamp) {
    this.mergeTimestamp = mergeTimestamp;
  }

  public ColumnPolicies getColumnPolicies() {
    return columnPolicies;
  }

  public void setColumnPolicies(ColumnPolicies columnPolicies) {
    this.columnPolicies = columnPolicies;
  }

  public ColumnNamingStrategy getNamingStrategy() {
    return namingStrategy;
  }

  public void setNamingStrategy(ColumnNamingStrategy namingStrategy) {
    this.namingStrategy = namingStrategy;
  }

  public String getSurrogateKeyColumn() {
    return surrogateKeyColumn;
  }

  public void setSurrogateKeyColumn(String surrogateKeyColumn) {
    this.surrogateKeyColumn = surrogateKeyColumn;
  }

  public String getEffectiveStartColumn() {
    return effectiveStartColumn;
  }

  public void setEffectiveStartColumn(String effectiveStartColumn) {
    this.effectiveStartColumn = effectiveStartColumn;
  }

  public String getEffectiveEndColumn() {
    return effectiveEndColumn;
  }

  public void setEffectiveEndColumn(String effectiveEndColumn) {
    this.effectiveEndColumn = effectiveEndColumn;
  }

  public String getCurrentFlagColumn() {
    return currentFlagColumn;
  }

  public void setCurrentFlagColumn(String currentFlagColumn) {
    this.currentFlagColumn = currentFlagColumn;
  }

  public Type3Mode getDefaultType3Mode() {
    return defaultType3Mode;
  }

  public void setDefaultType3Mode(Type3Mode defaultType3Mode) {
    this.defaultType3Mode = defaultType3Mode;
  }

  public IntervalBoundary getIntervalBoundary() {
    return intervalBoundary;
  }

  public void setIntervalBoundary(IntervalBoundary intervalBoundary) {
    this.intervalBoundary = intervalBoundary;
  }

  public Comparable<?> getMaxEffectiveTimestamp() {
    return maxEffectiveTimestamp;
  }

  public void setMaxEffectiveTimestamp(Comparable<?> maxEffectiveTimestamp) {
    this.maxEffectiveTimestamp = maxEffectiveTimestamp;
  }

  public SurrogateKeyGeneratorFactory getSurrogateKeyGeneratorFactory() {
    return surrogateKeyGeneratorFactory;
  }

  public void setSurrogateKeyGeneratorFactory(
      SurrogateKeyGeneratorFactory surrogateKeyGeneratorFactory) {
    this.surrogateKeyGeneratorFactory = surrogateKeyGeneratorFactory;
  }

  public boolean isSkipEmptySource() {
    return skipEmptySource;
  }

  public void setSkipEmptySource(boolean skipEmptySource) {
    this.skipEmptySource = skipEmptySource;
  }

  @Override
  public String toString() {
    return "DimensionMergeProperties{"
        + "dimensionName='"
        + dimensionName
        + '\''
        + ", sourceSize="
        + (source == null ? null : source.size())
        + ", targetSize="
        + (target == null ? null : target.size())
        + ", mergeTimestamp="
        + mergeTimestamp
        + ", columnPolicies="
        + columnPolicies
        + ", surrogateKeyColumn='"
        + surrogateKeyColumn
        + '\''
        + ", effectiveStartColumn='"
        + effectiveStartColumn
        + '\''
        + ", effectiveEndColumn='"
        + effectiveEndColumn
        + '\''
        + ", currentFlagColumn='"
        + currentFlagColumn
        + '\''
        + ", defaultType3Mode="
        + defaultType3Mode
        + ", intervalBoundary="
        + intervalBoundary
        + ", maxEffectiveTimestamp="
        + maxEffectiveTimestamp
        + ", skipEmptySource="
        + skipEmptySource
        + '}';
  }
}
