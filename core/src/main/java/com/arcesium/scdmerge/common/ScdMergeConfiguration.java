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
package com.arcesium.scdmerge.common;

import com.arcesium.scdmerge.keys.SurrogateKeyGeneratorFactory;
import com.arcesium.scdmerge.metrics.MetricCollector;
import com.arcesium.scdmerge.policy.ColumnNamingStrategy;
import com.arcesium.scdmerge.policy.Type3Mode;

/**
 * Configuration class for the SCD merge engine. This class holds the settings shared by all merges
 * run through one engine.
 */
public class ScdMergeConfiguration {
  private String applicationId;
  private ColumnNamingStrategy namingStrategy;
  private String surrogateKeyColumn;
  private String effectiveStartColumn;
  private String effectiveEndColumn;
  private String currentFlagColumn;
  private Type3Mode defaultType3Mode;
  private IntervalBoundary intervalBoundary;
  private Comparable<?> maxEffectiveTimestamp;
  private SurrogateKeyGeneratorFactory surrogateKeyGeneratorFactory;
  private Integer threads;
  private Integer parallelismThreshold;
  private MetricCollector metricCollector;
  private boolean skipEmptySource;

  public ScdMergeConfiguration() {}

  /**
   * Creates a copy of another configuration.
   *
   * @param other The configuration to copy.
   */
  public ScdMergeConfiguration(ScdMergeConfiguration other) {
    this.applicationId = other.applicationId;
    this.namingStrategy = other.namingStrategy;
    this.surrogateKeyColumn = other.surrogateKeyColumn;
    this.effectiveStartColumn = other.effectiveStartColumn;
    this.effectiveEndColumn = other.effectiveEndColumn;
    this.currentFlagColumn = other.currentFlagColumn;
    this.defaultType3Mode = other.defaultType3Mode;
    this.intervalBoundary = other.intervalBoundary;
    this.maxEffectiveTimestamp = other.maxEffectiveTimestamp;
    this.surrogateKeyGeneratorFactory = other.surrogateKeyGeneratorFactory;
    this.threads = other.threads;
    this.parallelismThreshold = other.parallelismThreshold;
    this.metricCollector = other.metricCollector;
    this.skipEmptySource = other.skipEmptySource;
  }

  /**
   * Gets the application ID.
   *
   * @return The application ID.
   */
  public String getApplicationId() {
    return applicationId;
  }

  /**
   * Sets the application ID.
   *
   * @param applicationId The application ID to set.
   */
  public void setApplicationId(String applicationId) {
    this.applicationId = applicationId;
  }

  /**
   * Gets the strategy naming the output columns of policies.
   *
   * @return The naming strategy.
   */
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

  /**
   * Gets the type 3 mode applied to policies that do not set their own.
   *
   * @return The default type 3 mode.
   */
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

  /**
   * Gets the effective end of current rows. Null means 9999-12-31 in the type of the merge
   * timestamp.
   *
   * @return The max effective timestamp, or null.
   */
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

  /**
   * Gets the number of threads.
   *
   * @return The number of threads.
   */
  public Integer getThreads() {
    return threads;
  }

  /**
   * Sets the number of threads.
   *
   * @param threads The number of threads to set.
   */
  public void setThreads(Integer threads) {
    this.threads = threads;
  }

  /**
   * Gets the number of durable keys above which a merge processes keys in parallel.
   *
   * @return The parallelism threshold.
   */
  public Integer getParallelismThreshold() {
    return parallelismThreshold;
  }

  public void setParallelismThreshold(Integer parallelismThreshold) {
    this.parallelismThreshold = parallelismThreshold;
  }

  /**
   * Gets the metric collector.
   *
   * @return The metric collector.
   */
  public MetricCollector getMetricCollector() {
    return metricCollector;
  }

  /**
   * Sets the metric collector.
   *
   * @param metricCollector The metric collector to set.
   */
  public void setMetricCollector(MetricCollector metricCollector) {
    this.metricCollector = metricCollector;
  }

  public boolean isSkipEmptySource() {
    return skipEmptySource;
  }

  public void setSkipEmptySource(boolean skipEmptySource) {
    this.skipEmptySource = skipEmptySource;
  }

  @Override
  public String toString() {
    return "ScdMergeConfiguration{"
        + "applicationId='"
        + applicationId
        + '\''
        + ", namingStrategy="
        + namingStrategy
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
        + ", threads="
        + threads
        + ", parallelismThreshold="
        + parallelismThreshold
        + ", skipEmptySource="
        + skipEmptySource
        + '}';
  }
}
