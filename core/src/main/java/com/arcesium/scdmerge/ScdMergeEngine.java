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
package com.arcesium.scdmerge;

import com.arcesium.scdmerge.commands.DimensionMerge;
import com.arcesium.scdmerge.common.DateTimeUtil;
import com.arcesium.scdmerge.common.IntervalBoundary;
import com.arcesium.scdmerge.common.ScdMergeConfiguration;
import com.arcesium.scdmerge.common.ValidationException;
import com.arcesium.scdmerge.keys.SurrogateKeyGeneratorFactory;
import com.arcesium.scdmerge.metrics.MetricCollector;
import com.arcesium.scdmerge.policy.ColumnNamingStrategy;
import com.arcesium.scdmerge.policy.ColumnPolicies;
import com.arcesium.scdmerge.policy.DefaultColumnNamingStrategy;
import com.arcesium.scdmerge.policy.Type3Mode;
import com.arcesium.scdmerge.table.DimensionTable;
import com.arcesium.scdmerge.table.DimensionViews;
import com.arcesium.scdmerge.table.TableTransform;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the SCD merge engine. An engine holds the configuration shared by all merges
 * and the worker pool used to process durable keys in parallel. Engines are thread-safe and meant
 * to be long-lived; close them to release the pool.
 */
public class ScdMergeEngine implements AutoCloseable {
  public static final String DEFAULT_SURROGATE_KEY_COLUMN = "surrogate_key";
  public static final String DEFAULT_EFFECTIVE_START_COLUMN = "effective_from";
  public static final String DEFAULT_EFFECTIVE_END_COLUMN = "effective_to";
  public static final String DEFAULT_CURRENT_FLAG_COLUMN = "is_current";
  public static final int DEFAULT_PARALLELISM_THRESHOLD = 10_000;

  private static final Logger LOGGER = LoggerFactory.getLogger(ScdMergeEngine.class);
  private final ScdMergeConfiguration configuration;
  private final ExecutorService workerPool;

  /**
   * Constructor for ScdMergeEngine.
   *
   * @param configuration The ScdMergeConfiguration to initialize the engine with.
   */
  private ScdMergeEngine(ScdMergeConfiguration configuration) {
    this.configuration = configuration;
    fillDefaults(this.configuration);
    this.workerPool =
        Executors.newFixedThreadPool(
            configuration.getThreads(),
            new ThreadFactoryBuilder()
                .setNameFormat(configuration.getApplicationId() + "-scd-merge-%d")
                .setDaemon(true)
                .build());
    LOGGER.debug("Created SCD merge engine with configuration {}", configuration);
  }

  private void fillDefaults(ScdMergeConfiguration configuration) {
    if (configuration.getNamingStrategy() == null) {
      configuration.setNamingStrategy(new DefaultColumnNamingStrategy());
    }
    if (configuration.getSurrogateKeyColumn() == null) {
      configuration.setSurrogateKeyColumn(DEFAULT_SURROGATE_KEY_COLUMN);
    }
    if (configuration.getEffectiveStartColumn() == null) {
      configuration.setEffectiveStartColumn(DEFAULT_EFFECTIVE_START_COLUMN);
    }
    if (configuration.getEffectiveEndColumn() == null) {
      configuration.setEffectiveEndColumn(DEFAULT_EFFECTIVE_END_COLUMN);
    }
    if (configuration.getCurrentFlagColumn() == null) {
      configuration.setCurrentFlagColumn(DEFAULT_CURRENT_FLAG_COLUMN);
    }
    if (configuration.getDefaultType3Mode() == null) {
      configuration.setDefaultType3Mode(Type3Mode.FREEZE_AFTER_FIRST);
    }
    if (configuration.getIntervalBoundary() == null) {
      configuration.setIntervalBoundary(IntervalBoundary.HALF_OPEN);
    }
    if (configuration.getSurrogateKeyGeneratorFactory() == null) {
      configuration.setSurrogateKeyGeneratorFactory(
          SurrogateKeyGeneratorFactory.sequencePerMerge());
    }
    // Set default number of threads if not provided
    if (configuration.getThreads() == null) {
      configuration.setThreads(Runtime.getRuntime().availableProcessors());
    }
    if (configuration.getParallelismThreshold() == null) {
      configuration.setParallelismThreshold(DEFAULT_PARALLELISM_THRESHOLD);
    }
  }

  /**
   * Closes the ScdMergeEngine and releases the worker pool. Merges already running complete.
   */
  @Override
  public void close() {
    try {
      this.workerPool.shutdown();
    } catch (Exception e) {
      LOGGER.error("An error occurred while closing ScdMergeEngine instance.", e);
    }
  }

  /**
   * Merges a source batch into a dimension using the engine's settings.
   *
   * @param source The source batch.
   * @param target The current snapshot of the dimension.
   * @param columnPolicies The durable key columns and column policies.
   * @param mergeTimestamp The merge timestamp: a LocalDate, LocalDateTime, OffsetDateTime or ISO
   *     string.
   * @return The next snapshot of the dimension.
   */
  public DimensionTable merge(
      DimensionTable source,
      DimensionTable target,
      ColumnPolicies columnPolicies,
      Object mergeTimestamp) {
    return withMergeTimestamp(applyBatch().source(source).target(target), mergeTimestamp)
        .columnPolicies(columnPolicies)
        .execute();
  }

  /**
   * Returns the merge of a source batch as a transform of the target snapshot, so that it can be
   * chained with other transforms.
   *
   * @param source The source batch.
   * @param columnPolicies The durable key columns and column policies.
   * @param mergeTimestamp The merge timestamp.
   * @return The transform.
   */
  public TableTransform mergeTransform(
      DimensionTable source, ColumnPolicies columnPolicies, Object mergeTimestamp) {
    return TableTransform.named(
        "scd_merge", target -> merge(source, target, columnPolicies, mergeTimestamp));
  }

  /**
   * Starts a merge with the full set of per-merge options.
   *
   * @return A SetSource for further configuration.
   */
  public DimensionMerge.SetSource applyBatch() {
    return DimensionMerge.applyBatch(this);
  }

  /**
   * Returns the type 1 and type 2 views of dimensions laid out by this engine.
   *
   * @param keyColumns The durable key columns.
   * @return The views.
   */
  public DimensionViews views(List<String> keyColumns) {
    return new DimensionViews(
        keyColumns, configuration.getSurrogateKeyColumn(), configuration.getCurrentFlagColumn());
  }

  private static DimensionMerge.SetColumnPolicies withMergeTimestamp(
      DimensionMerge.SetMergeTimestamp stage, Object mergeTimestamp) {
    Comparable<?> normalized = DateTimeUtil.normalizeEffectiveTimestamp(mergeTimestamp);
    if (normalized instanceof LocalDate) {
      return stage.mergeTimestamp((LocalDate) normalized);
    } else if (normalized instanceof LocalDateTime) {
      return stage.mergeTimestamp((LocalDateTime) normalized);
    }
    return stage.mergeTimestamp((OffsetDateTime) normalized);
  }

  public String getApplicationId() {
    return configuration.getApplicationId();
  }

  public ColumnNamingStrategy getNamingStrategy() {
    return configuration.getNamingStrategy();
  }

  public String getSurrogateKeyColumn() {
    return configuration.getSurrogateKeyColumn();
  }

  public String getEffectiveStartColumn() {
    return configuration.getEffectiveStartColumn();
  }

  public String getEffectiveEndColumn() {
    return configuration.getEffectiveEndColumn();
  }

  public String getCurrentFlagColumn() {
    return configuration.getCurrentFlagColumn();
  }

  public Type3Mode getDefaultType3Mode() {
    return configuration.getDefaultType3Mode();
  }

  public IntervalBoundary getIntervalBoundary() {
    return configuration.getIntervalBoundary();
  }

  public Comparable<?> getMaxEffectiveTimestamp() {
    return configuration.getMaxEffectiveTimestamp();
  }

  public SurrogateKeyGeneratorFactory getSurrogateKeyGeneratorFactory() {
    return configuration.getSurrogateKeyGeneratorFactory();
  }

  /**
   * Returns the number of worker threads.
   *
   * @return The number of threads.
   */
  public int getThreads() {
    return configuration.getThreads();
  }

  public int getParallelismThreshold() {
    return configuration.getParallelismThreshold();
  }

  /**
   * Returns the metric collector.
   *
   * @return The metric collector, or null if none is configured.
   */
  public MetricCollector getMetricCollector() {
    return configuration.getMetricCollector();
  }

  public boolean isSkipEmptySource() {
    return configuration.isSkipEmptySource();
  }

  /**
   * Returns the ExecutorService used to merge durable keys in parallel.
   *
   * @return The worker pool.
   */
  public ExecutorService getWorkerPool() {
    return workerPool;
  }

  /**
   * Creates a new Builder instance for constructing a ScdMergeEngine.
   *
   * @param applicationId The application ID to use for the ScdMergeEngine.
   * @return A new Builder instance.
   */
  public static Builder builderFor(String applicationId) {
    return new Builder(applicationId);
  }

  /** Builder class for constructing ScdMergeEngine instances. */
  public static class Builder {
    private final ScdMergeConfiguration configuration;

    private Builder(String applicationId) {
      configuration = new ScdMergeConfiguration();
      configuration.setApplicationId(applicationId);
      configuration.setSkipEmptySource(false);
    }

    /**
     * Sets the strategy naming the output columns of policies.
     *
     * @param namingStrategy The naming strategy.
     * @return This Builder instance.
     */
    public Builder namingStrategy(ColumnNamingStrategy namingStrategy) {
      this.configuration.setNamingStrategy(namingStrategy);
      return this;
    }

    public Builder surrogateKeyColumn(String surrogateKeyColumn) {
      this.configuration.setSurrogateKeyColumn(surrogateKeyColumn);
      return this;
    }

    /**
     * Sets the effective start and end columns.
     *
     * @param effectiveStartColumn The name of the effective start column.
     * @param effectiveEndColumn The name of the effective end column.
     * @return This Builder instance.
     */
    public Builder effectivePeriodColumns(String effectiveStartColumn, String effectiveEndColumn) {
      this.configuration.setEffectiveStartColumn(effectiveStartColumn);
      this.configuration.setEffectiveEndColumn(effectiveEndColumn);
      return this;
    }

    public Builder currentFlagColumn(String currentFlagColumn) {
      this.configuration.setCurrentFlagColumn(currentFlagColumn);
      return this;
    }

    /**
     * Sets the type 3 mode of policies that do not set their own.
     *
     * @param defaultType3Mode The default type 3 mode.
     * @return This Builder instance.
     */
    public Builder defaultType3Mode(Type3Mode defaultType3Mode) {
      this.configuration.setDefaultType3Mode(defaultType3Mode);
      return this;
    }

    public Builder intervalBoundary(IntervalBoundary intervalBoundary) {
      this.configuration.setIntervalBoundary(intervalBoundary);
      return this;
    }

    /**
     * Sets the effective end of current rows. Defaults to 9999-12-31 in the type of the merge
     * timestamp.
     *
     * @param maxEffectiveTimestamp A LocalDate, LocalDateTime, OffsetDateTime or ISO string.
     * @return This Builder instance.
     */
    public Builder maxEffectiveTimestamp(Object maxEffectiveTimestamp) {
      if (maxEffectiveTimestamp == null) {
        return this;
      }
      this.configuration.setMaxEffectiveTimestamp(
          DateTimeUtil.normalizeEffectiveTimestamp(maxEffectiveTimestamp));
      return this;
    }

    public Builder surrogateKeyGenerator(SurrogateKeyGeneratorFactory factory) {
      this.configuration.setSurrogateKeyGeneratorFactory(factory);
      return this;
    }

    /**
     * Sets the number of worker threads.
     *
     * @param threads The number of threads.
     * @return This Builder instance.
     */
    public Builder threads(Integer threads) {
      if (threads == null) {
        return this;
      }
      ValidationException.check(threads > 0, "Threads value must be greater than 0.");
      this.configuration.setThreads(threads);
      return this;
    }

    /**
     * Sets the number of durable keys above which merges use the worker pool.
     *
     * @param parallelismThreshold The threshold.
     * @return This Builder instance.
     */
    public Builder parallelismThreshold(Integer parallelismThreshold) {
      if (parallelismThreshold == null) {
        return this;
      }
      ValidationException.check(
          parallelismThreshold >= 0, "Parallelism threshold must not be negative.");
      this.configuration.setParallelismThreshold(parallelismThreshold);
      return this;
    }

    /**
     * Sets the metric collector.
     *
     * @param metricCollector The MetricCollector instance to set.
     * @return This Builder instance.
     */
    public Builder metricCollector(MetricCollector metricCollector) {
      this.configuration.setMetricCollector(metricCollector);
      return this;
    }

    public Builder skipEmptySource(boolean skipEmptySource) {
      this.configuration.setSkipEmptySource(skipEmptySource);
      return this;
    }

    /**
     * Builds and returns a new ScdMergeEngine instance.
     *
     * @return A new ScdMergeEngine instance
     * @throws ValidationException if the application ID is blank
     */
    public ScdMergeEngine build() {
      ValidationException.check(
          StringUtils.isNotBlank(configuration.getApplicationId()),
          "Application ID cannot be blank.");
      return new ScdMergeEngine(new ScdMergeConfiguration(configuration));
    }
  }
}
