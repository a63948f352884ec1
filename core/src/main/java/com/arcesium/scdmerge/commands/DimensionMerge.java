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

import com.arcesium.scdmerge.ScdMergeEngine;
import com.arcesium.scdmerge.common.DateTimeUtil;
import com.arcesium.scdmerge.common.IntervalBoundary;
import com.arcesium.scdmerge.common.ScdMergeException;
import com.arcesium.scdmerge.common.SurrogateKeyCollisionException;
import com.arcesium.scdmerge.common.ValidationException;
import com.arcesium.scdmerge.handlers.KeyMergeContext;
import com.arcesium.scdmerge.handlers.MutableRow;
import com.arcesium.scdmerge.handlers.ScdTypeHandlers;
import com.arcesium.scdmerge.handlers.Type7Handler;
import com.arcesium.scdmerge.handlers.VersionManager;
import com.arcesium.scdmerge.handlers.VersioningColumns;
import com.arcesium.scdmerge.keys.ChangeStatus;
import com.arcesium.scdmerge.keys.KeyResolution;
import com.arcesium.scdmerge.keys.KeyResolver;
import com.arcesium.scdmerge.keys.ResolvedKey;
import com.arcesium.scdmerge.keys.SurrogateKeyGenerator;
import com.arcesium.scdmerge.keys.SurrogateKeyGeneratorFactory;
import com.arcesium.scdmerge.metrics.MergeMetrics;
import com.arcesium.scdmerge.metrics.MetricCollector;
import com.arcesium.scdmerge.policy.BoundColumnPolicy;
import com.arcesium.scdmerge.policy.ColumnNamingStrategy;
import com.arcesium.scdmerge.policy.ColumnPolicies;
import com.arcesium.scdmerge.policy.ColumnPolicyRegistry;
import com.arcesium.scdmerge.policy.Type3Mode;
import com.arcesium.scdmerge.table.DimensionTable;
import com.arcesium.scdmerge.table.Row;
import com.google.common.collect.Lists;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Merges a source batch into a dimension table: validates the column policies, resolves durable
 * keys, applies the handler of every column to every key in the batch, allocates surrogate keys
 * and assembles the next snapshot. Inputs are never modified and nothing is returned unless every
 * check passed.
 */
public class DimensionMerge {
  private static final Logger LOGGER = LoggerFactory.getLogger(DimensionMerge.class);
  private final ScdMergeEngine scdMergeEngine;
  private final DimensionMergeProperties properties;

  private DimensionMerge(ScdMergeEngine scdMergeEngine, DimensionMergeProperties properties) {
    this.scdMergeEngine = scdMergeEngine;
    this.properties = properties;
  }

  /**
   * Executes the merge.
   *
   * @return The next snapshot of the dimension.
   */
  public DimensionTable execute() {
    Instant start = Instant.now();
    validateProperties();
    DimensionTable source = properties.getSource();
    DimensionTable target = properties.getTarget();
    String dimensionName = properties.getDimensionName();

    if (properties.isSkipEmptySource() && source.isEmpty()) {
      LOGGER.info("Empty data source. Dimension {} is unchanged.", dimensionName);
      collectMetrics(new MergeMetrics(dimensionName));
      return target;
    }

    VersioningColumns versioningColumns =
        new VersioningColumns(
            properties.getSurrogateKeyColumn(),
            properties.getEffectiveStartColumn(),
            properties.getEffectiveEndColumn(),
            properties.getCurrentFlagColumn(),
            properties.getIntervalBoundary());
    ColumnPolicyRegistry registry =
        ColumnPolicyRegistry.validate(
            properties.getColumnPolicies(),
            source.columns(),
            properties.getNamingStrategy(),
            properties.getDefaultType3Mode(),
            versioningColumns.asList());
    if (!registry.isVersioned()) {
      versioningColumns = null;
    }
    validateTarget(target, registry, versioningColumns);

    Comparable<?> mergeTimestamp = properties.getMergeTimestamp();
    Comparable<?> maxEffectiveTimestamp = getMaxEffectiveTimestamp(mergeTimestamp);

    KeyResolution resolution =
        new KeyResolver(
                registry,
                versioningColumns == null ? null : versioningColumns.getCurrentFlagColumn())
            .resolve(source, target);
    List<KeyMergeContext> contexts =
        mergeKeys(
            resolution.getKeys(),
            registry,
            versioningColumns,
            mergeTimestamp,
            maxEffectiveTimestamp);
    if (versioningColumns != null) {
      allocateSurrogateKeys(contexts, target, versioningColumns.getSurrogateKeyColumn());
    }

    List<String> columns = getOutputColumns(registry, versioningColumns, target);
    List<Row> rows = new ArrayList<>(target.size() + source.size());
    for (KeyMergeContext context : contexts) {
      for (MutableRow row : context.getRows()) {
        rows.add(row.toRow(columns));
      }
    }
    if (registry.isDualKeyed()) {
      Type7Handler.verifyKeys(
          rows, registry.getKeyColumns(), versioningColumns.getSurrogateKeyColumn());
    }
    DimensionTable result = DimensionTable.of(columns, rows);

    Map<ChangeStatus, Integer> counts = resolution.countByStatus();
    long closedRows = contexts.stream().filter(c -> c.getClosedRow() != null).count();
    MergeMetrics metrics =
        new MergeMetrics(
            dimensionName,
            Duration.between(start, Instant.now()),
            counts.getOrDefault(ChangeStatus.NEW, 0),
            counts.getOrDefault(ChangeStatus.CHANGED, 0),
            counts.getOrDefault(ChangeStatus.UNCHANGED, 0),
            counts.getOrDefault(ChangeStatus.ABSENT, 0),
            (long) result.size() - target.size(),
            closedRows);
    LOGGER.info(
        "Merged {} source rows into dimension {} at {}: {} rows inserted, {} rows closed in {} ms.",
        source.size(),
        dimensionName,
        DateTimeUtil.format(mergeTimestamp),
        metrics.getInsertedRowsCount(),
        metrics.getClosedRowsCount(),
        metrics.getTotalDuration().toMillis());
    collectMetrics(metrics);
    return result;
  }

  private void validateProperties() {
    ValidationException.checkNotNull(properties.getSource(), "Source cannot be null.");
    ValidationException.checkNotNull(properties.getTarget(), "Target cannot be null.");
    ValidationException.checkNotNull(
        properties.getMergeTimestamp(), "Merge timestamp cannot be null.");
    ValidationException.checkNotNull(
        properties.getColumnPolicies(), "Column policies cannot be null.");
    ValidationException.checkNotNull(
        properties.getIntervalBoundary(), "Interval boundary cannot be null.");
    ValidationException.checkNotNull(
        properties.getSurrogateKeyGeneratorFactory(),
        "Surrogate key generator factory cannot be null.");
    List<String> bookkeepingColumns =
        Arrays.asList(
            properties.getSurrogateKeyColumn(),
            properties.getEffectiveStartColumn(),
            properties.getEffectiveEndColumn(),
            properties.getCurrentFlagColumn());
    for (String column : bookkeepingColumns) {
      ValidationException.check(
          StringUtils.isNotBlank(column), "Bookkeeping column names cannot be blank.");
    }
    ValidationException.check(
        new HashSet<>(bookkeepingColumns).size() == bookkeepingColumns.size(),
        "Bookkeeping column names must be distinct: %s",
        bookkeepingColumns);
  }

  private void validateTarget(
      DimensionTable target, ColumnPolicyRegistry registry, VersioningColumns versioningColumns) {
    if (target.isEmpty()) {
      return;
    }
    List<String> requiredColumns = new ArrayList<>(registry.getKeyColumns());
    if (versioningColumns != null) {
      requiredColumns.addAll(versioningColumns.asList());
    }
    for (String column : requiredColumns) {
      if (!target.hasColumn(column)) {
        throw new ValidationException("Column %s does not exist.", column);
      }
    }
  }

  private Comparable<?> getMaxEffectiveTimestamp(Comparable<?> mergeTimestamp) {
    if (properties.getMaxEffectiveTimestamp() == null) {
      return DateTimeUtil.maxEffectiveTimestamp(mergeTimestamp);
    }
    Comparable<?> maxEffectiveTimestamp =
        DateTimeUtil.normalizeEffectiveTimestamp(properties.getMaxEffectiveTimestamp());
    ValidationException.check(
        DateTimeUtil.compare(maxEffectiveTimestamp, mergeTimestamp) > 0,
        "Max effective timestamp %s must be after the merge timestamp %s.",
        DateTimeUtil.format(maxEffectiveTimestamp),
        DateTimeUtil.format(mergeTimestamp));
    return maxEffectiveTimestamp;
  }

  private List<KeyMergeContext> mergeKeys(
      List<ResolvedKey> keys,
      ColumnPolicyRegistry registry,
      VersioningColumns versioningColumns,
      Comparable<?> mergeTimestamp,
      Comparable<?> maxEffectiveTimestamp) {
    VersionManager versionManager = new VersionManager(properties.getDimensionName());
    KeyMerger merger =
        key -> {
          KeyMergeContext context =
              KeyMergeContext.forKey(
                  key,
                  registry.getKeyColumns(),
                  mergeTimestamp,
                  maxEffectiveTimestamp,
                  versioningColumns);
          if (key.getStatus() == ChangeStatus.ABSENT) {
            return context;
          }
          versionManager.prepare(context);
          for (BoundColumnPolicy policy : registry.getPolicies()) {
            ScdTypeHandlers.forType(policy.getType()).apply(policy, context);
          }
          return context;
        };

    int threads = scdMergeEngine.getThreads();
    if (threads <= 1 || keys.size() <= scdMergeEngine.getParallelismThreshold()) {
      return keys.stream().map(merger::merge).collect(Collectors.toList());
    }

    int chunkSize = (keys.size() + threads - 1) / threads;
    LOGGER.debug(
        "Merging {} durable keys of dimension {} in chunks of {}.",
        keys.size(),
        properties.getDimensionName(),
        chunkSize);
    List<Future<List<KeyMergeContext>>> futures = new ArrayList<>();
    for (List<ResolvedKey> chunk : Lists.partition(keys, chunkSize)) {
      futures.add(
          scdMergeEngine
              .getWorkerPool()
              .submit(() -> chunk.stream().map(merger::merge).collect(Collectors.toList())));
    }

    List<KeyMergeContext> contexts = new ArrayList<>(keys.size());
    try {
      for (Future<List<KeyMergeContext>> future : futures) {
        contexts.addAll(future.get());
      }
    } catch (InterruptedException e) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new ScdMergeException(
          e, "Interrupted while merging dimension %s.", properties.getDimensionName());
    } catch (ExecutionException e) {
      futures.forEach(f -> f.cancel(true));
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new ScdMergeException(
          cause, "Failed to merge dimension %s.", properties.getDimensionName());
    }
    return contexts;
  }

  private void allocateSurrogateKeys(
      List<KeyMergeContext> contexts, DimensionTable target, String surrogateKeyColumn) {
    List<Object> existingKeys =
        target.rows().stream()
            .map(r -> r.get(surrogateKeyColumn))
            .filter(k -> k != null)
            .collect(Collectors.toList());
    SurrogateKeyGenerator generator =
        properties.getSurrogateKeyGeneratorFactory().create(existingKeys);
    Set<Object> usedKeys = new HashSet<>(existingKeys);
    for (KeyMergeContext context : contexts) {
      for (MutableRow row : context.getRows()) {
        if (!row.isNewVersion()) {
          continue;
        }
        Object surrogateKey = generator.nextKey();
        if (surrogateKey == null || !usedKeys.add(surrogateKey)) {
          throw new SurrogateKeyCollisionException(
              "Surrogate key %s allocated for durable key %s of dimension %s is already in use.",
              surrogateKey,
              context.getResolvedKey().getKey(),
              properties.getDimensionName());
        }
        row.set(surrogateKeyColumn, surrogateKey);
      }
    }
  }

  private static List<String> getOutputColumns(
      ColumnPolicyRegistry registry, VersioningColumns versioningColumns, DimensionTable target) {
    Set<String> columns = new LinkedHashSet<>(registry.getKeyColumns());
    if (versioningColumns != null) {
      columns.addAll(versioningColumns.asList());
    }
    columns.addAll(registry.getOutputColumns());
    columns.addAll(target.columns());
    return new ArrayList<>(columns);
  }

  private void collectMetrics(MergeMetrics metrics) {
    MetricCollector metricCollector = scdMergeEngine.getMetricCollector();
    if (metricCollector == null) {
      return;
    }
    try {
      metricCollector.collectMetrics(metrics);
    } catch (RuntimeException e) {
      LOGGER.warn("Metric collector failed for dimension {}.", properties.getDimensionName(), e);
    }
  }

  @FunctionalInterface
  private interface KeyMerger {
    KeyMergeContext merge(ResolvedKey key);
  }

  /**
   * Starts a merge of a source batch into a dimension.
   *
   * @param scdMergeEngine The engine providing defaults and the worker pool.
   * @return A SetSource for further configuration.
   */
  public static SetSource applyBatch(ScdMergeEngine scdMergeEngine) {
    return new BuilderImpl(scdMergeEngine);
  }

  /** Interface to set the source batch. */
  public interface SetSource {
    /**
     * Sets the source batch. It must hold at most one row per durable key.
     *
     * @param source The source batch
     * @return SetTarget interface for further configuration
     */
    SetTarget source(DimensionTable source);
  }

  /** Interface to set the current snapshot of the dimension. */
  public interface SetTarget {
    /**
     * Sets the current snapshot of the dimension. An empty table starts a new dimension.
     *
     * @param target The target snapshot
     * @return SetMergeTimestamp interface for further configuration
     */
    SetMergeTimestamp target(DimensionTable target);
  }

  /** Interface to set the merge timestamp. */
  public interface SetMergeTimestamp {
    /**
     * Sets the merge timestamp from an ISO string: a date, a local date-time or an offset
     * date-time.
     *
     * @param mergeTimestamp The merge timestamp as a string
     * @return SetColumnPolicies interface for further configuration
     */
    SetColumnPolicies mergeTimestamp(String mergeTimestamp);

    SetColumnPolicies mergeTimestamp(LocalDate mergeTimestamp);

    SetColumnPolicies mergeTimestamp(LocalDateTime mergeTimestamp);

    SetColumnPolicies mergeTimestamp(OffsetDateTime mergeTimestamp);
  }

  /** Interface to set the column policies. */
  public interface SetColumnPolicies {
    /**
     * Sets the durable key columns and the policy of every other source column.
     *
     * @param columnPolicies The column policies
     * @return Builder interface for final configuration and execution
     */
    Builder columnPolicies(ColumnPolicies columnPolicies);
  }

  /** Interface for final configuration and execution of the merge. */
  public interface Builder {
    /**
     * Sets the dimension name used in logs, metrics and error messages.
     *
     * @param dimensionName The dimension name
     * @return Builder interface for further configuration
     */
    Builder dimensionName(String dimensionName);

    /**
     * Sets the strategy naming the output columns of policies.
     *
     * @param namingStrategy The naming strategy
     * @return Builder interface for further configuration
     */
    Builder namingStrategy(ColumnNamingStrategy namingStrategy);

    /**
     * Sets the surrogate key column.
     *
     * @param surrogateKeyColumn The name of the surrogate key column
     * @return Builder interface for further configuration
     */
    Builder surrogateKeyColumn(String surrogateKeyColumn);

    /**
     * Sets the effective start and end columns.
     *
     * @param effectiveStartColumn The name of the effective start column
     * @param effectiveEndColumn The name of the effective end column
     * @return Builder interface for further configuration
     */
    Builder effectivePeriodColumns(String effectiveStartColumn, String effectiveEndColumn);

    /**
     * Sets the column used to indicate the current (active) record.
     *
     * @param currentFlagColumn The name of the current flag column
     * @return Builder interface for further configuration
     */
    Builder currentFlagColumn(String currentFlagColumn);

    Builder intervalBoundary(IntervalBoundary intervalBoundary);

    Builder defaultType3Mode(Type3Mode defaultType3Mode);

    /**
     * Sets the effective end of current rows, in the type of the merge timestamp or as an ISO
     * string.
     *
     * @param maxEffectiveTimestamp The max effective timestamp
     * @return Builder interface for further configuration
     */
    Builder maxEffectiveTimestamp(Object maxEffectiveTimestamp);

    Builder surrogateKeyGenerator(
        SurrogateKeyGeneratorFactory surrogateKeyGeneratorFactory);

    /**
     * Configures whether an empty source batch returns the target unchanged without validation.
     *
     * @param skipEmptySource True to skip empty source data, false otherwise
     * @return Builder interface for further configuration
     */
    Builder skipEmptySource(boolean skipEmptySource);

    /**
     * Executes the merge with the configured settings.
     *
     * @return The next snapshot of the dimension
     */
    DimensionTable execute();
  }

  public static class BuilderImpl
      implements SetSource, SetTarget, SetMergeTimestamp, SetColumnPolicies, Builder {
    private final ScdMergeEngine scdMergeEngine;
    private final DimensionMergeProperties properties;

    private BuilderImpl(ScdMergeEngine scdMergeEngine) {
      this.scdMergeEngine =
          ValidationException.checkNotNull(scdMergeEngine, "Engine cannot be null.");
      this.properties = new DimensionMergeProperties();
      initProperties();
    }

    private void initProperties() {
      properties.setDimensionName(scdMergeEngine.getApplicationId());
      properties.setNamingStrategy(scdMergeEngine.getNamingStrategy());
      properties.setSurrogateKeyColumn(scdMergeEngine.getSurrogateKeyColumn());
      properties.setEffectiveStartColumn(scdMergeEngine.getEffectiveStartColumn());
      properties.setEffectiveEndColumn(scdMergeEngine.getEffectiveEndColumn());
      properties.setCurrentFlagColumn(scdMergeEngine.getCurrentFlagColumn());
      properties.setDefaultType3Mode(scdMergeEngine.getDefaultType3Mode());
      properties.setIntervalBoundary(scdMergeEngine.getIntervalBoundary());
      properties.setMaxEffectiveTimestamp(scdMergeEngine.getMaxEffectiveTimestamp());
      properties.setSurrogateKeyGeneratorFactory(
          scdMergeEngine.getSurrogateKeyGeneratorFactory());
      properties.setSkipEmptySource(scdMergeEngine.isSkipEmptySource());
    }

    @Override
    public SetTarget source(DimensionTable source) {
      properties.setSource(source);
      return this;
    }

    @Override
    public SetMergeTimestamp target(DimensionTable target) {
      properties.setTarget(target);
      return this;
    }

    @Override
    public SetColumnPolicies mergeTimestamp(String mergeTimestamp) {
      properties.setMergeTimestamp(DateTimeUtil.parseEffectiveTimestamp(mergeTimestamp));
      return this;
    }

    @Override
    public SetColumnPolicies mergeTimestamp(LocalDate mergeTimestamp) {
      return setMergeTimestamp(mergeTimestamp);
    }

    @Override
    public SetColumnPolicies mergeTimestamp(LocalDateTime mergeTimestamp) {
      return setMergeTimestamp(mergeTimestamp);
    }

    @Override
    public SetColumnPolicies mergeTimestamp(OffsetDateTime mergeTimestamp) {
      return setMergeTimestamp(mergeTimestamp);
    }

    private SetColumnPolicies setMergeTimestamp(Object mergeTimestamp) {
      properties.setMergeTimestamp(DateTimeUtil.normalizeEffectiveTimestamp(mergeTimestamp));
      return this;
    }

    @Override
    public Builder columnPolicies(ColumnPolicies columnPolicies) {
      properties.setColumnPolicies(columnPolicies);
      return this;
    }

    @Override
    public Builder dimensionName(String dimensionName) {
      properties.setDimensionName(dimensionName);
      return this;
    }

    @Override
    public Builder namingStrategy(ColumnNamingStrategy namingStrategy) {
      properties.setNamingStrategy(namingStrategy);
      return this;
    }

    @Override
    public Builder surrogateKeyColumn(String surrogateKeyColumn) {
      properties.setSurrogateKeyColumn(surrogateKeyColumn);
      return this;
    }

    @Override
    public Builder effectivePeriodColumns(String effectiveStartColumn, String effectiveEndColumn) {
      properties.setEffectiveStartColumn(effectiveStartColumn);
      properties.setEffectiveEndColumn(effectiveEndColumn);
      return this;
    }

    @Override
    public Builder currentFlagColumn(String currentFlagColumn) {
      properties.setCurrentFlagColumn(currentFlagColumn);
      return this;
    }

    @Override
    public Builder intervalBoundary(IntervalBoundary intervalBoundary) {
      properties.setIntervalBoundary(intervalBoundary);
      return this;
    }

    @Override
    public Builder defaultType3Mode(Type3Mode defaultType3Mode) {
      properties.setDefaultType3Mode(defaultType3Mode);
      return this;
    }

    @Override
    public Builder maxEffectiveTimestamp(Object maxEffectiveTimestamp) {
      properties.setMaxEffectiveTimestamp(
          maxEffectiveTimestamp == null
              ? null
              : DateTimeUtil.normalizeEffectiveTimestamp(maxEffectiveTimestamp));
      return this;
    }

    @Override
    public Builder surrogateKeyGenerator(
        SurrogateKeyGeneratorFactory surrogateKeyGeneratorFactory) {
      properties.setSurrogateKeyGeneratorFactory(surrogateKeyGeneratorFactory);
      return this;
    }

    @Override
    public Builder skipEmptySource(boolean skipEmptySource) {
      properties.setSkipEmptySource(skipEmptySource);
      return this;
    }

    @Override
    public DimensionTable execute() {
      return new DimensionMerge(scdMergeEngine, properties).execute();
    }
  }
}
