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

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.arcesium.scdmerge.common.IntervalBoundary;
import com.arcesium.scdmerge.common.ValidationException;
import com.arcesium.scdmerge.metrics.MetricCollector;
import com.arcesium.scdmerge.metrics.Metrics;
import com.arcesium.scdmerge.policy.ColumnPolicies;
import com.arcesium.scdmerge.policy.DefaultColumnNamingStrategy;
import com.arcesium.scdmerge.policy.Type3Mode;
import com.arcesium.scdmerge.table.DimensionTable;
import com.arcesium.scdmerge.table.DimensionViews;
import com.arcesium.scdmerge.table.TableTransforms;
import com.arcesium.scdmerge.table.TransformPipeline;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class ScdMergeEngineTest {
  private static final ColumnPolicies POLICIES =
      ColumnPolicies.builder().keyColumns("customer").type2("credit_score").build();

  @Mock private MetricCollector mockMetricCollector;

  private ScdMergeEngine engine;
  private AutoCloseable mocks;

  @BeforeEach
  void setUp() {
    mocks = MockitoAnnotations.openMocks(this);
    engine =
        ScdMergeEngine.builderFor("testApp")
            .threads(2)
            .parallelismThreshold(100)
            .metricCollector(mockMetricCollector)
            .build();
  }

  @AfterEach
  void tearDown() throws Exception {
    engine.close();
    mocks.close();
  }

  @Test
  void testDefaults() {
    try (ScdMergeEngine defaults = ScdMergeEngine.builderFor("defaults").build()) {
      assertThat(defaults.getApplicationId()).isEqualTo("defaults");
      assertThat(defaults.getNamingStrategy()).isInstanceOf(DefaultColumnNamingStrategy.class);
      assertThat(defaults.getSurrogateKeyColumn()).isEqualTo("surrogate_key");
      assertThat(defaults.getEffectiveStartColumn()).isEqualTo("effective_from");
      assertThat(defaults.getEffectiveEndColumn()).isEqualTo("effective_to");
      assertThat(defaults.getCurrentFlagColumn()).isEqualTo("is_current");
      assertThat(defaults.getDefaultType3Mode()).isEqualTo(Type3Mode.FREEZE_AFTER_FIRST);
      assertThat(defaults.getIntervalBoundary()).isEqualTo(IntervalBoundary.HALF_OPEN);
      assertThat(defaults.getMaxEffectiveTimestamp()).isNull();
      assertThat(defaults.getSurrogateKeyGeneratorFactory()).isNotNull();
      assertThat(defaults.getThreads()).isEqualTo(Runtime.getRuntime().availableProcessors());
      assertThat(defaults.getParallelismThreshold())
          .isEqualTo(ScdMergeEngine.DEFAULT_PARALLELISM_THRESHOLD);
      assertThat(defaults.getMetricCollector()).isNull();
      assertThat(defaults.isSkipEmptySource()).isFalse();
    }
  }

  @Test
  void testCustomSettings() {
    assertThat(engine.getThreads()).isEqualTo(2);
    assertThat(engine.getParallelismThreshold()).isEqualTo(100);
    assertThat(engine.getMetricCollector()).isSameAs(mockMetricCollector);
    assertThat(engine.getWorkerPool().isShutdown()).isFalse();
  }

  @ParameterizedTest
  @ValueSource(strings = {"", " "})
  void testBlankApplicationId(String applicationId) {
    assertThatThrownBy(() -> ScdMergeEngine.builderFor(applicationId).build())
        .isInstanceOf(ValidationException.class)
        .hasMessage("Application ID cannot be blank.");
  }

  @Test
  void testInvalidThreadSettings() {
    assertThatThrownBy(() -> ScdMergeEngine.builderFor("testApp").threads(0))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Threads value must be greater than 0.");
    assertThatThrownBy(() -> ScdMergeEngine.builderFor("testApp").parallelismThreshold(-1))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Parallelism threshold must not be negative.");
  }

  @Test
  void testBuilderChangesAfterBuildDoNotReachEngine() {
    ScdMergeEngine.Builder builder =
        ScdMergeEngine.builderFor("reused").threads(1).currentFlagColumn("active");
    try (ScdMergeEngine first = builder.build()) {
      builder
          .threads(7)
          .skipEmptySource(true)
          .currentFlagColumn("is_live")
          .intervalBoundary(IntervalBoundary.CLOSED);

      try (ScdMergeEngine second = builder.build()) {
        assertThat(first.getThreads()).isEqualTo(1);
        assertThat(first.isSkipEmptySource()).isFalse();
        assertThat(first.getCurrentFlagColumn()).isEqualTo("active");
        assertThat(first.getIntervalBoundary()).isEqualTo(IntervalBoundary.HALF_OPEN);
        assertThat(second.getThreads()).isEqualTo(7);
        assertThat(second.getCurrentFlagColumn()).isEqualTo("is_live");
      }
    }
  }

  @Test
  void testCloseShutsDownWorkerPool() {
    ScdMergeEngine closed = ScdMergeEngine.builderFor("closing").threads(1).build();

    closed.close();

    assertThat(closed.getWorkerPool().isShutdown()).isTrue();
  }

  @Test
  void testMergeTransformChainsWithOtherTransforms() {
    DimensionTable source =
        DimensionTable.builder("customer", "credit_score")
            .addRow("C1", 700)
            .addRow("C2", 640)
            .build();
    TransformPipeline pipeline =
        TransformPipeline.builder("nightly")
            .add(engine.mergeTransform(source, POLICIES, LocalDate.of(2024, 1, 1)))
            .add(TableTransforms.select("customer", "surrogate_key", "credit_score"))
            .build();

    DimensionTable result = DimensionTable.empty().transform(pipeline);

    assertThat(pipeline.transformNames()).containsExactly("scd_merge", "select");
    assertThat(result.columns()).containsExactly("customer", "surrogate_key", "credit_score");
    assertThat(result.rows())
        .extracting(r -> r.get("surrogate_key"))
        .containsExactlyInAnyOrder(1L, 2L);
    verify(mockMetricCollector, times(1)).collectMetrics(any(Metrics.class));
  }

  @Test
  void testViewsFollowEngineColumnNames() {
    DimensionTable source =
        DimensionTable.builder("customer", "credit_score").addRow("C1", 700).build();
    DimensionTable dimension =
        engine.merge(source, DimensionTable.empty(), POLICIES, "2024-01-01");

    DimensionViews views = engine.views(List.of("customer"));

    assertThat(views.findCurrent(dimension, "C1").get("credit_score")).isEqualTo(700);
    assertThat(views.findVersion(dimension, 1L).get("effective_from"))
        .isEqualTo(LocalDate.of(2024, 1, 1));
    assertThat(views.type1View(dimension).size()).isEqualTo(1);
  }
}
