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
package com.arcesium.scdmerge.metrics;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class MergeMetricsTest {

  @Test
  void testConstructorWithOnlyDimensionName() {
    MergeMetrics metrics = new MergeMetrics("customers");

    assertThat(metrics).isInstanceOf(Metrics.class);
    assertThat(metrics.getDimensionName()).isEqualTo("customers");
    assertThat(metrics.getTotalDuration()).isEqualTo(Duration.ZERO);
    assertThat(metrics.getNewKeysCount()).isZero();
    assertThat(metrics.getChangedKeysCount()).isZero();
    assertThat(metrics.getUnchangedKeysCount()).isZero();
    assertThat(metrics.getAbsentKeysCount()).isZero();
    assertThat(metrics.getInsertedRowsCount()).isZero();
    assertThat(metrics.getClosedRowsCount()).isZero();
  }

  @Test
  void testConstructorWithAllParameters() {
    Duration duration = Duration.ofMillis(250);

    MergeMetrics metrics = new MergeMetrics("customers", duration, 2, 3, 4, 5, 7L, 3L);

    assertThat(metrics.getTotalDuration()).isEqualTo(duration);
    assertThat(metrics.getNewKeysCount()).isEqualTo(2);
    assertThat(metrics.getChangedKeysCount()).isEqualTo(3);
    assertThat(metrics.getUnchangedKeysCount()).isEqualTo(4);
    assertThat(metrics.getAbsentKeysCount()).isEqualTo(5);
    assertThat(metrics.getInsertedRowsCount()).isEqualTo(7L);
    assertThat(metrics.getClosedRowsCount()).isEqualTo(3L);
    assertThat(metrics.toString()).contains("dimensionName='customers'");
  }
}
