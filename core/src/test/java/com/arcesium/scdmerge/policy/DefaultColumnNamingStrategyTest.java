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
package com.arcesium.scdmerge.policy;

import static org.assertj.core.api.Assertions.*;

import com.arcesium.scdmerge.common.ValidationException;
import org.junit.jupiter.api.Test;

class DefaultColumnNamingStrategyTest {

  @Test
  void testDefaultNames() {
    ColumnNamingStrategy naming = new DefaultColumnNamingStrategy();

    assertThat(naming.originalColumn("channel")).isEqualTo("original_channel");
    assertThat(naming.currentColumn("email")).isEqualTo("current_email");
    assertThat(naming.versionedColumn("credit_score")).isEqualTo("credit_score");
    assertThat(naming.primaryColumn("region")).isEqualTo("region");
    assertThat(naming.alternateColumn("region")).isEqualTo("region_alternate");
    assertThat(naming.shadowCurrentColumn("tier")).isEqualTo("tier_current");
    assertThat(naming.historicalColumn("tier")).isEqualTo("tier_historical");
    assertThat(naming.passThroughColumn("batch_id")).isEqualTo("batch_id");
  }

  @Test
  void testNullAlternateSuffix() {
    ColumnNamingStrategy naming =
        new DefaultColumnNamingStrategy("orig_", "cur_", null, "_now", "_then");

    assertThat(naming.alternateColumn("region")).isNull();
    assertThat(naming.originalColumn("channel")).isEqualTo("orig_channel");
  }

  @Test
  void testType6SuffixesMustDiffer() {
    assertThatThrownBy(
            () -> new DefaultColumnNamingStrategy("orig_", "cur_", "_alt", "_same", "_same"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Type 6 current and historical suffixes must differ.");
  }
}
