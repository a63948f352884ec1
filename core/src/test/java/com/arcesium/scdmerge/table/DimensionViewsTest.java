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
package com.arcesium.scdmerge.table;

import static org.assertj.core.api.Assertions.*;

import com.arcesium.scdmerge.common.ValidationException;
import java.util.List;
import org.junit.jupiter.api.Test;

class DimensionViewsTest {
  private final DimensionViews views =
      new DimensionViews(List.of("customer"), "surrogate_key", "is_current");
  private final DimensionTable dimension =
      DimensionTable.builder("customer", "surrogate_key", "is_current", "credit_score")
          .addRow("C1", 1L, false, 700)
          .addRow("C1", 2L, true, 750)
          .addRow("C2", 3L, true, 640)
          .build();

  @Test
  void testType1ViewHoldsCurrentRows() {
    assertThat(views.type1View(dimension).rows())
        .extracting(r -> r.get("surrogate_key"))
        .containsExactly(2L, 3L);
    assertThat(views.type2View(dimension)).isSameAs(dimension);
  }

  @Test
  void testFindCurrentByDurableKey() {
    assertThat(views.findCurrent(dimension, "C1").get("credit_score")).isEqualTo(750);
    assertThat(views.findCurrent(dimension, "C9")).isNull();
  }

  @Test
  void testFindVersionBySurrogateKey() {
    assertThat(views.findVersion(dimension, 1L).get("credit_score")).isEqualTo(700);
    assertThat(views.findVersion(dimension, 42L)).isNull();
  }

  @Test
  void testKeyArity() {
    assertThatThrownBy(() -> views.findCurrent(dimension, "C1", "extra"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Expected 1 durable key values, got 2.");
  }
}
