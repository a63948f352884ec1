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
import java.util.Map;
import org.junit.jupiter.api.Test;

class DimensionTableTest {

  @Test
  void testRowsAreProjectedOntoTableColumns() {
    DimensionTable table =
        DimensionTable.of(
            List.of("customer", "credit_score"),
            List.of(Row.of("credit_score", 700, "customer", "C1")));

    assertThat(table.rows().get(0).columns()).containsExactly("customer", "credit_score");
    DimensionTable sparse =
        DimensionTable.of(List.of("customer", "email"), List.of(Row.of("customer", "C2")));
    assertThat(sparse.rows().get(0).get("email")).isNull();
  }

  @Test
  void testUndeclaredRowColumnIsRejected() {
    assertThatThrownBy(
            () -> DimensionTable.of(List.of("customer"), List.of(Row.of("customer", "C1", "x", 1))))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Column x does not exist.");
  }

  @Test
  void testDuplicateColumnsAreRejected() {
    assertThatThrownBy(() -> DimensionTable.builder("customer", "customer").build())
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void testBuilderChecksArity() {
    assertThatThrownBy(() -> DimensionTable.builder("customer", "credit_score").addRow("C1"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Expected 2 values but got 1.");
  }

  @Test
  void testOfRowsUnionsColumnsInFirstSeenOrder() {
    DimensionTable table =
        DimensionTable.ofRows(
            List.of(Row.of("customer", "C1", "email", "a@x"), Row.of("customer", "C2", "tier", 1)));

    assertThat(table.columns()).containsExactly("customer", "email", "tier");
    assertThat(table.rows().get(1).asMap())
        .containsEntry("email", null)
        .containsEntry("tier", 1);
  }

  @Test
  void testWithColumnFilterAndSelectReturnNewTables() {
    DimensionTable table =
        DimensionTable.builder("customer", "credit_score")
            .addRow("C1", 700)
            .addRow("C2", 640)
            .build();

    DimensionTable result =
        table
            .withColumn("band", r -> (Integer) r.get("credit_score") >= 680 ? "prime" : "subprime")
            .filter(r -> "prime".equals(r.get("band")))
            .select(List.of("band", "customer"));

    assertThat(result.columns()).containsExactly("band", "customer");
    assertThat(result.rows()).containsExactly(Row.of(Map.of("band", "prime", "customer", "C1")));
    assertThat(table.columns()).containsExactly("customer", "credit_score");
    assertThat(table.size()).isEqualTo(2);
  }

  @Test
  void testSelectUnknownColumn() {
    assertThatThrownBy(() -> DimensionTable.builder("customer").build().select(List.of("tier")))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Column tier does not exist.");
  }

  @Test
  void testTransformMustNotReturnNull() {
    DimensionTable table = DimensionTable.builder("customer").addRow("C1").build();

    assertThatThrownBy(() -> table.transform(TableTransform.named("broken", t -> null)))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Transform broken returned null.");
  }

  @Test
  void testEquality() {
    DimensionTable left = DimensionTable.builder("customer").addRow("C1").build();
    DimensionTable right =
        DimensionTable.of(List.of("customer"), List.of(Row.of("customer", "C1")));

    assertThat(left).isEqualTo(right).hasSameHashCodeAs(right);
    assertThat(DimensionTable.empty().isEmpty()).isTrue();
  }
}
