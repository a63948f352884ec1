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

import com.arcesium.scdmerge.common.ScdMergeException;
import com.arcesium.scdmerge.common.ValidationException;
import org.junit.jupiter.api.Test;

class TransformPipelineTest {
  private final DimensionTable table =
      DimensionTable.builder("customer", "is_current")
          .addRow("C1", true)
          .addRow("C1", false)
          .addRow("C2", true)
          .build();

  @Test
  void testAppliesTransformsInOrder() {
    TransformPipeline pipeline =
        TransformPipeline.builder("publish")
            .add(TableTransforms.currentRows("is_current"))
            .add(TableTransforms.withColumn("source_system", "crm"))
            .add(TableTransforms.select("customer", "source_system"))
            .build();

    DimensionTable result = table.transform(pipeline);

    assertThat(pipeline.transformNames())
        .containsExactly("current_rows", "with_source_system", "select");
    assertThat(result.columns()).containsExactly("customer", "source_system");
    assertThat(result.rows())
        .extracting(r -> r.get("customer"))
        .containsExactly("C1", "C2");
  }

  @Test
  void testExcludeWhereAndAndThen() {
    TableTransform transform =
        TableTransforms.excludeWhere("drop_c2", r -> "C2".equals(r.get("customer")))
            .andThen(TableTransforms.currentRows("is_current"));

    DimensionTable result = table.transform(transform);

    assertThat(transform.name()).isEqualTo("drop_c2 -> current_rows");
    assertThat(result.size()).isEqualTo(1);
  }

  @Test
  void testDuplicateTransformName() {
    TransformPipeline.Builder builder =
        TransformPipeline.builder("publish").add("step", t -> t);

    assertThatThrownBy(() -> builder.add("step", t -> t))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Transform step is already registered in pipeline publish.");
  }

  @Test
  void testFailingTransformIsWrapped() {
    TransformPipeline pipeline =
        TransformPipeline.builder("publish")
            .add(
                "explode",
                t -> {
                  throw new IllegalStateException("boom");
                })
            .build();

    assertThatThrownBy(() -> table.transform(pipeline))
        .isInstanceOf(ScdMergeException.class)
        .hasMessage("Transform explode of pipeline publish failed.")
        .hasCauseInstanceOf(IllegalStateException.class);
  }

  @Test
  void testBlankPipelineName() {
    assertThatThrownBy(() -> TransformPipeline.builder(" "))
        .isInstanceOf(ValidationException.class);
  }
}
