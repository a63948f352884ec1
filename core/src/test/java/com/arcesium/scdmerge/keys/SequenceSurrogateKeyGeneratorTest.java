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
package com.arcesium.scdmerge.keys;

import static org.assertj.core.api.Assertions.*;

import com.arcesium.scdmerge.common.ValidationException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class SequenceSurrogateKeyGeneratorTest {

  @Test
  void testStartsAfterHighestExistingKey() {
    SequenceSurrogateKeyGenerator generator =
        SequenceSurrogateKeyGenerator.startingAfter(Arrays.asList(3L, null, 7, 5L));

    assertThat(generator.nextKey()).isEqualTo(8L);
    assertThat(generator.nextKey()).isEqualTo(9L);
    assertThat(generator.getLastIssued()).isEqualTo(9L);
  }

  @Test
  void testEmptyTargetStartsAtOne() {
    assertThat(SequenceSurrogateKeyGenerator.startingAfter(List.of()).nextKey()).isEqualTo(1L);
  }

  @Test
  void testNonIntegralExistingKeyIsRejected() {
    assertThatThrownBy(() -> SequenceSurrogateKeyGenerator.startingAfter(List.of("k-1")))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("integral");
  }

  @Test
  void testSharedGeneratorNeverGoesBackwards() {
    SequenceSurrogateKeyGenerator generator = new SequenceSurrogateKeyGenerator(10L);
    SurrogateKeyGeneratorFactory factory = SurrogateKeyGeneratorFactory.shared(generator);

    assertThat(factory.create(List.of(4L)).nextKey()).isEqualTo(11L);
    assertThat(factory.create(List.of(20L)).nextKey()).isEqualTo(21L);
  }

  @Test
  void testConcurrentCallersReceiveDistinctKeys() throws Exception {
    SequenceSurrogateKeyGenerator generator = new SequenceSurrogateKeyGenerator(0L);
    Set<Long> issued = ConcurrentHashMap.newKeySet();
    ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 4; i++) {
        futures.add(
            executor.submit(
                () -> {
                  for (int j = 0; j < 1000; j++) {
                    issued.add(generator.nextKey());
                  }
                }));
      }
      for (Future<?> future : futures) {
        future.get();
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(issued).hasSize(4000);
    assertThat(generator.getLastIssued()).isEqualTo(4000L);
  }

  @Test
  void testUuidKeysAreDistinct() {
    SurrogateKeyGenerator generator = SurrogateKeyGeneratorFactory.uuid().create(List.of());

    assertThat(generator.nextKey()).isInstanceOf(String.class).isNotEqualTo(generator.nextKey());
  }
}
