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

import java.util.Collection;

/** Provides the surrogate key generator for one merge, given the keys the target already uses. */
@FunctionalInterface
public interface SurrogateKeyGeneratorFactory {
  /**
   * Creates or prepares a generator for a merge.
   *
   * @param existingKeys Non-null surrogate keys of the target snapshot.
   * @return The generator.
   */
  SurrogateKeyGenerator create(Collection<Object> existingKeys);

  /**
   * A fresh sequence per merge, continuing after the largest existing key. Merging the same batch
   * into the same target twice allocates the same keys.
   *
   * @return The factory.
   */
  static SurrogateKeyGeneratorFactory sequencePerMerge() {
    return SequenceSurrogateKeyGenerator::startingAfter;
  }

  /**
   * One sequence shared by all merges, advanced past the keys of each target.
   *
   * @param generator The shared sequence.
   * @return The factory.
   */
  static SurrogateKeyGeneratorFactory shared(SequenceSurrogateKeyGenerator generator) {
    return existingKeys -> {
      generator.advancePast(existingKeys);
      return generator;
    };
  }

  /**
   * Random UUID strings. Collision-free without coordination, but not repeatable.
   *
   * @return The factory.
   */
  static SurrogateKeyGeneratorFactory uuid() {
    return existingKeys -> new UuidSurrogateKeyGenerator();
  }
}
