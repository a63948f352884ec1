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

/**
 * A named transformation of a table. Transforms are composed statically with {@link
 * TransformPipeline} or applied one by one through {@link DimensionTable#transform}.
 */
@FunctionalInterface
public interface TableTransform {
  /**
   * Transforms a table. Implementations must not return null.
   *
   * @param table The input table.
   * @return The transformed table.
   */
  DimensionTable apply(DimensionTable table);

  /**
   * Returns the name used in logs and error messages.
   *
   * @return The transform name.
   */
  default String name() {
    return getClass().getSimpleName();
  }

  /**
   * Gives a transform a name.
   *
   * @param name The name.
   * @param transform The transform.
   * @return A named transform delegating to the given one.
   */
  static TableTransform named(String name, TableTransform transform) {
    return new TableTransform() {
      @Override
      public DimensionTable apply(DimensionTable table) {
        return transform.apply(table);
      }

      @Override
      public String name() {
        return name;
      }

      @Override
      public String toString() {
        return name;
      }
    };
  }

  /**
   * Returns a transform applying this one, then the given one.
   *
   * @param next The transform to apply second.
   * @return The composed transform.
   */
  default TableTransform andThen(TableTransform next) {
    TableTransform first = this;
    return named(first.name() + " -> " + next.name(), t -> next.apply(first.apply(t)));
  }
}
