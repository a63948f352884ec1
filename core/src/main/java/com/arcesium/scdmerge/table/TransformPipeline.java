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

import com.arcesium.scdmerge.common.ScdMergeException;
import com.arcesium.scdmerge.common.ValidationException;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An immutable sequence of named table transforms, applied in the order they were added. Callers
 * register their custom transformations here instead of attaching methods to the table type.
 */
public class TransformPipeline implements TableTransform {
  private static final Logger LOGGER = LoggerFactory.getLogger(TransformPipeline.class);
  private final String name;
  private final ImmutableList<TableTransform> transforms;

  private TransformPipeline(String name, List<TableTransform> transforms) {
    this.name = name;
    this.transforms = ImmutableList.copyOf(transforms);
  }

  /**
   * Starts a pipeline definition.
   *
   * @param name The pipeline name.
   * @return A Builder.
   */
  public static Builder builder(String name) {
    return new Builder(name);
  }

  @Override
  public DimensionTable apply(DimensionTable table) {
    DimensionTable current = table;
    for (TableTransform transform : transforms) {
      LOGGER.debug("Applying transform {} of pipeline {}", transform.name(), name);
      try {
        current = current.transform(transform);
      } catch (ScdMergeException e) {
        throw e;
      } catch (RuntimeException e) {
        throw new ScdMergeException(
            e, "Transform %s of pipeline %s failed.", transform.name(), name);
      }
    }
    return current;
  }

  @Override
  public String name() {
    return name;
  }

  /**
   * Returns the names of the transforms, in application order.
   *
   * @return The transform names.
   */
  public List<String> transformNames() {
    return transforms.stream().map(TableTransform::name).collect(Collectors.toList());
  }

  @Override
  public String toString() {
    return "TransformPipeline{" + "name='" + name + '\'' + ", transforms=" + transformNames() + '}';
  }

  /** Builder for {@link TransformPipeline}. Transform names must be unique within a pipeline. */
  public static class Builder {
    private final String name;
    private final List<TableTransform> transforms = new ArrayList<>();
    private final Set<String> names = new HashSet<>();

    private Builder(String name) {
      ValidationException.check(StringUtils.isNotBlank(name), "Pipeline name cannot be blank.");
      this.name = name;
    }

    /**
     * Adds a named transform.
     *
     * @param transformName The name of the transform.
     * @param transform The transform.
     * @return This Builder.
     */
    public Builder add(String transformName, TableTransform transform) {
      ValidationException.checkNotNull(transform, "Transform cannot be null.");
      return add(TableTransform.named(transformName, transform));
    }

    /**
     * Adds a transform under its own name.
     *
     * @param transform The transform.
     * @return This Builder.
     */
    public Builder add(TableTransform transform) {
      ValidationException.checkNotNull(transform, "Transform cannot be null.");
      String transformName = transform.name();
      ValidationException.check(
          StringUtils.isNotBlank(transformName), "Transform name cannot be blank.");
      ValidationException.check(
          names.add(transformName),
          "Transform %s is already registered in pipeline %s.",
          transformName,
          name);
      transforms.add(transform);
      return this;
    }

    public TransformPipeline build() {
      return new TransformPipeline(name, transforms);
    }
  }
}
