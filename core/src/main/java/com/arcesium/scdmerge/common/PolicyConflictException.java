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
package com.arcesium.scdmerge.common;

import com.google.errorprone.annotations.FormatMethod;

/**
 * Thrown when two policies cannot coexist, either on the same column or because their output
 * columns collide.
 */
public class PolicyConflictException extends ValidationException {
  @FormatMethod
  public PolicyConflictException(String message, Object... args) {
    super(message, args);
  }
}
