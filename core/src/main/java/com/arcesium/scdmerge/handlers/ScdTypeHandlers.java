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
package com.arcesium.scdmerge.handlers;

import com.arcesium.scdmerge.common.ValidationException;
import com.arcesium.scdmerge.policy.ScdType;
import java.util.EnumMap;
import java.util.Map;

/** Looks up the handler of an SCD type. Handlers are stateless and shared. */
public final class ScdTypeHandlers {
  private static final Map<ScdType, ScdTypeHandler> HANDLERS = new EnumMap<>(ScdType.class);

  static {
    register(new Type0Handler());
    register(new Type1Handler());
    register(new Type2Handler());
    register(new Type3Handler());
    register(new Type6Handler());
    register(new Type7Handler());
    register(new PassThroughHandler());
  }

  private ScdTypeHandlers() {}

  private static void register(ScdTypeHandler handler) {
    HANDLERS.put(handler.getType(), handler);
  }

  /**
   * Returns the handler of a type.
   *
   * @param type The SCD type.
   * @return The handler.
   */
  public static ScdTypeHandler forType(ScdType type) {
    return ValidationException.checkNotNull(HANDLERS.get(type), "No handler for SCD type %s", type);
  }
}
