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

import static org.assertj.core.api.Assertions.*;

import java.util.MissingFormatArgumentException;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

class ValidationExceptionTest {

  @ParameterizedTest
  @MethodSource("provideArgumentsForFormatting")
  void testMessageFormatting(String format, Object[] args, String expectedMessage) {
    ValidationException exception = new ValidationException(format, args);

    assertThat(exception).hasMessage(expectedMessage);
  }

  private static Stream<Arguments> provideArgumentsForFormatting() {
    return Stream.of(
        Arguments.of(
            "Column %s does not exist.", new Object[] {"email"}, "Column email does not exist."),
        Arguments.of(
            "Expected %d values but got %d.", new Object[] {3, 2}, "Expected 3 values but got 2."),
        Arguments.of("No args", new Object[] {}, "No args"));
  }

  @Test
  void testMessageOnlyConstructorDoesNotFormat() {
    ValidationException exception = new ValidationException("100% invalid");

    assertThat(exception).hasMessage("100% invalid");
  }

  @Test
  void testCheckWithFalseConditionAndFormatting() {
    assertThatThrownBy(() -> ValidationException.check(false, "Key %s is null", "customer"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Key customer is null");
    assertThatCode(() -> ValidationException.check(true, "never")).doesNotThrowAnyException();
  }

  @Test
  void testCheckNotNullReturnsValue() {
    String value = ValidationException.checkNotNull("customer", "Column cannot be null.");

    assertThat(value).isEqualTo("customer");
    assertThatThrownBy(() -> ValidationException.checkNotNull(null, "Column %s is null", "x"))
        .isInstanceOf(ValidationException.class)
        .hasMessage("Column x is null");
  }

  @Test
  void testWithInsufficientArgs() {
    assertThatThrownBy(() -> new ValidationException("Error: %s and %s", "Only one"))
        .isInstanceOf(MissingFormatArgumentException.class);
  }

  @Test
  void testInputErrorsAreValidationExceptions() {
    assertThat(new UnknownColumnPolicyException("x %s", 1)).isInstanceOf(ValidationException.class);
    assertThat(new InvalidPolicyParamsException("x %s", 1)).isInstanceOf(ValidationException.class);
    assertThat(new PolicyConflictException("x %s", 1)).isInstanceOf(ValidationException.class);
    assertThat(new DuplicateSourceKeyException("x %s", 1)).isInstanceOf(ValidationException.class);
    assertThat(new DuplicateCurrentRowException("x %s", 1))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void testSurrogateKeyCollisionIsNotAnInputError() {
    SurrogateKeyCollisionException exception = new SurrogateKeyCollisionException("Key %d", 7);

    assertThat(exception).isInstanceOf(ScdMergeException.class).hasMessage("Key 7");
    assertThat(exception).isNotInstanceOf(ValidationException.class);
  }

  @Test
  void testCauseIsKept() {
    IllegalStateException cause = new IllegalStateException("boom");
    ScdMergeException exception = new ScdMergeException(cause, "Transform %s failed.", "t1");

    assertThat(exception).hasMessage("Transform t1 failed.").hasCause(cause);
  }
}
