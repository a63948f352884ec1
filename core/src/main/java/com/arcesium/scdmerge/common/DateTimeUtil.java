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

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * Utility class for the effective timestamps of a dimension. Supported timestamp types are {@link
 * LocalDate}, {@link LocalDateTime} and {@link OffsetDateTime}; date-times are kept at microsecond
 * precision.
 */
public class DateTimeUtil {
  /** Calendar date of the open-ended effective end of a current row. */
  public static final LocalDate MAX_EFFECTIVE_DATE = LocalDate.of(9999, 12, 31);

  private DateTimeUtil() {}

  /**
   * Parses a string representation into a LocalDate using ISO_LOCAL_DATE format.
   *
   * @param value The string to parse (e.g., "2023-12-31")
   * @return The parsed LocalDate
   * @throws ValidationException if the string cannot be parsed as a valid ISO date
   */
  public static LocalDate parseLocalDate(String value) {
    ValidationException.checkNotNull(value, "Date string cannot be null");
    if (value.trim().isEmpty()) {
      throw new ValidationException("Date string cannot be empty");
    }

    try {
      return LocalDate.parse(value, DateTimeFormatter.ISO_LOCAL_DATE);
    } catch (DateTimeParseException e) {
      throw new ValidationException(
          "Date '%s' must be in ISO format (yyyy-MM-dd, e.g., 2023-12-31)", value);
    }
  }

  /**
   * Parses a string representation into a LocalDateTime with microsecond precision. Any nanosecond
   * precision beyond microseconds will be truncated.
   *
   * @param value The string to parse (e.g., "2023-12-31T14:30:45.123456")
   * @return The parsed LocalDateTime truncated to microsecond precision
   * @throws ValidationException if the string cannot be parsed as a valid ISO date-time
   */
  public static LocalDateTime parseLocalDateTimeToMicros(String value) {
    ValidationException.checkNotNull(value, "Timestamp string cannot be null");
    if (value.trim().isEmpty()) {
      throw new ValidationException("Timestamp string cannot be empty");
    }

    try {
      return LocalDateTime.parse(value, DateTimeFormatter.ISO_LOCAL_DATE_TIME)
          .truncatedTo(ChronoUnit.MICROS);
    } catch (DateTimeParseException e) {
      throw new ValidationException(
          "Timestamp '%s' must be in ISO format (yyyy-MM-ddTHH:mm:ss[.SSSSSS], e.g., 2023-12-31T14:30:45.123456)",
          value);
    }
  }

  /**
   * Parses a string representation into an OffsetDateTime with microsecond precision. Any
   * nanosecond precision beyond microseconds will be truncated.
   *
   * @param value The string to parse (e.g., "2023-12-31T14:30:45.123456+01:00")
   * @return The parsed OffsetDateTime truncated to microsecond precision
   * @throws ValidationException if the string cannot be parsed as a valid ISO offset date-time
   */
  public static OffsetDateTime parseOffsetDateTimeToMicros(String value) {
    ValidationException.checkNotNull(value, "TimestampTZ string cannot be null");
    if (value.trim().isEmpty()) {
      throw new ValidationException("TimestampTZ string cannot be empty");
    }

    try {
      return OffsetDateTime.parse(value, DateTimeFormatter.ISO_OFFSET_DATE_TIME)
          .truncatedTo(ChronoUnit.MICROS);
    } catch (DateTimeParseException e) {
      throw new ValidationException(
          "TimestampTZ '%s' must be in ISO format (yyyy-MM-ddTHH:mm:ss[.SSSSSS]+HH:MM, e.g., 2023-12-31T14:30:45.123456+01:00)",
          value);
    }
  }

  /**
   * Parses an effective timestamp, picking the type from the shape of the string: a plain date
   * becomes a LocalDate, a date-time with a zone offset an OffsetDateTime, anything else a
   * LocalDateTime.
   *
   * @param value The string to parse
   * @return The parsed timestamp
   * @throws ValidationException if the string is not an ISO date or date-time
   */
  public static Comparable<?> parseEffectiveTimestamp(String value) {
    ValidationException.checkNotNull(value, "Effective timestamp string cannot be null");
    int timeSeparator = value.indexOf('T');
    if (timeSeparator < 0) {
      return parseLocalDate(value);
    }
    String timePart = value.substring(timeSeparator);
    if (timePart.endsWith("Z") || timePart.contains("+") || timePart.contains("-")) {
      return parseOffsetDateTimeToMicros(value);
    }
    return parseLocalDateTimeToMicros(value);
  }

  /**
   * Validates that a value can be used as an effective timestamp and normalizes its precision.
   *
   * @param value The timestamp value
   * @return The normalized timestamp
   * @throws ValidationException if the value is null or of an unsupported type
   */
  public static Comparable<?> normalizeEffectiveTimestamp(Object value) {
    ValidationException.checkNotNull(value, "Effective timestamp cannot be null");
    if (value instanceof LocalDate) {
      return (LocalDate) value;
    } else if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).truncatedTo(ChronoUnit.MICROS);
    } else if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).truncatedTo(ChronoUnit.MICROS);
    } else if (value instanceof String) {
      return parseEffectiveTimestamp((String) value);
    }
    throw new ValidationException(
        "Unsupported effective timestamp type %s", value.getClass().getName());
  }

  /**
   * Returns the open-ended effective end matching the type of the given timestamp.
   *
   * @param sample A timestamp of the dimension
   * @return 9999-12-31 as a value of the same type
   */
  public static Comparable<?> maxEffectiveTimestamp(Object sample) {
    if (sample instanceof LocalDate) {
      return MAX_EFFECTIVE_DATE;
    } else if (sample instanceof LocalDateTime) {
      return MAX_EFFECTIVE_DATE.atStartOfDay();
    } else if (sample instanceof OffsetDateTime) {
      return MAX_EFFECTIVE_DATE.atStartOfDay().atOffset(ZoneOffset.UTC);
    }
    throw new ValidationException(
        "Unsupported effective timestamp type %s",
        sample == null ? "null" : sample.getClass().getName());
  }

  /**
   * Returns the timestamp one tick before the given one: one day for dates, one microsecond for
   * date-times.
   *
   * @param value The timestamp
   * @return The preceding tick
   */
  public static Comparable<?> previousTick(Object value) {
    if (value instanceof LocalDate) {
      return ((LocalDate) value).minusDays(1);
    } else if (value instanceof LocalDateTime) {
      return ((LocalDateTime) value).minus(1, ChronoUnit.MICROS);
    } else if (value instanceof OffsetDateTime) {
      return ((OffsetDateTime) value).minus(1, ChronoUnit.MICROS);
    }
    throw new ValidationException(
        "Unsupported effective timestamp type %s",
        value == null ? "null" : value.getClass().getName());
  }

  /**
   * Compares two effective timestamps of the same type. OffsetDateTime values are compared as
   * instants.
   *
   * @param left The first timestamp
   * @param right The second timestamp
   * @return a negative number, zero or a positive number as left is before, equal to or after right
   * @throws ValidationException if either value is null or the types differ
   */
  public static int compare(Object left, Object right) {
    ValidationException.checkNotNull(left, "Effective timestamp cannot be null");
    ValidationException.checkNotNull(right, "Effective timestamp cannot be null");
    if (left instanceof OffsetDateTime && right instanceof OffsetDateTime) {
      return ((OffsetDateTime) left).toInstant().compareTo(((OffsetDateTime) right).toInstant());
    }
    if (left instanceof LocalDate && right instanceof LocalDate) {
      return ((LocalDate) left).compareTo((LocalDate) right);
    }
    if (left instanceof LocalDateTime && right instanceof LocalDateTime) {
      return ((LocalDateTime) left).compareTo((LocalDateTime) right);
    }
    throw new ValidationException(
        "Cannot compare effective timestamps of types %s and %s",
        left.getClass().getSimpleName(), right.getClass().getSimpleName());
  }

  /**
   * Formats an effective timestamp in ISO format.
   *
   * @param value The timestamp
   * @return The formatted string
   */
  public static String format(Object value) {
    if (value instanceof LocalDate) {
      return DateTimeFormatter.ISO_LOCAL_DATE.format((LocalDate) value);
    } else if (value instanceof LocalDateTime) {
      return DateTimeFormatter.ISO_LOCAL_DATE_TIME.format((LocalDateTime) value);
    } else if (value instanceof OffsetDateTime) {
      return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format((OffsetDateTime) value);
    }
    return String.valueOf(value);
  }
}
