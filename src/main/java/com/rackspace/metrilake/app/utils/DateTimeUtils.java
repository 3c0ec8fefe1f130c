package com.rackspace.metrilake.app.utils;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.ChronoUnit;

public class DateTimeUtils {

  /**
   * Timestamp layout used by the query engine, such as <code>2025-08-27 15:00:00.000</code>.
   */
  public static final DateTimeFormatter ENGINE_TIMESTAMP = new DateTimeFormatterBuilder()
      .appendPattern("yyyy-MM-dd HH:mm:ss")
      .optionalStart()
      .appendFraction(ChronoField.NANO_OF_SECOND, 0, 9, true)
      .optionalEnd()
      .toFormatter();

  /**
   * Gets the start of the UTC day containing the instant.
   */
  public static Instant startOfDayUtc(Instant instant) {
    return instant.truncatedTo(ChronoUnit.DAYS);
  }

  /**
   * Rounds down to the nearest multiple of the period since the epoch.
   */
  public static Instant floorToPeriod(Instant instant, Duration period) {
    return instant.with(new TemporalNormalizer(period));
  }

  /**
   * Rounds up to the nearest multiple of the period since the epoch.
   */
  public static Instant ceilToPeriod(Instant instant, Duration period) {
    final Instant floor = floorToPeriod(instant, period);
    return floor.equals(instant) ? floor : floor.plus(period);
  }

  public static LocalDate utcDate(Instant instant) {
    return instant.atOffset(ZoneOffset.UTC).toLocalDate();
  }

  /**
   * Formats as ISO-8601 in UTC, for example <code>2025-08-27T15:00:00Z</code>.
   */
  public static String formatIso(Instant instant) {
    return DateTimeFormatter.ISO_INSTANT.format(instant);
  }

  /**
   * Parses an engine timestamp, either ISO-8601 or the engine's zone-less layout which is
   * taken to be UTC.
   */
  public static Instant parseEngineTimestamp(String value) {
    try {
      return Instant.parse(value);
    } catch (DateTimeParseException ignoredIso) {
      // fall through to the other supported layouts
    }
    try {
      return OffsetDateTime.parse(value).toInstant();
    } catch (DateTimeParseException ignoredOffset) {
      // fall through to the engine layout
    }
    return LocalDateTime.parse(value, ENGINE_TIMESTAMP).toInstant(ZoneOffset.UTC);
  }
}
