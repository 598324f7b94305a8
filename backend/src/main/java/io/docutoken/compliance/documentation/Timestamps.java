package io.docutoken.compliance.documentation;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.TemporalAccessor;
import java.util.Date;
import java.util.Optional;

/**
 * Parses the loosely typed timestamp values found in documentation payloads.
 *
 * <p>Accepted: {@link Instant}, {@link Date}, {@link OffsetDateTime}, {@link ZonedDateTime}, numbers
 * (epoch milliseconds), ISO-8601 instant and offset date-time strings, local date-time strings and
 * {@code yyyy-MM-dd} dates. A single space may stand in for the {@code T} separator, as in {@code
 * 2024-01-01 10:00}. Zone-less values are read as UTC.
 */
public final class Timestamps {

  private static final int DATE_LENGTH = "yyyy-MM-dd".length();

  private Timestamps() {}

  public static Optional<Instant> parse(Object value) {
    if (value == null) {
      return Optional.empty();
    }
    if (value instanceof Instant instant) {
      return Optional.of(instant);
    }
    if (value instanceof Date date) {
      return Optional.of(date.toInstant());
    }
    if (value instanceof OffsetDateTime offsetDateTime) {
      return Optional.of(offsetDateTime.toInstant());
    }
    if (value instanceof ZonedDateTime zonedDateTime) {
      return Optional.of(zonedDateTime.toInstant());
    }
    if (value instanceof Number number) {
      double millis = number.doubleValue();
      if (Double.isNaN(millis) || Double.isInfinite(millis)) {
        return Optional.empty();
      }
      return Optional.of(Instant.ofEpochMilli(number.longValue()));
    }
    if (value instanceof CharSequence text) {
      return parseText(text.toString().trim());
    }
    return Optional.empty();
  }

  /** True when the value parses to an instant strictly after the epoch. */
  public static boolean isAfterEpoch(Object value) {
    return parse(value).map(instant -> instant.isAfter(Instant.EPOCH)).orElse(false);
  }

  private static Optional<Instant> parseText(String raw) {
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    String text =
        raw.length() > DATE_LENGTH && raw.charAt(DATE_LENGTH) == ' '
            ? raw.substring(0, DATE_LENGTH) + 'T' + raw.substring(DATE_LENGTH + 1)
            : raw;
    try {
      if (text.indexOf('T') < 0) {
        return Optional.of(LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant());
      }
      TemporalAccessor parsed =
          DateTimeFormatter.ISO_DATE_TIME.parseBest(text, ZonedDateTime::from, LocalDateTime::from);
      if (parsed instanceof ZonedDateTime zoned) {
        return Optional.of(zoned.toInstant());
      }
      return Optional.of(((LocalDateTime) parsed).toInstant(ZoneOffset.UTC));
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }
}
