package com.ospicorp.outageanalytics.time;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.time.temporal.TemporalQuery;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns the loosely formatted date and time strings found in incident records into calendar
 * values in a single local zone, and converts local calendar days into UTC query bounds.
 *
 * <p>All parse operations are total: they return an empty {@link Optional} or a sentinel value
 * instead of throwing.
 */
public final class TimeNormalizer {

  /** Sort key used for rows whose date cannot be read. */
  public static final LocalDateTime SENTINEL = LocalDateTime.of(1900, 1, 1, 0, 0);

  private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
      strict("dd-MM-uuuu"),
      strict("uuuu-MM-dd"),
      strict("dd/MM/uuuu"));

  private static final List<DateTimeFormatter> TIME_FORMATS = List.of(
      strict("HH:mm:ss"),
      strict("HH:mm"));

  private static final DateTimeFormatter DISPLAY_DATE = DateTimeFormatter.ofPattern("dd/MM/yyyy");
  private static final DateTimeFormatter DISPLAY_TIME = DateTimeFormatter.ofPattern("HH:mm:ss");

  private final ZoneId zone;

  public TimeNormalizer(ZoneId zone) {
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public ZoneId zone() {
    return zone;
  }

  public Optional<LocalDate> parseFlexibleDate(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return DATE_FORMATS.stream()
        .map(format -> tryParse(trimmed, format, LocalDate::from))
        .flatMap(Optional::stream)
        .findFirst();
  }

  public Optional<LocalTime> parseFlexibleTime(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String trimmed = value.trim();
    return TIME_FORMATS.stream()
        .map(format -> tryParse(trimmed, format, LocalTime::from))
        .flatMap(Optional::stream)
        .findFirst();
  }

  /**
   * Combines a date and a time string into an instant in the local zone. A missing or
   * unreadable time means midnight; an unreadable date yields {@link #SENTINEL}.
   */
  public Instant parseFlexibleDateTime(String date, String time) {
    return parseLocalDateTime(date, time)
        .orElse(SENTINEL)
        .atZone(zone)
        .toInstant();
  }

  public Optional<LocalDateTime> parseLocalDateTime(String date, String time) {
    return parseFlexibleDate(date)
        .map(d -> d.atTime(parseFlexibleTime(time).orElse(LocalTime.MIDNIGHT)));
  }

  /** Local midnight to local 23:59:59 of {@code day}, both inclusive. */
  public UtcRange toUtcRange(LocalDate day) {
    Instant start = day.atStartOfDay(zone).toInstant();
    Instant end = day.atTime(23, 59, 59).atZone(zone).toInstant();
    return new UtcRange(start, end);
  }

  /** Local midnight of {@code first} to local midnight of the day after {@code last}, stop exclusive. */
  public UtcRange toUtcRangeExclusive(LocalDate first, LocalDate last) {
    Instant start = first.atStartOfDay(zone).toInstant();
    Instant stop = last.plusDays(1).atStartOfDay(zone).toInstant();
    return new UtcRange(start, stop);
  }

  public ZonedDateTime toLocal(Instant instant) {
    return instant.atZone(zone);
  }

  public ZonedDateTime toLocal(LocalDateTime dateTime) {
    return dateTime.atZone(zone);
  }

  public static String displayDate(ZonedDateTime value) {
    return value == null ? "" : DISPLAY_DATE.format(value);
  }

  public static String displayTime(ZonedDateTime value) {
    return value == null ? "" : DISPLAY_TIME.format(value);
  }

  private static <T> Optional<T> tryParse(String text, DateTimeFormatter format,
      TemporalQuery<T> query) {
    try {
      return Optional.of(format.parse(text, query));
    } catch (DateTimeParseException ex) {
      return Optional.empty();
    }
  }

  private static DateTimeFormatter strict(String pattern) {
    return DateTimeFormatter.ofPattern(pattern).withResolverStyle(ResolverStyle.STRICT);
  }
}
