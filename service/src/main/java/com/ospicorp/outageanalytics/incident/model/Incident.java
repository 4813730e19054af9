package com.ospicorp.outageanalytics.incident.model;

import java.time.Duration;
import java.time.LocalDate;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * One outage event as read from the store. Times are already resolved to the local zone;
 * {@code end} is null when the record carries no usable restoration time.
 */
public record Incident(
    String number,
    ZonedDateTime start,
    ZonedDateTime end,
    String district,
    VoltageLevel voltage,
    String cause,
    String locality,
    String distributor,
    String installation,
    long substations,
    long customers,
    double power,
    long complaints
) {

  public boolean hasValidWindow() {
    return start != null && end != null && !end.isBefore(start);
  }

  /** Elapsed time between start and end, or empty when the window is missing or inverted. */
  public Optional<Duration> duration() {
    return hasValidWindow() ? Optional.of(Duration.between(start, end)) : Optional.empty();
  }

  /** Duration in minutes, zero when the window is not valid. */
  public double durationMinutes() {
    return duration().map(d -> d.getSeconds() / 60d).orElse(0d);
  }

  public LocalDate startDay() {
    return start.toLocalDate();
  }
}
