package com.ospicorp.outageanalytics.incident.query;

import java.time.Instant;

/**
 * A Flux script ready to send to the store. {@code start} and {@code stop} hold the resolved UTC
 * bounds ({@code stop} exclusive); both are null when the default lookback applies.
 */
public record QuerySpec(String flux, Instant start, Instant stop) {

  public boolean isBounded() {
    return start != null;
  }
}
