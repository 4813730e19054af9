package com.ospicorp.outageanalytics.analytics;

import com.ospicorp.outageanalytics.incident.InvalidFilterException;
import com.ospicorp.outageanalytics.incident.model.Incident;
import java.util.Locale;

public enum Metric {
  COUNT,
  DURATION_MINUTES;

  /** Contribution of one incident: 1 for counts, valid duration in minutes otherwise. */
  public double valueOf(Incident incident) {
    return this == COUNT ? 1d : incident.durationMinutes();
  }

  public static Metric parse(String value) {
    if (value == null || value.isBlank()) {
      return COUNT;
    }
    try {
      return Metric.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw InvalidFilterException.unknownMetric(value);
    }
  }
}
