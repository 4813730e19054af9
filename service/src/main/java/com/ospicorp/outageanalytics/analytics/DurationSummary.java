package com.ospicorp.outageanalytics.analytics;

import com.ospicorp.outageanalytics.incident.model.Incident;
import java.time.Duration;
import java.util.Collection;

public final class DurationSummary {
  private DurationSummary() {
  }

  /** Sum of end minus start over incidents whose window is complete and not inverted. */
  public static Duration total(Collection<Incident> incidents) {
    Duration total = Duration.ZERO;
    for (Incident incident : incidents) {
      total = total.plus(incident.duration().orElse(Duration.ZERO));
    }
    return total;
  }

  /** Formats as {@code 2d 5h 30m}; days and hours are left out when zero, minutes never are. */
  public static String format(Duration duration) {
    long days = duration.toDays();
    long hours = duration.toHoursPart();
    long minutes = duration.toMinutesPart();
    StringBuilder out = new StringBuilder();
    if (days > 0) {
      out.append(days).append("d ");
    }
    if (hours > 0) {
      out.append(hours).append("h ");
    }
    return out.append(minutes).append('m').toString();
  }
}
