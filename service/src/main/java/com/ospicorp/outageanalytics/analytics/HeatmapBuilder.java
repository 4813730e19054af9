package com.ospicorp.outageanalytics.analytics;

import static com.ospicorp.outageanalytics.analytics.HeatmapResult.HOURS;
import static com.ospicorp.outageanalytics.analytics.HeatmapResult.WEEKDAYS;

import com.ospicorp.outageanalytics.incident.model.Incident;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class HeatmapBuilder {
  private HeatmapBuilder() {
  }

  /** Buckets each incident by the local weekday and hour of its start. Always 7 x 24 cells. */
  public static HeatmapResult build(Collection<Incident> incidents, Metric metric) {
    double[][] matrix = new double[WEEKDAYS][HOURS];
    for (Incident incident : incidents) {
      int weekday = incident.start().getDayOfWeek().getValue() - 1;
      int hour = incident.start().getHour();
      matrix[weekday][hour] += metric.valueOf(incident);
    }

    List<HeatmapResult.Cell> cells = new ArrayList<>(WEEKDAYS * HOURS);
    double max = 0d;
    for (int weekday = 0; weekday < WEEKDAYS; weekday++) {
      for (int hour = 0; hour < HOURS; hour++) {
        double value = matrix[weekday][hour];
        cells.add(new HeatmapResult.Cell(hour, weekday, value));
        max = Math.max(max, value);
      }
    }
    return new HeatmapResult(metric, cells, max);
  }
}
