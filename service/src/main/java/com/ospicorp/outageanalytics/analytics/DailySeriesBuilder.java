package com.ospicorp.outageanalytics.analytics;

import com.ospicorp.outageanalytics.incident.model.Incident;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

public final class DailySeriesBuilder {
  private DailySeriesBuilder() {
  }

  public static DailySeries build(Collection<Incident> incidents, Metric metric) {
    // index 0 total, 1 BT, 2 MT
    Map<LocalDate, double[]> byDay = new TreeMap<>();
    for (Incident incident : incidents) {
      double[] sums = byDay.computeIfAbsent(incident.startDay(), d -> new double[3]);
      double value = metric.valueOf(incident);
      sums[0] += value;
      switch (incident.voltage()) {
        case BT -> sums[1] += value;
        case MT -> sums[2] += value;
        default -> {
        }
      }
    }

    List<LocalDate> days = new ArrayList<>(byDay.size());
    List<Double> total = new ArrayList<>(byDay.size());
    List<Double> bt = new ArrayList<>(byDay.size());
    List<Double> mt = new ArrayList<>(byDay.size());
    for (var e : byDay.entrySet()) {
      days.add(e.getKey());
      total.add(e.getValue()[0]);
      bt.add(e.getValue()[1]);
      mt.add(e.getValue()[2]);
    }
    return new DailySeries(metric, days, total, bt, mt);
  }
}
