package com.ospicorp.outageanalytics.analytics;

import com.ospicorp.outageanalytics.incident.model.Incident;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregates a metric by cause, largest first. Only the top {@value #TOP_CAUSES} causes are
 * named; the rest are summed into a trailing {@value #OTHER} bucket.
 */
public final class ParetoAggregator {
  public static final int TOP_CAUSES = 12;
  public static final String OTHER = "Other";
  public static final String UNSPECIFIED = "Unspecified";

  private ParetoAggregator() {
  }

  public static ParetoResult byCause(Collection<Incident> incidents, Metric metric) {
    Map<String, Double> sums = new LinkedHashMap<>();
    for (Incident incident : incidents) {
      String cause = incident.cause() == null || incident.cause().isBlank()
          ? UNSPECIFIED
          : incident.cause();
      sums.merge(cause, metric.valueOf(incident), Double::sum);
    }

    List<Map.Entry<String, Double>> ranked = new ArrayList<>(sums.entrySet());
    ranked.sort(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
        .thenComparing(Map.Entry::getKey));

    List<String> categories = new ArrayList<>();
    List<Double> values = new ArrayList<>();
    double other = 0d;
    for (int i = 0; i < ranked.size(); i++) {
      if (i < TOP_CAUSES) {
        categories.add(ranked.get(i).getKey());
        values.add(ranked.get(i).getValue());
      } else {
        other += ranked.get(i).getValue();
      }
    }
    if (ranked.size() > TOP_CAUSES) {
      categories.add(OTHER);
      values.add(other);
    }

    return new ParetoResult(metric, categories, values, cumulativePercent(values));
  }

  private static List<Double> cumulativePercent(List<Double> values) {
    double total = 0d;
    for (Double value : values) {
      total += value;
    }
    List<Double> out = new ArrayList<>(values.size());
    double running = 0d;
    for (Double value : values) {
      running += value;
      double pct = total > 0 ? running / total * 100d : 0d;
      out.add(BigDecimal.valueOf(pct).setScale(2, RoundingMode.HALF_UP).doubleValue());
    }
    return out;
  }
}
