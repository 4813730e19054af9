package com.ospicorp.outageanalytics.analytics;

import com.ospicorp.outageanalytics.incident.model.Incident;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

public final class DurationHistogram {
  private DurationHistogram() {
  }

  /** Counts incidents with a valid window per duration bucket, split by voltage level. */
  public static HistogramResult build(Collection<Incident> incidents) {
    DurationBucket[] buckets = DurationBucket.values();
    long[][] counts = new long[buckets.length][3];
    for (Incident incident : incidents) {
      if (!incident.hasValidWindow()) {
        continue;
      }
      long[] row = counts[DurationBucket.of(incident.durationMinutes()).ordinal()];
      row[0]++;
      switch (incident.voltage()) {
        case BT -> row[1]++;
        case MT -> row[2]++;
        default -> {
        }
      }
    }

    List<HistogramResult.Bucket> out = new ArrayList<>(buckets.length);
    for (DurationBucket bucket : buckets) {
      long[] row = counts[bucket.ordinal()];
      out.add(new HistogramResult.Bucket(bucket.label(), row[0], row[1], row[2]));
    }
    return new HistogramResult(out);
  }
}
