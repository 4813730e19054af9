package com.ospicorp.outageanalytics.analytics;

import static com.ospicorp.outageanalytics.IncidentFixtures.incident;
import static com.ospicorp.outageanalytics.IncidentFixtures.lasting;
import static com.ospicorp.outageanalytics.IncidentFixtures.local;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.ospicorp.outageanalytics.incident.model.VoltageLevel;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DurationHistogramTest {

  @Test
  void boundariesAreLowerInclusive() {
    assertEquals(DurationBucket.UNDER_15, DurationBucket.of(0));
    assertEquals(DurationBucket.UNDER_15, DurationBucket.of(14.99));
    assertEquals(DurationBucket.FROM_15_TO_60, DurationBucket.of(15));
    assertEquals(DurationBucket.FROM_60_TO_120, DurationBucket.of(60));
    assertEquals(DurationBucket.FROM_120_TO_240, DurationBucket.of(239.5));
    assertEquals(DurationBucket.FROM_240, DurationBucket.of(240));
    assertEquals(DurationBucket.FROM_240, DurationBucket.of(Double.NaN));
  }

  @Test
  void everyNonNegativeDurationFitsExactlyOneBucket() {
    for (double minutes : new double[] {0, 1, 14.5, 15, 59.99, 60, 120, 239, 240, 10_000}) {
      long matches = Arrays.stream(DurationBucket.values()).filter(b -> b.contains(minutes)).count();
      assertEquals(1, matches, "minutes=" + minutes);
    }
  }

  @Test
  void countsByVoltageSkippingInvalidWindows() {
    var start = local(2024, 1, 10, 8, 0);
    HistogramResult result = DurationHistogram.build(List.of(
        lasting(start, 10, VoltageLevel.BT),
        lasting(start, 15, VoltageLevel.MT),
        lasting(start, 300, VoltageLevel.MT),
        lasting(start, 300, VoltageLevel.UNKNOWN),
        incident(start, null, VoltageLevel.BT, "Open")));

    assertThat(result.buckets()).extracting(HistogramResult.Bucket::label)
        .containsExactly("<15", "15-60", "60-120", "120-240", ">=240");
    assertEquals(new HistogramResult.Bucket("<15", 1, 1, 0), result.buckets().get(0));
    assertEquals(new HistogramResult.Bucket("15-60", 1, 0, 1), result.buckets().get(1));
    assertEquals(new HistogramResult.Bucket("60-120", 0, 0, 0), result.buckets().get(2));
    assertEquals(new HistogramResult.Bucket(">=240", 2, 0, 1), result.buckets().get(4));
  }
}
