package com.ospicorp.outageanalytics.analytics;

import static com.ospicorp.outageanalytics.IncidentFixtures.lasting;
import static com.ospicorp.outageanalytics.IncidentFixtures.local;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.ospicorp.outageanalytics.incident.model.VoltageLevel;
import java.util.List;
import org.junit.jupiter.api.Test;

class HeatmapBuilderTest {

  @Test
  void emptyInputStillHasEveryCell() {
    HeatmapResult result = HeatmapBuilder.build(List.of(), Metric.COUNT);

    assertEquals(7 * 24, result.cells().size());
    assertEquals(0d, result.max());
    assertEquals(0d, valueAt(result, 6, 23));
  }

  @Test
  void bucketsByLocalWeekdayAndHourOfStart() {
    // 2024-01-10 is a Wednesday, 2024-01-14 a Sunday
    var result = HeatmapBuilder.build(List.of(
        lasting(local(2024, 1, 10, 8, 5), 30, VoltageLevel.BT),
        lasting(local(2024, 1, 10, 8, 55), 90, VoltageLevel.MT),
        lasting(local(2024, 1, 14, 23, 0), 15, VoltageLevel.BT)), Metric.DURATION_MINUTES);

    assertEquals(120d, valueAt(result, 2, 8));
    assertEquals(15d, valueAt(result, 6, 23));
    assertEquals(120d, result.max());
    HeatmapResult.Cell cell = result.cells().get(2 * 24 + 8);
    assertEquals(8, cell.hour());
    assertEquals(2, cell.weekday());
  }

  private static double valueAt(HeatmapResult result, int weekday, int hour) {
    return result.cells().get(weekday * HeatmapResult.HOURS + hour).value();
  }
}
