package com.ospicorp.outageanalytics.analytics;

import static com.ospicorp.outageanalytics.IncidentFixtures.incident;
import static com.ospicorp.outageanalytics.IncidentFixtures.local;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.ospicorp.outageanalytics.incident.model.Incident;
import com.ospicorp.outageanalytics.incident.model.VoltageLevel;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ParetoAggregatorTest {

  private static List<Incident> withCounts(int... counts) {
    List<Incident> incidents = new ArrayList<>();
    for (int i = 0; i < counts.length; i++) {
      for (int n = 0; n < counts[i]; n++) {
        var start = local(2024, 1, 10, 8, 0);
        incidents.add(incident(start, start.plusMinutes(10), VoltageLevel.BT,
            String.format("cause-%02d", i)));
      }
    }
    return incidents;
  }

  @Test
  void collapsesTailIntoOther() {
    ParetoResult result = ParetoAggregator.byCause(
        withCounts(50, 40, 30, 20, 15, 10, 8, 6, 5, 4, 3, 2, 1, 1), Metric.COUNT);

    assertEquals(13, result.categories().size());
    assertEquals("cause-00", result.categories().get(0));
    assertEquals("cause-11", result.categories().get(11));
    assertEquals(ParetoAggregator.OTHER, result.categories().get(12));
    assertEquals(2d, result.values().get(12));
    assertEquals(195d, result.values().stream().mapToDouble(Double::doubleValue).sum());
    assertEquals(100d, result.cumulativePercent().get(12));
  }

  @Test
  void cumulativePercentIsNonDecreasing() {
    ParetoResult result = ParetoAggregator.byCause(withCounts(3, 7, 1, 1, 9), Metric.COUNT);

    List<Double> cumulative = result.cumulativePercent();
    for (int i = 1; i < cumulative.size(); i++) {
      assertThat(cumulative.get(i)).isGreaterThanOrEqualTo(cumulative.get(i - 1));
    }
    assertEquals(100d, cumulative.get(cumulative.size() - 1));
    assertThat(result.categories()).doesNotContain(ParetoAggregator.OTHER);
    assertThat(result.values()).containsExactly(9d, 7d, 3d, 1d, 1d);
    assertThat(cumulative.get(0)).isEqualTo(42.86);
  }

  @Test
  void blankCauseIsUnspecified() {
    var start = local(2024, 1, 10, 8, 0);
    ParetoResult result = ParetoAggregator.byCause(
        List.of(incident(start, start.plusMinutes(30), VoltageLevel.MT, " ")),
        Metric.DURATION_MINUTES);

    assertThat(result.categories()).containsExactly(ParetoAggregator.UNSPECIFIED);
    assertThat(result.values()).containsExactly(30d);
  }

  @Test
  void emptyInputGivesEmptyResult() {
    ParetoResult result = ParetoAggregator.byCause(List.of(), Metric.COUNT);

    assertThat(result.categories()).isEmpty();
    assertThat(result.cumulativePercent()).isEmpty();
  }
}
