package com.ospicorp.outageanalytics.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.ospicorp.outageanalytics.IncidentFixtures;
import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import com.ospicorp.outageanalytics.incident.service.IncidentService;
import com.ospicorp.outageanalytics.time.TimeNormalizer;
import com.ospicorp.outageanalytics.time.UtcRange;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.Test;

class AnalyticsServiceTest {

  private final IncidentService incidentService = mock(IncidentService.class);
  private final AnalyticsService service =
      new AnalyticsService(incidentService, new TimeNormalizer(IncidentFixtures.ZONE));

  @Test
  void periodCoversSelectedLocalDaysInclusively() {
    FilterCriteria criteria = new FilterCriteria(LocalDate.of(2024, 1, 10),
        LocalDate.of(2024, 1, 12), null, null, null);
    when(incidentService.find(criteria)).thenReturn(List.of());

    DashboardResponse response = service.dashboard(criteria, Metric.COUNT);

    assertEquals(new UtcRange(Instant.parse("2024-01-10T03:00:00Z"),
        Instant.parse("2024-01-13T02:59:59Z")), response.period());
    assertEquals(0, response.incidentCount());
  }

  @Test
  void noDatesMeansNoPeriod() {
    when(incidentService.find(FilterCriteria.none())).thenReturn(List.of());

    assertThat(service.dashboard(FilterCriteria.none(), Metric.COUNT).period()).isNull();
  }
}
