package com.ospicorp.outageanalytics.analytics;

import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import com.ospicorp.outageanalytics.incident.model.Incident;
import com.ospicorp.outageanalytics.incident.service.IncidentService;
import com.ospicorp.outageanalytics.time.TimeNormalizer;
import com.ospicorp.outageanalytics.time.UtcRange;
import java.time.Duration;
import java.util.List;
import org.springframework.stereotype.Service;

@Service
public class AnalyticsService {
  private final IncidentService incidentService;
  private final TimeNormalizer timeNormalizer;

  public AnalyticsService(IncidentService incidentService, TimeNormalizer timeNormalizer) {
    this.incidentService = incidentService;
    this.timeNormalizer = timeNormalizer;
  }

  public DashboardResponse dashboard(FilterCriteria criteria, Metric metric) {
    return summarize(incidentService.find(criteria), metric, period(criteria));
  }

  UtcRange period(FilterCriteria criteria) {
    if (!criteria.hasDateRange()) {
      return null;
    }
    return new UtcRange(
        timeNormalizer.toUtcRange(criteria.startDate()).start(),
        timeNormalizer.toUtcRange(criteria.endDate()).end());
  }

  static DashboardResponse summarize(List<Incident> incidents, Metric metric) {
    return summarize(incidents, metric, null);
  }

  static DashboardResponse summarize(List<Incident> incidents, Metric metric, UtcRange period) {
    Duration total = DurationSummary.total(incidents);
    return new DashboardResponse(
        metric,
        period,
        incidents.size(),
        total.toMinutes(),
        DurationSummary.format(total),
        DailySeriesBuilder.build(incidents, metric),
        ParetoAggregator.byCause(incidents, metric),
        HeatmapBuilder.build(incidents, metric),
        DurationHistogram.build(incidents));
  }
}
