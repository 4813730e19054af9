package com.ospicorp.outageanalytics.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ospicorp.outageanalytics.time.UtcRange;

/**
 * Dashboard views for one filter. {@code period} is the selected local days as UTC instants,
 * first midnight to last 23:59:59, or null when no dates were chosen.
 */
public record DashboardResponse(
    Metric metric,
    @JsonProperty("period_utc") UtcRange period,
    @JsonProperty("incident_count") int incidentCount,
    @JsonProperty("total_duration_minutes") long totalDurationMinutes,
    @JsonProperty("total_duration") String totalDuration,
    DailySeries daily,
    ParetoResult pareto,
    HeatmapResult heatmap,
    HistogramResult histogram
) {}
