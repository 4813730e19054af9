package com.ospicorp.outageanalytics.analytics;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

public record ParetoResult(
    Metric metric,
    List<String> categories,
    List<Double> values,
    @JsonProperty("cumulative_percent") List<Double> cumulativePercent
) {}
