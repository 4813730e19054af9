package com.ospicorp.outageanalytics.analytics;

import java.time.LocalDate;
import java.util.List;

/** Per-day totals aligned on {@code days}; only days with at least one incident appear. */
public record DailySeries(
    Metric metric,
    List<LocalDate> days,
    List<Double> total,
    List<Double> bt,
    List<Double> mt
) {}
