package com.ospicorp.outageanalytics.analytics;

import com.fasterxml.jackson.annotation.JsonFormat;
import java.util.List;

/**
 * Weekday by hour matrix flattened to cells, plus the largest cell value for colour scaling.
 * Weekday 0 is Monday.
 */
public record HeatmapResult(Metric metric, List<Cell> cells, double max) {

  public static final int WEEKDAYS = 7;
  public static final int HOURS = 24;

  /** Serialized as {@code [hour, weekday, value]}. */
  @JsonFormat(shape = JsonFormat.Shape.ARRAY)
  public record Cell(int hour, int weekday, double value) {}
}
