package com.ospicorp.outageanalytics.analytics;

import java.util.List;

public record HistogramResult(List<Bucket> buckets) {

  public record Bucket(String label, long total, long bt, long mt) {}
}
