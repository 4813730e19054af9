package com.ospicorp.outageanalytics.weather;

import java.time.Instant;
import java.util.List;

public interface WeatherSampleSource {

  /**
   * Returns hourly samples of the configured fields for {@code siteTag} within
   * {@code [start, stop]}. An empty list means no data, whatever the reason.
   */
  List<WeatherSample> fetch(String siteTag, Instant start, Instant stop);
}
