package com.ospicorp.outageanalytics.weather;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Weather observed during an incident. Each value is null when no sample supports it. */
public record WeatherMetrics(
    @JsonProperty("wind_max") Double windMax,
    @JsonProperty("wind_mean") Double windMean,
    @JsonProperty("temperature_mean") Double temperatureMean,
    @JsonProperty("humidity_mean") Double humidityMean,
    @JsonProperty("humidity_prev_6h") Double humidityPrevious6h
) {

  public static final WeatherMetrics EMPTY = new WeatherMetrics(null, null, null, null, null);
}
