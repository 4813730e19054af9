package com.ospicorp.outageanalytics.weather;

import java.time.Instant;

/** Hourly mean of one weather field at one site. */
public record WeatherSample(Instant time, String field, double value) {}
