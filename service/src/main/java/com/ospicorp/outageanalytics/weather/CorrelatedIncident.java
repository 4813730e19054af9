package com.ospicorp.outageanalytics.weather;

import com.ospicorp.outageanalytics.incident.model.Incident;

public record CorrelatedIncident(Incident incident, WeatherMetrics weather, WeatherStatus status) {}
