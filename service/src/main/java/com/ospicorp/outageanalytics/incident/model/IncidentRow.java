package com.ospicorp.outageanalytics.incident.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.ospicorp.outageanalytics.time.TimeNormalizer;

/** Flat listing/export shape of an incident, with local dates and times already formatted. */
@JsonPropertyOrder({"number", "start_date", "start_time", "end_date", "end_time", "district",
    "voltage", "installation", "locality", "distributor", "cause", "complaints", "substations",
    "customers", "power"})
public record IncidentRow(
    String number,
    @JsonProperty("start_date") String startDate,
    @JsonProperty("start_time") String startTime,
    @JsonProperty("end_date") String endDate,
    @JsonProperty("end_time") String endTime,
    String district,
    String voltage,
    String installation,
    String locality,
    String distributor,
    String cause,
    long complaints,
    long substations,
    long customers,
    double power
) {

  public static IncidentRow of(Incident incident) {
    return new IncidentRow(
        incident.number(),
        TimeNormalizer.displayDate(incident.start()),
        TimeNormalizer.displayTime(incident.start()),
        TimeNormalizer.displayDate(incident.end()),
        TimeNormalizer.displayTime(incident.end()),
        incident.district(),
        incident.voltage().name(),
        incident.installation(),
        incident.locality(),
        incident.distributor(),
        incident.cause(),
        incident.complaints(),
        incident.substations(),
        incident.customers(),
        incident.power());
  }
}
