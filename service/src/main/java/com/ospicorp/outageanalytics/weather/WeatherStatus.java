package com.ospicorp.outageanalytics.weather;

import com.fasterxml.jackson.annotation.JsonValue;

public enum WeatherStatus {
  /** Samples were returned for the district's site. */
  OK("ok"),
  /** The district has a site tag but the store returned nothing for the window. */
  NO_DATA("sin_datos"),
  /** The district is missing from the tag table; no query was made. */
  NO_TAG("sin_tag");

  private final String code;

  WeatherStatus(String code) {
    this.code = code;
  }

  @JsonValue
  public String code() {
    return code;
  }
}
