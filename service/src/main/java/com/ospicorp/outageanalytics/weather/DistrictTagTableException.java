package com.ospicorp.outageanalytics.weather;

/** The district to weather-site table is missing or does not have the expected columns. */
public class DistrictTagTableException extends RuntimeException {

  public DistrictTagTableException(String message) {
    super(message);
  }

  public DistrictTagTableException(String message, Throwable cause) {
    super(message, cause);
  }
}
