package com.ospicorp.outageanalytics.incident;

import java.time.LocalDate;

public class InvalidFilterException extends RuntimeException {
  private static final String ERROR_DOCS_BASE = "https://docs.outage-analytics.dev/errors/";

  private final int errorCode;
  private final String moreInfo;

  public InvalidFilterException(String message, int errorCode) {
    super(message);
    this.errorCode = errorCode;
    this.moreInfo = ERROR_DOCS_BASE + errorCode;
  }

  public static InvalidFilterException endWithoutStart() {
    return new InvalidFilterException("end_date requires start_date.", 2001);
  }

  public static InvalidFilterException invertedRange(LocalDate start, LocalDate end) {
    return new InvalidFilterException(
        "start_date " + start + " must be before or equal to end_date " + end + ".", 2002);
  }

  public static InvalidFilterException unknownVoltage(String value) {
    return new InvalidFilterException(
        "Invalid voltage '" + value + "'. Supported values: BT,MT.", 2003);
  }

  public static InvalidFilterException unknownMetric(String value) {
    return new InvalidFilterException(
        "Invalid metric '" + value + "'. Supported values: count,duration_minutes.", 2004);
  }

  public static InvalidFilterException unknownFormat(String value) {
    return new InvalidFilterException(
        "Invalid format '" + value + "'. Supported values: json,csv.", 2005);
  }

  public int errorCode() {
    return errorCode;
  }

  public String moreInfo() {
    return moreInfo;
  }
}
