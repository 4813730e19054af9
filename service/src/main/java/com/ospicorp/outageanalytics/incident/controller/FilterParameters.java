package com.ospicorp.outageanalytics.incident.controller;

import com.ospicorp.outageanalytics.incident.InvalidFilterException;
import com.ospicorp.outageanalytics.incident.model.FilterCriteria;
import com.ospicorp.outageanalytics.incident.model.VoltageLevel;
import com.ospicorp.outageanalytics.time.TimeNormalizer;
import java.time.LocalDate;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Turns the raw {@code start_date}, {@code end_date}, {@code district}, {@code cause} and
 * {@code voltage} query parameters shared by the incident, analytics and weather endpoints
 * into {@link FilterCriteria}. Dates that do not parse are treated as absent.
 */
@Component
public class FilterParameters {
  private final TimeNormalizer timeNormalizer;

  public FilterParameters(TimeNormalizer timeNormalizer) {
    this.timeNormalizer = timeNormalizer;
  }

  public FilterCriteria toCriteria(String startDate, String endDate, String district,
      String cause, String voltage) {
    return new FilterCriteria(date(startDate), date(endDate), district, cause,
        voltage(voltage));
  }

  private LocalDate date(String value) {
    return timeNormalizer.parseFlexibleDate(value).orElse(null);
  }

  static VoltageLevel voltage(String value) {
    if (!StringUtils.hasText(value)) {
      return null;
    }
    VoltageLevel level = VoltageLevel.fromTag(value);
    if (level == VoltageLevel.UNKNOWN) {
      throw InvalidFilterException.unknownVoltage(value);
    }
    return level;
  }
}
