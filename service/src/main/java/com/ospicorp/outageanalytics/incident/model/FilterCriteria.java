package com.ospicorp.outageanalytics.incident.model;

import com.ospicorp.outageanalytics.incident.InvalidFilterException;
import java.time.LocalDate;
import org.springframework.util.StringUtils;

/**
 * Filters for an incident query. Dates are whole local days, both inclusive. A start date
 * without an end date selects that single day.
 */
public record FilterCriteria(
    LocalDate startDate,
    LocalDate endDate,
    String district,
    String cause,
    VoltageLevel voltage
) {

  public FilterCriteria {
    if (endDate != null && startDate == null) {
      throw InvalidFilterException.endWithoutStart();
    }
    if (startDate != null && endDate == null) {
      endDate = startDate;
    }
    if (startDate != null && endDate.isBefore(startDate)) {
      throw InvalidFilterException.invertedRange(startDate, endDate);
    }
    district = StringUtils.hasText(district) ? district : null;
    cause = StringUtils.hasText(cause) ? cause : null;
  }

  public static FilterCriteria none() {
    return new FilterCriteria(null, null, null, null, null);
  }

  public boolean hasDateRange() {
    return startDate != null;
  }
}
