package com.ospicorp.outageanalytics.weather;

import java.util.List;
import java.util.Map;

/** Raised when incidents handed to the correlator lack district, start or end. */
public class CorrelationValidationException extends RuntimeException {
  private final List<String> missingFields;
  private final List<Map<String, Object>> examples;

  public CorrelationValidationException(List<String> missingFields,
      List<Map<String, Object>> examples) {
    super("Incidents missing required fields " + missingFields + ". Examples: " + examples);
    this.missingFields = List.copyOf(missingFields);
    this.examples = List.copyOf(examples);
  }

  public List<String> missingFields() {
    return missingFields;
  }

  public List<Map<String, Object>> examples() {
    return examples;
  }
}
