package com.ospicorp.outageanalytics.store;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.Map;

/**
 * One row of a Flux query result, keyed by column name. Values arrive as text; the typed
 * accessors return a fallback instead of failing on blank or malformed cells.
 */
public final class FluxRecord {
  private final Map<String, String> values;

  public FluxRecord(Map<String, String> values) {
    this.values = Collections.unmodifiableMap(values);
  }

  public Map<String, String> values() {
    return values;
  }

  public String getString(String column) {
    String value = values.get(column);
    return value == null ? "" : value;
  }

  public Instant getTime() {
    return getInstant("_time");
  }

  public Instant getInstant(String column) {
    String value = values.get(column);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return Instant.parse(value.trim());
    } catch (DateTimeParseException ex) {
      return null;
    }
  }

  public Double getDouble(String column) {
    BigDecimal number = getNumber(column);
    return number == null ? null : number.doubleValue();
  }

  public long getLong(String column, long fallback) {
    BigDecimal number = getNumber(column);
    return number == null ? fallback : number.longValue();
  }

  private BigDecimal getNumber(String column) {
    String value = values.get(column);
    if (value == null || value.isBlank()) {
      return null;
    }
    try {
      return new BigDecimal(value.trim());
    } catch (NumberFormatException ex) {
      return null;
    }
  }

  @Override
  public String toString() {
    return "FluxRecord" + values;
  }
}
