package com.ospicorp.outageanalytics.incident.model;

import java.util.Locale;

public enum VoltageLevel {
  BT,
  MT,
  UNKNOWN;

  /** Reads the store's {@code nivel_tension} tag; anything other than BT or MT is unknown. */
  public static VoltageLevel fromTag(String value) {
    if (value == null) {
      return UNKNOWN;
    }
    return switch (value.trim().toUpperCase(Locale.ROOT)) {
      case "BT" -> BT;
      case "MT" -> MT;
      default -> UNKNOWN;
    };
  }
}
