package com.ospicorp.outageanalytics.analytics;

/** Fixed duration ranges in minutes, lower bound inclusive, upper bound exclusive. */
public enum DurationBucket {
  UNDER_15("<15", 0, 15),
  FROM_15_TO_60("15-60", 15, 60),
  FROM_60_TO_120("60-120", 60, 120),
  FROM_120_TO_240("120-240", 120, 240),
  FROM_240(">=240", 240, Double.POSITIVE_INFINITY);

  private final String label;
  private final double lower;
  private final double upper;

  DurationBucket(String label, double lower, double upper) {
    this.label = label;
    this.lower = lower;
    this.upper = upper;
  }

  public String label() {
    return label;
  }

  public boolean contains(double minutes) {
    return minutes >= lower && minutes < upper;
  }

  /** Bucket for {@code minutes}; anything that fits no range lands in the last bucket. */
  public static DurationBucket of(double minutes) {
    for (DurationBucket bucket : values()) {
      if (bucket.contains(minutes)) {
        return bucket;
      }
    }
    return FROM_240;
  }
}
