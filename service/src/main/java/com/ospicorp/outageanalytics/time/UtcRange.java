package com.ospicorp.outageanalytics.time;

import java.time.Instant;

/** A pair of UTC instants. Whether {@code end} is inclusive depends on the producer. */
public record UtcRange(Instant start, Instant end) {}
