package com.culprit.analysis.engine;

import java.time.Instant;

/** A single point whose deviation from its metric's baseline crossed the z threshold. */
public record Anomaly(
    String metricName,
    Instant timestamp,
    double value,
    double baselineMean,
    double baselineStd,
    double zScore
) {
  public double absZ() {
    return Math.abs(zScore);
  }
}
