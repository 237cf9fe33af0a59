package com.culprit.analysis.engine;

import java.time.Instant;

/**
 * A run of same-metric anomalies with no gap wider than the merge tolerance.
 * {@code peakValue} and {@code peakAbsZScore} are running maxima over the members, tracked
 * independently, so a dip below baseline raises the |z| peak without lowering the value peak.
 */
public record Episode(
    String metricName,
    Instant start,
    Instant end,
    double baselineMean,
    double baselineStd,
    double peakValue,
    double peakAbsZScore
) {

  private static final double MIN_MEAN = 1e-9;

  public Episode {
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("episode end must not precede start");
    }
  }

  static Episode open(Anomaly a) {
    return new Episode(a.metricName(), a.timestamp(), a.timestamp(),
        a.baselineMean(), a.baselineStd(), a.value(), a.absZ());
  }

  Episode extend(Anomaly a) {
    return new Episode(metricName, start, a.timestamp(), baselineMean, baselineStd,
        Math.max(peakValue, a.value()),
        Math.max(peakAbsZScore, a.absZ()));
  }

  /** Peak change relative to the baseline mean in percent, 0 when the mean is ~0. */
  public double percentChange() {
    if (Math.abs(baselineMean) <= MIN_MEAN) return 0.0;
    return (peakValue - baselineMean) / baselineMean * 100.0;
  }

  /** Closed-interval overlap. */
  public boolean overlaps(Episode other) {
    return !(end.isBefore(other.start) || other.end.isBefore(start));
  }
}
