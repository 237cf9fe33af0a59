package com.culprit.analysis.engine;

import java.util.List;
import java.util.Optional;

/**
 * Derives a metric's reference mean and standard deviation from the earliest slice of its
 * series. The incident window is assumed to open on normal behaviour.
 */
public class BaselineEstimator {

  private final AnalysisSettings settings;

  public BaselineEstimator(AnalysisSettings settings) {
    this.settings = settings;
  }

  /**
   * @param points one metric's points, ascending by timestamp
   * @return empty when the series is too short or its baseline is near-constant
   */
  public Optional<Baseline> estimate(List<MetricPoint> points) {
    if (points == null || points.size() < settings.minPoints()) return Optional.empty();

    int window = windowSize(points.size());
    Stats stats = computeStats(points.subList(0, window));
    if (stats.stddev() < settings.minStd()) return Optional.empty();

    return Optional.of(new Baseline(stats.mean(), stats.stddev(), window));
  }

  int windowSize(int size) {
    int quarter = size / settings.baselineFraction();
    return Math.max(settings.baselineMin(), Math.min(settings.baselineMax(), quarter));
  }

  private Stats computeStats(List<MetricPoint> window) {
    int n = window.size();
    double sum = 0.0;
    for (MetricPoint p : window) sum += p.value();
    double mean = sum / n;
    double var = 0.0;
    for (MetricPoint p : window) {
      double d = p.value() - mean;
      var += d * d;
    }
    // population variance
    return new Stats(mean, Math.sqrt(var / n));
  }

  private record Stats(double mean, double stddev) {}
}
