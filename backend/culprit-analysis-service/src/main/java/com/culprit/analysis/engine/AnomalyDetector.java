package com.culprit.analysis.engine;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flags points whose z-score against the metric baseline reaches the threshold.
 * Metrics are independent, so large incidents are scored on an executor.
 */
public class AnomalyDetector {

  private static final Logger log = LoggerFactory.getLogger(AnomalyDetector.class);

  static final Comparator<Anomaly> BY_TIME =
      Comparator.comparing(Anomaly::timestamp).thenComparing(Anomaly::metricName);

  private final AnalysisSettings settings;
  private final BaselineEstimator baselines;

  public AnomalyDetector(AnalysisSettings settings, BaselineEstimator baselines) {
    this.settings = settings;
    this.baselines = baselines;
  }

  public List<Anomaly> detect(String metricName, List<MetricPoint> points) {
    Optional<Baseline> baseline = baselines.estimate(points);
    if (baseline.isEmpty()) {
      log.debug("Skipping metric '{}': {} points, no usable baseline", metricName,
          points == null ? 0 : points.size());
      return List.of();
    }
    Baseline b = baseline.get();
    List<Anomaly> out = new ArrayList<>();
    for (MetricPoint p : points.subList(b.scoringStart(), points.size())) {
      double z = (p.value() - b.mean()) / b.std();
      if (Math.abs(z) >= settings.zThreshold()) {
        out.add(new Anomaly(metricName, p.timestamp(), p.value(), b.mean(), b.std(), z));
      }
    }
    return out;
  }

  /**
   * Scores every metric. Runs inline unless the metric count exceeds
   * {@link AnalysisSettings#parallelMetricThreshold()} and an executor is given.
   */
  public Detection detectAll(Map<String, List<MetricPoint>> series, Executor executor) {
    Map<String, List<Anomaly>> perMetric = new LinkedHashMap<>();
    if (executor != null && series.size() > settings.parallelMetricThreshold()) {
      Map<String, CompletableFuture<List<Anomaly>>> futures = new LinkedHashMap<>();
      series.forEach((metric, points) ->
          futures.put(metric, CompletableFuture.supplyAsync(() -> detect(metric, points), executor)));
      try {
        for (Map.Entry<String, CompletableFuture<List<Anomaly>>> e : futures.entrySet()) {
          perMetric.put(e.getKey(), e.getValue().get());
        }
      } catch (InterruptedException e) {
        futures.values().forEach(f -> f.cancel(true));
        Thread.currentThread().interrupt();
        throw new CancellationException("metric detection interrupted");
      } catch (ExecutionException e) {
        futures.values().forEach(f -> f.cancel(true));
        if (e.getCause() instanceof RuntimeException re) throw re;
        throw new IllegalStateException("metric detection failed", e.getCause());
      } catch (CancellationException e) {
        futures.values().forEach(f -> f.cancel(true));
        throw e;
      }
    } else {
      series.forEach((metric, points) -> perMetric.put(metric, detect(metric, points)));
    }

    List<Anomaly> all = new ArrayList<>();
    perMetric.values().forEach(all::addAll);
    all.sort(BY_TIME);
    return new Detection(all, perMetric);
  }

  /**
   * @param anomalies all anomalies, ascending by time
   * @param perMetric the same anomalies grouped by metric, each list ascending by time
   */
  public record Detection(List<Anomaly> anomalies, Map<String, List<Anomaly>> perMetric) {}
}
