package com.culprit.analysis.engine;

import com.culprit.analysis.model.AnalysisResponse;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;

/**
 * One-shot batch analysis of a single incident.
 *
 * <p>Stages run strictly in order: baseline and detection per metric, episode building,
 * cross-metric agreement, cause correlation, response assembly. Inputs are never mutated and
 * nothing is retained between calls, so one instance can serve concurrent requests. The
 * interrupt flag is checked between stages; an interrupted run throws
 * {@link CancellationException} and yields nothing.
 */
public class IncidentAnalyzer {

  private final AnomalyDetector detector;
  private final EpisodeBuilder episodes;
  private final AgreementScorer agreement;
  private final CauseCorrelator correlator;
  private final Executor executor;

  public IncidentAnalyzer(AnalysisSettings settings) {
    this(settings, null);
  }

  /** @param executor used for per-metric detection on large incidents, may be null */
  public IncidentAnalyzer(AnalysisSettings settings, Executor executor) {
    this.detector = new AnomalyDetector(settings, new BaselineEstimator(settings));
    this.episodes = new EpisodeBuilder(settings);
    this.agreement = new AgreementScorer(settings);
    this.correlator = new CauseCorrelator(settings);
    this.executor = executor;
  }

  /**
   * @param points ordered by metric name then timestamp
   * @param events ordered by timestamp
   */
  public AnalysisResponse analyze(String incidentId, List<MetricPoint> points, List<Event> events) {
    AnomalyDetector.Detection detection = detector.detectAll(groupByMetric(points), executor);
    checkCancelled();

    List<Episode> built = episodes.build(detection.perMetric());
    checkCancelled();

    double[] totals = agreement.score(built);
    checkCancelled();

    List<CauseCandidate> causes = correlator.rank(built, totals, events);
    checkCancelled();

    return assemble(incidentId, detection.anomalies(), built, causes);
  }

  private static Map<String, List<MetricPoint>> groupByMetric(List<MetricPoint> points) {
    Map<String, List<MetricPoint>> series = new LinkedHashMap<>();
    for (MetricPoint p : points) {
      series.computeIfAbsent(p.metricName(), k -> new ArrayList<>()).add(p);
    }
    return series;
  }

  private static void checkCancelled() {
    if (Thread.currentThread().isInterrupted()) {
      throw new CancellationException("analysis interrupted");
    }
  }

  private static AnalysisResponse assemble(String incidentId, List<Anomaly> anomalies,
                                           List<Episode> episodes, List<CauseCandidate> causes) {
    List<AnalysisResponse.AnomalyItem> anomalyItems = anomalies.stream()
        .map(a -> new AnalysisResponse.AnomalyItem(a.metricName(), a.timestamp(), a.value(),
            a.baselineMean(), a.baselineStd(), a.zScore()))
        .toList();

    List<AnalysisResponse.EpisodeItem> episodeItems = episodes.stream()
        .map(e -> new AnalysisResponse.EpisodeItem(e.metricName(), e.start(), e.end(),
            e.baselineMean(), e.baselineStd(), e.peakValue(), e.peakAbsZScore(), e.percentChange()))
        .toList();

    List<AnalysisResponse.CauseItem> causeItems = causes.stream()
        .map(c -> new AnalysisResponse.CauseItem(c.event().eventType(), c.event().timestamp(),
            c.event().metadata(), c.confidence(), c.evidence()))
        .toList();

    return new AnalysisResponse(incidentId, anomalyItems, episodeItems, causeItems);
  }
}
