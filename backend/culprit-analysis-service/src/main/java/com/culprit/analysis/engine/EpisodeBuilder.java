package com.culprit.analysis.engine;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Collapses same-metric anomalies into episodes with a single forward scan. Cross-metric
 * grouping is left to {@link AgreementScorer}.
 */
public class EpisodeBuilder {

  static final Comparator<Episode> BY_START =
      Comparator.comparing(Episode::start).thenComparing(Episode::metricName);

  private final AnalysisSettings settings;

  public EpisodeBuilder(AnalysisSettings settings) {
    this.settings = settings;
  }

  public List<Episode> build(Map<String, List<Anomaly>> perMetric) {
    List<Episode> episodes = new ArrayList<>();
    for (List<Anomaly> anomalies : perMetric.values()) {
      buildMetric(anomalies, episodes);
    }
    episodes.sort(BY_START);
    return episodes;
  }

  private void buildMetric(List<Anomaly> anomalies, List<Episode> out) {
    Episode current = null;
    Duration gap = settings.mergeGap();
    for (Anomaly a : anomalies) {
      if (current == null) {
        current = Episode.open(a);
      } else if (Duration.between(current.end(), a.timestamp()).compareTo(gap) <= 0) {
        current = current.extend(a);
      } else {
        out.add(current);
        current = Episode.open(a);
      }
    }
    if (current != null) out.add(current);
  }
}
