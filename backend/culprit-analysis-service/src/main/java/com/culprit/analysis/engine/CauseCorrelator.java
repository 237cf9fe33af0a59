package com.culprit.analysis.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Links episodes to the events that most plausibly caused them.
 *
 * <p>For each episode and each event within the correlation window of the episode start the
 * contribution is {@code proximity * prior * severityWeight * agreementWeight}. Contributions
 * accumulate per event across episodes, so one deploy behind several abnormal metrics outranks
 * an event that lines up with only one. Scores are then normalised against the best event.
 * Every event inside the window of some episode is a candidate, including one exactly on the
 * window edge, which carries zero weight and ranks with confidence 0. Ids that are both numeric
 * strings break final ties in numeric order.
 */
public class CauseCorrelator {

  private static final Comparator<CauseCandidate> BY_CONFIDENCE =
      Comparator.comparingDouble(CauseCandidate::confidence).reversed()
          .thenComparing(c -> c.event().timestamp())
          .thenComparing(c -> c.event().id(), Comparator.nullsLast(
              Comparator.comparingInt(String::length).thenComparing(Comparator.naturalOrder())));

  private final AnalysisSettings settings;

  public CauseCorrelator(AnalysisSettings settings) {
    this.settings = settings;
  }

  /**
   * @param episodes  ascending by start
   * @param agreement raw agreement totals indexed like {@code episodes}
   * @param events    ascending by timestamp
   * @return at most {@code maxCauses} candidates, most confident first
   */
  public List<CauseCandidate> rank(List<Episode> episodes, double[] agreement, List<Event> events) {
    Map<Integer, Accumulator> byEvent = new LinkedHashMap<>();
    double windowSeconds = settings.correlationWindow().toMillis() / 1000.0;

    for (int i = 0; i < episodes.size(); i++) {
      Episode ep = episodes.get(i);
      double severityWeight = severityWeight(ep);
      double agreementWeight = 1.0 + Math.min(settings.agreementCap(), agreement[i]);

      for (int j = 0; j < events.size(); j++) {
        Event ev = events.get(j);
        double distance = Math.abs(seconds(ep.start(), ev.timestamp()));
        if (distance > windowSeconds) continue;

        double proximity = Math.max(0.0, 1.0 - distance / windowSeconds);
        double contribution = proximity * settings.prior(ev.eventType()) * severityWeight * agreementWeight;

        Accumulator acc = byEvent.computeIfAbsent(j, k -> new Accumulator(ev));
        acc.score += contribution;
        acc.evidence.add(evidence(ep, ev));
      }
    }

    double max = 0.0;
    for (Accumulator acc : byEvent.values()) max = Math.max(max, acc.score);
    if (max <= 0.0) return List.of();

    List<CauseCandidate> ranked = new ArrayList<>();
    for (Accumulator acc : byEvent.values()) {
      List<String> lines = acc.evidence.size() > settings.maxEvidence()
          ? acc.evidence.subList(0, settings.maxEvidence())
          : acc.evidence;
      ranked.add(new CauseCandidate(acc.event, acc.score, lines, acc.score / max));
    }
    ranked.sort(BY_CONFIDENCE);
    return List.copyOf(ranked.size() > settings.maxCauses() ? ranked.subList(0, settings.maxCauses()) : ranked);
  }

  double severityWeight(Episode ep) {
    double severity = Math.min(settings.severityCap(), ep.peakAbsZScore()) / settings.severityCap();
    return settings.severityFloor() + (1.0 - settings.severityFloor()) * severity;
  }

  static String evidence(Episode ep, Event ev) {
    double offsetMinutes = seconds(ep.start(), ev.timestamp()) / 60.0;
    String relation;
    if (offsetMinutes < 0) {
      relation = String.format(Locale.ROOT, "%.1f min before onset", -offsetMinutes);
    } else if (offsetMinutes > 0) {
      relation = String.format(Locale.ROOT, "%.1f min after onset", offsetMinutes);
    } else {
      relation = "at onset";
    }
    return String.format(Locale.ROOT,
        "%s abnormal %s -> %s: baseline %.2f -> peak %.2f (%+.1f%%, |z|=%.1f); %s %s",
        ep.metricName(), ep.start(), ep.end(), ep.baselineMean(), ep.peakValue(),
        ep.percentChange(), ep.peakAbsZScore(), ev.eventType(), relation);
  }

  /** Signed seconds from {@code from} to {@code to}. */
  private static double seconds(Instant from, Instant to) {
    return Duration.between(from, to).toMillis() / 1000.0;
  }

  private static final class Accumulator {
    private final Event event;
    private final List<String> evidence = new ArrayList<>();
    private double score;

    private Accumulator(Event event) {
      this.event = event;
    }
  }
}
