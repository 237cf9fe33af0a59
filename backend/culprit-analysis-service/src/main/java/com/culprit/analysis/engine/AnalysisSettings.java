package com.culprit.analysis.engine;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Heuristic constants of the analysis pipeline.
 *
 * <p>Everything the stages compare against lives here so a deployment can tune thresholds
 * without touching the algorithms. {@link #defaults()} is the calibrated set.
 *
 * @param minPoints               metrics with fewer points are skipped
 * @param baselineMin             lower clamp of the baseline window
 * @param baselineMax             upper clamp of the baseline window
 * @param baselineFraction        baseline window is {@code size / baselineFraction} before clamping
 * @param minStd                  baselines with a smaller standard deviation are skipped
 * @param zThreshold              points with {@code |z| >= zThreshold} are anomalies
 * @param mergeGap                max gap between same-metric anomalies inside one episode
 * @param correlationWindow       max distance between an event and an episode start
 * @param agreementBonus          bonus per overlapping pair of episodes
 * @param agreementCap            cap applied to an episode's summed agreement
 * @param severityCap             |z| above this counts as full severity
 * @param severityFloor           weight of a zero-severity episode
 * @param defaultPrior            prior for event types missing from {@code eventPriors}
 * @param eventPriors             prior plausibility per event type
 * @param maxEvidence             evidence lines kept per cause
 * @param maxCauses               causes kept in the response
 * @param parallelMetricThreshold metric count above which detection fans out to workers
 */
public record AnalysisSettings(
    int minPoints,
    int baselineMin,
    int baselineMax,
    int baselineFraction,
    double minStd,
    double zThreshold,
    Duration mergeGap,
    Duration correlationWindow,
    double agreementBonus,
    double agreementCap,
    double severityCap,
    double severityFloor,
    double defaultPrior,
    Map<String, Double> eventPriors,
    int maxEvidence,
    int maxCauses,
    int parallelMetricThreshold
) {

  public static final Map<String, Double> DEFAULT_EVENT_PRIORS = defaultPriors();

  public AnalysisSettings {
    Objects.requireNonNull(mergeGap, "mergeGap");
    Objects.requireNonNull(correlationWindow, "correlationWindow");
    if (baselineMin < 1 || baselineMax < baselineMin) {
      throw new IllegalArgumentException("baseline window bounds must satisfy 1 <= min <= max");
    }
    if (baselineFraction < 1) {
      throw new IllegalArgumentException("baselineFraction must be >= 1");
    }
    if (correlationWindow.isZero() || correlationWindow.isNegative()) {
      throw new IllegalArgumentException("correlationWindow must be positive");
    }
    if (mergeGap.isNegative()) {
      throw new IllegalArgumentException("mergeGap must not be negative");
    }
    if (maxEvidence < 0 || maxCauses < 0) {
      throw new IllegalArgumentException("evidence and cause limits must not be negative");
    }
    eventPriors = eventPriors == null ? Map.of() : Map.copyOf(eventPriors);
  }

  public static AnalysisSettings defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    return new Builder()
        .minPoints(minPoints)
        .baselineMin(baselineMin)
        .baselineMax(baselineMax)
        .baselineFraction(baselineFraction)
        .minStd(minStd)
        .zThreshold(zThreshold)
        .mergeGap(mergeGap)
        .correlationWindow(correlationWindow)
        .agreementBonus(agreementBonus)
        .agreementCap(agreementCap)
        .severityCap(severityCap)
        .severityFloor(severityFloor)
        .defaultPrior(defaultPrior)
        .eventPriors(eventPriors)
        .maxEvidence(maxEvidence)
        .maxCauses(maxCauses)
        .parallelMetricThreshold(parallelMetricThreshold);
  }

  /** Prior plausibility of an event type; unknown or missing types get {@link #defaultPrior()}. */
  public double prior(String eventType) {
    if (eventType == null) return defaultPrior;
    Double p = eventPriors.get(eventType);
    return p != null ? p : defaultPrior;
  }

  private static Map<String, Double> defaultPriors() {
    Map<String, Double> m = new LinkedHashMap<>();
    m.put("deploy", 1.00);
    m.put("config_change", 0.85);
    m.put("feature_flag", 0.75);
    m.put("db_migration", 0.80);
    m.put("incident_note", 0.50);
    return Map.copyOf(m);
  }

  public static final class Builder {
    private int minPoints = 12;
    private int baselineMin = 10;
    private int baselineMax = 30;
    private int baselineFraction = 4;
    private double minStd = 1e-9;
    private double zThreshold = 3.0;
    private Duration mergeGap = Duration.ofMinutes(2);
    private Duration correlationWindow = Duration.ofMinutes(10);
    private double agreementBonus = 0.35;
    private double agreementCap = 0.6;
    private double severityCap = 10.0;
    private double severityFloor = 0.55;
    private double defaultPrior = 0.6;
    private Map<String, Double> eventPriors = DEFAULT_EVENT_PRIORS;
    private int maxEvidence = 6;
    private int maxCauses = 5;
    private int parallelMetricThreshold = 16;

    private Builder() {}

    public Builder minPoints(int v) { this.minPoints = v; return this; }
    public Builder baselineMin(int v) { this.baselineMin = v; return this; }
    public Builder baselineMax(int v) { this.baselineMax = v; return this; }
    public Builder baselineFraction(int v) { this.baselineFraction = v; return this; }
    public Builder minStd(double v) { this.minStd = v; return this; }
    public Builder zThreshold(double v) { this.zThreshold = v; return this; }
    public Builder mergeGap(Duration v) { this.mergeGap = v; return this; }
    public Builder correlationWindow(Duration v) { this.correlationWindow = v; return this; }
    public Builder agreementBonus(double v) { this.agreementBonus = v; return this; }
    public Builder agreementCap(double v) { this.agreementCap = v; return this; }
    public Builder severityCap(double v) { this.severityCap = v; return this; }
    public Builder severityFloor(double v) { this.severityFloor = v; return this; }
    public Builder defaultPrior(double v) { this.defaultPrior = v; return this; }
    public Builder eventPriors(Map<String, Double> v) { this.eventPriors = v; return this; }
    public Builder maxEvidence(int v) { this.maxEvidence = v; return this; }
    public Builder maxCauses(int v) { this.maxCauses = v; return this; }
    public Builder parallelMetricThreshold(int v) { this.parallelMetricThreshold = v; return this; }

    public AnalysisSettings build() {
      return new AnalysisSettings(minPoints, baselineMin, baselineMax, baselineFraction, minStd,
          zThreshold, mergeGap, correlationWindow, agreementBonus, agreementCap, severityCap,
          severityFloor, defaultPrior, eventPriors, maxEvidence, maxCauses, parallelMetricThreshold);
    }
  }
}
