package com.culprit.analysis.config;

import com.culprit.analysis.engine.AnalysisSettings;
import com.culprit.analysis.engine.IncidentAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AnalysisConfig {

  private static final Logger log = LoggerFactory.getLogger(AnalysisConfig.class);

  @Bean
  public AnalysisSettings analysisSettings(
      @Value("${culprit.analysis.min-points:12}") int minPoints,
      @Value("${culprit.analysis.baseline-min:10}") int baselineMin,
      @Value("${culprit.analysis.baseline-max:30}") int baselineMax,
      @Value("${culprit.analysis.z-threshold:3.0}") double zThreshold,
      @Value("${culprit.analysis.merge-gap-seconds:120}") long mergeGapSeconds,
      @Value("${culprit.analysis.correlation-window-seconds:600}") long windowSeconds,
      @Value("${culprit.analysis.agreement-bonus:0.35}") double agreementBonus,
      @Value("${culprit.analysis.agreement-cap:0.6}") double agreementCap,
      @Value("${culprit.analysis.default-prior:0.6}") double defaultPrior,
      @Value("${culprit.analysis.event-priors:}") String eventPriors,
      @Value("${culprit.analysis.max-evidence:6}") int maxEvidence,
      @Value("${culprit.analysis.max-causes:5}") int maxCauses,
      @Value("${culprit.analysis.parallel-metric-threshold:16}") int parallelMetricThreshold) {
    AnalysisSettings settings = AnalysisSettings.builder()
        .minPoints(minPoints)
        .baselineMin(baselineMin)
        .baselineMax(baselineMax)
        .zThreshold(zThreshold)
        .mergeGap(Duration.ofSeconds(mergeGapSeconds))
        .correlationWindow(Duration.ofSeconds(windowSeconds))
        .agreementBonus(agreementBonus)
        .agreementCap(agreementCap)
        .defaultPrior(defaultPrior)
        .eventPriors(parsePriors(eventPriors))
        .maxEvidence(maxEvidence)
        .maxCauses(maxCauses)
        .parallelMetricThreshold(parallelMetricThreshold)
        .build();
    log.info("Analysis settings: z>={} gap={}s window={}s priors={}",
        settings.zThreshold(), mergeGapSeconds, windowSeconds, settings.eventPriors());
    return settings;
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService metricWorkerExecutor(@Value("${culprit.analysis.metric-threads:4}") int threads) {
    return Executors.newFixedThreadPool(Math.max(1, threads), named("culprit-metric-"));
  }

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService analysisRequestExecutor(@Value("${culprit.analysis.request-threads:4}") int threads) {
    return Executors.newFixedThreadPool(Math.max(1, threads), named("culprit-analysis-"));
  }

  @Bean
  public IncidentAnalyzer incidentAnalyzer(AnalysisSettings settings,
                                           @Qualifier("metricWorkerExecutor") ExecutorService workers) {
    return new IncidentAnalyzer(settings, workers);
  }

  /**
   * Parses {@code type:prior} pairs separated by commas, e.g. {@code deploy:1.0,rollback:0.9}.
   * Blank input keeps the built-in table.
   */
  static Map<String, Double> parsePriors(String raw) {
    if (raw == null || raw.isBlank()) return AnalysisSettings.DEFAULT_EVENT_PRIORS;
    Map<String, Double> out = new LinkedHashMap<>();
    for (String pair : raw.split(",")) {
      String p = pair.strip();
      if (p.isEmpty()) continue;
      int idx = p.indexOf(':');
      if (idx <= 0 || idx == p.length() - 1) {
        throw new IllegalArgumentException("Invalid event prior '" + p + "', expected type:value");
      }
      String type = p.substring(0, idx).strip().toLowerCase(Locale.ROOT);
      out.put(type, Double.parseDouble(p.substring(idx + 1).strip()));
    }
    return out;
  }

  private static ThreadFactory named(String prefix) {
    AtomicInteger seq = new AtomicInteger();
    return r -> {
      Thread t = new Thread(r, prefix + seq.incrementAndGet());
      t.setDaemon(true);
      return t;
    };
  }
}
