package com.culprit.analysis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record AnalysisResponse(
    @JsonProperty("incident_id") String incidentId,
    List<AnomalyItem> anomalies,
    List<EpisodeItem> episodes,
    @JsonProperty("likely_causes") List<CauseItem> likelyCauses
) {
  public record AnomalyItem(
      @JsonProperty("metric_name") String metricName,
      Instant ts,
      double value,
      @JsonProperty("baseline_mean") double baselineMean,
      @JsonProperty("baseline_std") double baselineStd,
      @JsonProperty("z_score") double zScore
  ) {}

  public record EpisodeItem(
      @JsonProperty("metric_name") String metricName,
      @JsonProperty("start_ts") Instant startTs,
      @JsonProperty("end_ts") Instant endTs,
      @JsonProperty("baseline_mean") double baselineMean,
      @JsonProperty("baseline_std") double baselineStd,
      @JsonProperty("peak_value") double peakValue,
      @JsonProperty("peak_z_score") double peakZScore,
      @JsonProperty("percent_change") double percentChange
  ) {}

  public record CauseItem(
      @JsonProperty("event_type") String eventType,
      Instant ts,
      Map<String, Object> meta,
      double confidence,
      List<String> evidence
  ) {}
}
