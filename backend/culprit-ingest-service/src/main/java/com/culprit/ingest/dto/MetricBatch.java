package com.culprit.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;

public record MetricBatch(List<Item> points) {
  public record Item(
      @JsonProperty("metric_name") String metricName,
      Instant ts,
      Double value
  ) {}
}
