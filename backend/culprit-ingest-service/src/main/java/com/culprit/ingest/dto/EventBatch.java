package com.culprit.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record EventBatch(List<Item> events) {
  public record Item(
      @JsonProperty("event_type") String eventType,
      Instant ts,
      Map<String, Object> meta
  ) {}
}
