package com.culprit.analysis.engine;

import java.time.Instant;
import java.util.Map;

/** An operational event (deploy, config change, ...) that may explain abnormal metrics. */
public record Event(
    String id,
    String eventType,
    Instant timestamp,
    Map<String, Object> metadata
) {
  public Event {
    metadata = metadata == null ? Map.of() : metadata;
  }
}
