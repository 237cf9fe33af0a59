package com.culprit.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record IncidentResponse(
    String id,
    String title,
    @JsonProperty("created_at") Instant createdAt
) {}
