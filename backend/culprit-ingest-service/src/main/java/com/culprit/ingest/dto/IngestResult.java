package com.culprit.ingest.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IngestResult(
    @JsonProperty("incident_id") String incidentId,
    int received,
    int inserted,
    int duplicates
) {}
