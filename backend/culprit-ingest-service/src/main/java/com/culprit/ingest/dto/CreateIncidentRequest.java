package com.culprit.ingest.dto;

public record CreateIncidentRequest(String id, String title) {}
