package com.culprit.ingest.service;

public class IncidentNotFoundException extends RuntimeException {
  public IncidentNotFoundException(String incidentId) {
    super("Incident not found: " + incidentId);
  }
}
