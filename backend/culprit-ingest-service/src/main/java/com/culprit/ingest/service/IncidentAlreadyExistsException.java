package com.culprit.ingest.service;

public class IncidentAlreadyExistsException extends RuntimeException {
  public IncidentAlreadyExistsException(String incidentId) {
    super("Incident already exists: " + incidentId);
  }
}
