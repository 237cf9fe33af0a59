package com.culprit.analysis.service;

public class AnalysisTimeoutException extends RuntimeException {
  public AnalysisTimeoutException(String incidentId, long timeoutMs) {
    super("Analysis of incident " + incidentId + " exceeded " + timeoutMs + " ms");
  }
}
