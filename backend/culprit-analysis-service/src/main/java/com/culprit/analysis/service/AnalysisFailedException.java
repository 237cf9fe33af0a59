package com.culprit.analysis.service;

/** Any fault outside the modelled cases; the message is surfaced to the caller. */
public class AnalysisFailedException extends RuntimeException {
  public AnalysisFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
