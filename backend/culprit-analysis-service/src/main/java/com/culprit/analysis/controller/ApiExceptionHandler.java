package com.culprit.analysis.controller;

import com.culprit.analysis.model.ApiError;
import com.culprit.analysis.service.AnalysisFailedException;
import com.culprit.analysis.service.AnalysisTimeoutException;
import com.culprit.analysis.service.IncidentNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(IncidentNotFoundException.class)
  public ResponseEntity<ApiError> notFound(IncidentNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("Incident not found"));
  }

  @ExceptionHandler(AnalysisTimeoutException.class)
  public ResponseEntity<ApiError> timeout(AnalysisTimeoutException e) {
    return ResponseEntity.status(HttpStatus.GATEWAY_TIMEOUT).body(new ApiError(e.getMessage()));
  }

  @ExceptionHandler(AnalysisFailedException.class)
  public ResponseEntity<ApiError> failed(AnalysisFailedException e) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiError(e.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiError> unexpected(RuntimeException e) {
    log.error("Unexpected failure: {}", e.getMessage(), e);
    String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiError(msg));
  }
}
