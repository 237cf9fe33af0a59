package com.culprit.ingest.controller;

import com.culprit.ingest.dto.ApiError;
import com.culprit.ingest.service.IncidentAlreadyExistsException;
import com.culprit.ingest.service.IncidentNotFoundException;
import com.culprit.ingest.service.InvalidPayloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(IncidentNotFoundException.class)
  public ResponseEntity<ApiError> notFound(IncidentNotFoundException e) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ApiError("Incident not found"));
  }

  @ExceptionHandler(IncidentAlreadyExistsException.class)
  public ResponseEntity<ApiError> conflict(IncidentAlreadyExistsException e) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(new ApiError(e.getMessage()));
  }

  @ExceptionHandler(InvalidPayloadException.class)
  public ResponseEntity<ApiError> invalid(InvalidPayloadException e) {
    return ResponseEntity.badRequest().body(new ApiError(e.getMessage()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> unreadable(HttpMessageNotReadableException e) {
    return ResponseEntity.badRequest().body(new ApiError("Malformed request body"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiError> unexpected(RuntimeException e) {
    log.error("Unexpected failure: {}", e.getMessage(), e);
    String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ApiError(msg));
  }
}
