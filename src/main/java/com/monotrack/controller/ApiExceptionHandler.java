package com.monotrack.controller;

import com.monotrack.dto.ErrorResponse;
import com.monotrack.service.ReportUnavailableException;
import com.monotrack.store.UserDirectoryUnavailableException;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(UserDirectoryUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleDirectoryUnavailable(UserDirectoryUnavailableException ex) {
    log.error("User directory unavailable: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse(ex.getMessage(), "USER_DIRECTORY_UNAVAILABLE"));
  }

  @ExceptionHandler(ReportUnavailableException.class)
  public ResponseEntity<ErrorResponse> handleReportUnavailable(ReportUnavailableException ex) {
    log.error("Report unavailable: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ErrorResponse(ex.getMessage(), "REPORT_UNAVAILABLE"));
  }

  @ExceptionHandler(ConstraintViolationException.class)
  public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ErrorResponse(ex.getMessage(), "INVALID_REQUEST"));
  }
}
