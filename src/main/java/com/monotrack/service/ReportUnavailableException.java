package com.monotrack.service;

public class ReportUnavailableException extends RuntimeException {
  public ReportUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
