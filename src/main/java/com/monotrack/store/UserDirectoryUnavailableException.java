package com.monotrack.store;

public class UserDirectoryUnavailableException extends RuntimeException {
  public UserDirectoryUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
