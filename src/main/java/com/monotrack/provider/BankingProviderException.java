package com.monotrack.provider;

public class BankingProviderException extends RuntimeException {
  private final String code;
  private final boolean retryable;

  public BankingProviderException(String message) {
    this("PROVIDER_ERROR", message, false, null);
  }

  public BankingProviderException(String message, Throwable cause) {
    this("PROVIDER_ERROR", message, false, cause);
  }

  protected BankingProviderException(String code, String message, boolean retryable, Throwable cause) {
    super(message, cause);
    this.code = code;
    this.retryable = retryable;
  }

  public String getCode() {
    return code;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
