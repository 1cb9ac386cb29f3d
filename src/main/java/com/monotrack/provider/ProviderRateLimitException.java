package com.monotrack.provider;

public class ProviderRateLimitException extends BankingProviderException {
  public ProviderRateLimitException(String message, Throwable cause) {
    super("RATE_LIMITED", message, true, cause);
  }
}
