package com.monotrack.provider;

/**
 * Timeouts, connection failures and 5xx answers from the provider.
 */
public class ProviderUnavailableException extends BankingProviderException {
  public ProviderUnavailableException(String message, Throwable cause) {
    super("PROVIDER_UNAVAILABLE", message, true, cause);
  }
}
