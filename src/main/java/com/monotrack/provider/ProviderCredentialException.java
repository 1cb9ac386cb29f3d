package com.monotrack.provider;

public class ProviderCredentialException extends BankingProviderException {
  public ProviderCredentialException(String message) {
    super("CREDENTIAL_ERROR", message, false, null);
  }

  public ProviderCredentialException(String message, Throwable cause) {
    super("CREDENTIAL_ERROR", message, false, cause);
  }
}
