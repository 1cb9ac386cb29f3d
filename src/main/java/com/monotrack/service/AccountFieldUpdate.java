package com.monotrack.service;

/**
 * Explicit new values for the app-owned account fields. A null component keeps the stored value.
 */
public record AccountFieldUpdate(Boolean budget, Long invested) {
  public static AccountFieldUpdate none() {
    return new AccountFieldUpdate(null, null);
  }
}
