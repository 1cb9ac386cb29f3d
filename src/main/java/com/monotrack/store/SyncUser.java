package com.monotrack.store;

/**
 * The slice of a user record the sync and report paths read.
 */
public record SyncUser(String id, boolean active, String credential) {
  public boolean hasCredential() {
    return credential != null && !credential.isBlank();
  }
}
