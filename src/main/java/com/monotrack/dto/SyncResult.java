package com.monotrack.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Outcome of one account's transaction sync.
 */
@Getter
@AllArgsConstructor
public class SyncResult {
  private String accountId;
  private boolean success;
  private int fetched;
  private int imported;
  private int updated;
  private Long watermarkBefore;
  private Long watermarkAfter;
  private String errorCode;
  private String error;

  public static SyncResult succeeded(String accountId, int fetched, int imported, int updated,
                                     Long watermarkBefore, Long watermarkAfter) {
    return new SyncResult(accountId, true, fetched, imported, updated, watermarkBefore, watermarkAfter, null, null);
  }

  public static SyncResult failed(String accountId, int fetched, int imported, int updated,
                                  Long watermarkBefore, Long watermarkAfter,
                                  String errorCode, String error) {
    return new SyncResult(accountId, false, fetched, imported, updated, watermarkBefore, watermarkAfter,
        errorCode, error);
  }

  public int getSynced() {
    return imported + updated;
  }
}
