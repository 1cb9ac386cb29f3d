package com.monotrack.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class UserSyncResult {
  private String userId;
  private boolean success;
  private int accountsSynced;
  private List<SyncResult> accounts;
  private String errorCode;
  private String error;

  public static UserSyncResult completed(String userId, int accountsSynced, List<SyncResult> accounts) {
    long failed = accounts.stream().filter(result -> !result.isSuccess()).count();
    if (failed == 0) {
      return new UserSyncResult(userId, true, accountsSynced, accounts, null, null);
    }
    return new UserSyncResult(userId, false, accountsSynced, accounts, "ACCOUNT_SYNC_FAILED",
        failed + " of " + accounts.size() + " account(s) failed to sync");
  }

  public static UserSyncResult failed(String userId, String errorCode, String error) {
    return new UserSyncResult(userId, false, 0, List.of(), errorCode, error);
  }

  public int getTransactionsSynced() {
    return accounts.stream().mapToInt(SyncResult::getSynced).sum();
  }
}
