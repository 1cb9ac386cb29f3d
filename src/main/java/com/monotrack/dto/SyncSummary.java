package com.monotrack.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class SyncSummary {
  public static final String STATUS_SUCCESS = "success";
  public static final String STATUS_COMPLETED_WITH_ERRORS = "completed_with_errors";

  private String status;
  private int processedUsers;
  private int failedUsers;
  private int totalAccountsSynced;
  private int failedAccounts;
  private int totalTransactionsSynced;
  private List<UserSyncResult> users;

  public static SyncSummary of(List<UserSyncResult> users) {
    int processed = 0;
    int failed = 0;
    int accounts = 0;
    int failedAccounts = 0;
    int transactions = 0;
    for (UserSyncResult user : users) {
      if (user.isSuccess()) {
        processed++;
      } else {
        failed++;
      }
      accounts += user.getAccountsSynced();
      failedAccounts += (int) user.getAccounts().stream().filter(result -> !result.isSuccess()).count();
      transactions += user.getTransactionsSynced();
    }
    String status = failed == 0 ? STATUS_SUCCESS : STATUS_COMPLETED_WITH_ERRORS;
    return new SyncSummary(status, processed, failed, accounts, failedAccounts, transactions, users);
  }
}
