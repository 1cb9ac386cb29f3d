package com.monotrack.controller;

import com.monotrack.dto.SyncSummary;
import com.monotrack.dto.UserSyncResult;
import com.monotrack.service.SyncOrchestrator;
import java.util.List;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sync")
public class SyncController {
  private final SyncOrchestrator syncOrchestrator;

  public SyncController(SyncOrchestrator syncOrchestrator) {
    this.syncOrchestrator = syncOrchestrator;
  }

  @PostMapping("/accounts")
  public SyncSummary syncAccounts(@RequestParam(value = "userId", required = false) String userId) {
    if (userId == null || userId.isBlank()) {
      return syncOrchestrator.runAccountSync();
    }
    return SyncSummary.of(List.of(syncOrchestrator.syncUser(userId)));
  }

  @PostMapping("/users/{userId}/transactions")
  public UserSyncResult syncTransactions(@PathVariable String userId) {
    return syncOrchestrator.syncUserTransactions(userId);
  }
}
