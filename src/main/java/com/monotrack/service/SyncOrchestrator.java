package com.monotrack.service;

import com.monotrack.dto.SyncResult;
import com.monotrack.dto.SyncSummary;
import com.monotrack.dto.UserSyncResult;
import com.monotrack.model.BankAccount;
import com.monotrack.provider.BankingClient;
import com.monotrack.provider.BankingProviderException;
import com.monotrack.provider.ProviderAccount;
import com.monotrack.store.AccountStore;
import com.monotrack.store.StoreWriteException;
import com.monotrack.store.SyncUser;
import com.monotrack.store.UserDirectory;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class SyncOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(SyncOrchestrator.class);

  private final UserDirectory userDirectory;
  private final BankingClient bankingClient;
  private final CanonicalMapper mapper;
  private final AccountStore accountStore;
  private final TransactionSyncEngine transactionSyncEngine;
  private final RequestThrottle throttle;
  private final RetryPolicy providerRetry;
  private final RetryPolicy storeRetry;
  private final Sleeper sleeper;
  private final Clock clock;
  private final ExecutorService syncExecutor;

  public SyncOrchestrator(UserDirectory userDirectory,
                          BankingClient bankingClient,
                          CanonicalMapper mapper,
                          AccountStore accountStore,
                          TransactionSyncEngine transactionSyncEngine,
                          RequestThrottle throttle,
                          @Qualifier("providerRetryPolicy") RetryPolicy providerRetry,
                          @Qualifier("storeRetryPolicy") RetryPolicy storeRetry,
                          Sleeper sleeper,
                          Clock clock,
                          @Qualifier("syncExecutor") ExecutorService syncExecutor) {
    this.userDirectory = userDirectory;
    this.bankingClient = bankingClient;
    this.mapper = mapper;
    this.accountStore = accountStore;
    this.transactionSyncEngine = transactionSyncEngine;
    this.throttle = throttle;
    this.providerRetry = providerRetry;
    this.storeRetry = storeRetry;
    this.sleeper = sleeper;
    this.clock = clock;
    this.syncExecutor = syncExecutor;
  }

  /**
   * Syncs accounts and transactions for every active user. Users are read once up front and each
   * one is processed as an independent task; a failing user only shows up in the summary. Only a
   * failure to list users escapes.
   */
  public SyncSummary runAccountSync() {
    List<SyncUser> users = userDirectory.listActiveUsers();
    log.info("Starting account sync for {} active users", users.size());
    List<CompletableFuture<UserSyncResult>> tasks = users.stream()
        .map(user -> CompletableFuture.supplyAsync(() -> syncUserSafely(user), syncExecutor))
        .toList();
    List<UserSyncResult> results = tasks.stream().map(CompletableFuture::join).toList();
    SyncSummary summary = SyncSummary.of(results);
    log.info("Account sync finished: {} users ok, {} failed, {} accounts, {} transactions",
        summary.getProcessedUsers(), summary.getFailedUsers(),
        summary.getTotalAccountsSynced(), summary.getTotalTransactionsSynced());
    return summary;
  }

  public UserSyncResult syncUser(String userId) {
    SyncUser user = userDirectory.findUser(userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found"));
    if (!user.active()) {
      return UserSyncResult.failed(userId, "USER_INACTIVE", "User is not active");
    }
    return syncUserSafely(user);
  }

  /**
   * Transaction sync only, over the accounts already stored for the user.
   */
  public UserSyncResult syncUserTransactions(String userId) {
    SyncUser user = userDirectory.findUser(userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found"));
    if (!user.hasCredential()) {
      return UserSyncResult.failed(userId, "CREDENTIAL_ERROR", "Missing Monobank token");
    }
    List<BankAccount> accounts;
    try {
      accounts = accountStore.findAll(userId);
    } catch (RuntimeException ex) {
      log.error("Failed to load accounts for user {}", userId, ex);
      return UserSyncResult.failed(userId, "STORE_READ_FAILED", ex.getMessage());
    }
    return UserSyncResult.completed(userId, accounts.size(), syncAccounts(user, accounts));
  }

  private UserSyncResult syncUserSafely(SyncUser user) {
    String userId = user.id();
    if (!user.hasCredential()) {
      log.warn("Skipping user {}: no Monobank token", userId);
      return UserSyncResult.failed(userId, "CREDENTIAL_ERROR", "Missing Monobank token");
    }
    try {
      List<BankAccount> accounts = syncAccountList(user);
      return UserSyncResult.completed(userId, accounts.size(), syncAccounts(user, accounts));
    } catch (BankingProviderException ex) {
      log.warn("Account sync failed for user {}: {}", userId, ex.getMessage());
      return UserSyncResult.failed(userId, ex.getCode(), ex.getMessage());
    } catch (StoreWriteException ex) {
      log.error("Failed to store accounts for user {}: {}", userId, ex.getMessage());
      return UserSyncResult.failed(userId, "STORE_WRITE_FAILED", ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Unexpected failure syncing user {}", userId, ex);
      return UserSyncResult.failed(userId, "UNEXPECTED_ERROR", ex.getMessage());
    }
  }

  private List<BankAccount> syncAccountList(SyncUser user) {
    String userId = user.id();
    List<ProviderAccount> provided = providerRetry.execute(
        "Client info for user " + userId,
        () -> {
          throttle.acquire(user.credential());
          return bankingClient.listAccounts(user.credential());
        },
        ex -> ex instanceof BankingProviderException && ((BankingProviderException) ex).isRetryable(),
        sleeper);
    if (provided.isEmpty()) {
      log.info("No accounts returned for user {}", userId);
      return List.of();
    }

    Map<String, BankAccount> existing = accountStore.findAll(userId).stream()
        .collect(Collectors.toMap(BankAccount::getId, Function.identity()));
    Instant syncedAt = clock.instant();
    List<BankAccount> merged = new ArrayList<>(provided.size());
    for (ProviderAccount source : provided) {
      BankAccount account = mapper.mapAccount(userId, source, Optional.ofNullable(existing.get(source.id())));
      account.setLastSyncedAt(syncedAt);
      merged.add(account);
    }
    storeRetry.execute("Upsert accounts for user " + userId,
        () -> {
          accountStore.upsertAll(userId, merged);
          return merged.size();
        },
        ex -> ex instanceof StoreWriteException,
        sleeper);
    log.info("Stored {} accounts for user {}", merged.size(), userId);
    return merged;
  }

  private List<SyncResult> syncAccounts(SyncUser user, List<BankAccount> accounts) {
    List<SyncResult> results = new ArrayList<>(accounts.size());
    for (BankAccount account : accounts) {
      try {
        results.add(transactionSyncEngine.syncAccountTransactions(user, account));
      } catch (RuntimeException ex) {
        log.error("Unexpected failure syncing account {} for user {}", account.getId(), user.id(), ex);
        results.add(SyncResult.failed(account.getId(), 0, 0, 0, null, null, "UNEXPECTED_ERROR", ex.getMessage()));
      }
    }
    return results;
  }
}
