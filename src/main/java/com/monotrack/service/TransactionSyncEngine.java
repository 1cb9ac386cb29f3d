package com.monotrack.service;

import com.monotrack.config.SyncProperties;
import com.monotrack.dto.SyncResult;
import com.monotrack.model.BankAccount;
import com.monotrack.model.BankTransaction;
import com.monotrack.model.CurrencyInfo;
import com.monotrack.provider.BankingClient;
import com.monotrack.provider.BankingProviderException;
import com.monotrack.provider.StatementItem;
import com.monotrack.store.AccountStore;
import com.monotrack.store.StoreWriteException;
import com.monotrack.store.SyncUser;
import com.monotrack.store.TransactionStore;
import com.monotrack.store.UserDirectory;
import com.monotrack.store.WatermarkStore;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

/**
 * Pulls one account's statement forward from its watermark and stores it.
 *
 * <p>The history is walked in windows no longer than the provider allows. Each non-empty window is
 * written as one batch, and only then does the watermark move to the newest item time in that
 * batch. A failure anywhere leaves the watermark at the last committed batch, so the next run
 * re-reads whatever was not stored. Each run starts {@code rereadOverlap} before the watermark so
 * that holds settled since the last run are written again with their final state.
 */
@Service
public class TransactionSyncEngine {
  private static final Logger log = LoggerFactory.getLogger(TransactionSyncEngine.class);
  private static final Comparator<BankTransaction> BY_TIME_THEN_ID =
      Comparator.comparingLong(BankTransaction::getTime).thenComparing(BankTransaction::getId);

  private final BankingClient bankingClient;
  private final CanonicalMapper mapper;
  private final UserDirectory userDirectory;
  private final AccountStore accountStore;
  private final TransactionStore transactionStore;
  private final WatermarkStore watermarkStore;
  private final RequestThrottle throttle;
  private final RetryPolicy providerRetry;
  private final RetryPolicy storeRetry;
  private final Sleeper sleeper;
  private final Clock clock;
  private final SyncProperties properties;

  public TransactionSyncEngine(BankingClient bankingClient,
                               CanonicalMapper mapper,
                               UserDirectory userDirectory,
                               AccountStore accountStore,
                               TransactionStore transactionStore,
                               WatermarkStore watermarkStore,
                               RequestThrottle throttle,
                               @Qualifier("providerRetryPolicy") RetryPolicy providerRetry,
                               @Qualifier("storeRetryPolicy") RetryPolicy storeRetry,
                               Sleeper sleeper,
                               Clock clock,
                               SyncProperties properties) {
    this.bankingClient = bankingClient;
    this.mapper = mapper;
    this.userDirectory = userDirectory;
    this.accountStore = accountStore;
    this.transactionStore = transactionStore;
    this.watermarkStore = watermarkStore;
    this.throttle = throttle;
    this.providerRetry = providerRetry;
    this.storeRetry = storeRetry;
    this.sleeper = sleeper;
    this.clock = clock;
    this.properties = properties;
  }

  public SyncResult syncAccountTransactions(String userId, String accountId) {
    SyncUser user = userDirectory.findUser(userId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found"));
    BankAccount account = accountStore.find(userId, accountId)
        .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Account not found"));
    return syncAccountTransactions(user, account);
  }

  public SyncResult syncAccountTransactions(SyncUser user, BankAccount account) {
    String userId = user.id();
    String accountId = account.getId();
    long now = clock.instant().getEpochSecond();

    Optional<Long> stored;
    try {
      stored = storeCall("read watermark " + accountId, () -> watermarkStore.getWatermark(userId, accountId));
    } catch (StoreWriteException ex) {
      log.error("Watermark read failed for user {} account {}: {}", userId, accountId, ex.getMessage());
      return SyncResult.failed(accountId, 0, 0, 0, null, null, "STORE_READ_FAILED", ex.getMessage());
    }
    Long watermarkBefore = stored.orElse(null);
    Long committed = watermarkBefore;
    long cursor = stored
        .map(watermark -> watermark - rereadOverlap().toSeconds())
        .orElseGet(() -> now - Duration.ofDays(properties.lookbackDays()).toSeconds());
    long windowSeconds = bankingClient.maxStatementWindow().toSeconds();

    int fetched = 0;
    int imported = 0;
    int updated = 0;
    try {
      while (cursor < now) {
        long windowEnd = Math.min(cursor + windowSeconds, now);
        List<StatementItem> page = fetchWindow(user, accountId, cursor, windowEnd);
        if (!page.isEmpty()) {
          List<BankTransaction> batch = toCanonical(userId, account, page);
          fetched += batch.size();
          TransactionStore.UpsertResult written = storeCall("upsert transactions " + accountId,
              () -> transactionStore.upsertAll(userId, accountId, batch));
          long newest = batch.get(batch.size() - 1).getTime();
          long next = committed == null ? newest : Math.max(committed, newest);
          storeCall("store watermark " + accountId, () -> {
            watermarkStore.setWatermark(userId, accountId, next);
            return next;
          });
          committed = next;
          imported += written.inserted();
          updated += written.updated();
          log.info("Committed {} transactions for user {} account {} ({} new), watermark {}",
              batch.size(), userId, accountId, written.inserted(), next);
        }
        cursor = windowEnd + 1;
      }
    } catch (BankingProviderException ex) {
      log.warn("Transaction sync failed for user {} account {}: {}", userId, accountId, ex.getMessage());
      return SyncResult.failed(accountId, fetched, imported, updated, watermarkBefore, committed,
          ex.getCode(), ex.getMessage());
    } catch (StoreWriteException ex) {
      log.error("Store write failed for user {} account {}: {}", userId, accountId, ex.getMessage());
      return SyncResult.failed(accountId, fetched, imported, updated, watermarkBefore, committed,
          "STORE_WRITE_FAILED", ex.getMessage());
    }
    return SyncResult.succeeded(accountId, fetched, imported, updated, watermarkBefore, committed);
  }

  /**
   * Collects every item in {@code [from, to]}. The provider answers newest first and caps each
   * response, so a full response is followed by another one ending at the oldest time seen. Items
   * sharing that second come back again and are de-duplicated; paging ends on a short response or
   * one that adds nothing new.
   */
  private List<StatementItem> fetchWindow(SyncUser user, String accountId, long from, long to) {
    int pageLimit = bankingClient.statementPageLimit();
    Map<String, StatementItem> unique = new LinkedHashMap<>();
    long upper = to;
    while (true) {
      long requestTo = upper;
      List<StatementItem> items = providerRetry.execute(
          "Statement " + accountId + " [" + from + ", " + requestTo + "]",
          () -> {
            throttle.acquire(user.credential());
            return bankingClient.listStatementItems(user.credential(), accountId, from, requestTo);
          },
          TransactionSyncEngine::isRetryableProviderError,
          sleeper);
      int added = 0;
      for (StatementItem item : items) {
        if (item.id() == null || item.id().isBlank()) {
          log.warn("Skipping statement item without id for account {}", accountId);
          continue;
        }
        if (unique.putIfAbsent(item.id(), item) == null) {
          added++;
        }
      }
      if (items.size() < pageLimit) {
        break;
      }
      if (added == 0) {
        log.debug("Paging for account {} stopped at {}: no new items", accountId, requestTo);
        break;
      }
      upper = items.stream().mapToLong(StatementItem::time).min().orElse(from);
    }
    return new ArrayList<>(unique.values());
  }

  private List<BankTransaction> toCanonical(String userId, BankAccount account, List<StatementItem> items) {
    CurrencyInfo accountCurrency = account.getCurrency();
    List<BankTransaction> batch = new ArrayList<>(items.size());
    for (StatementItem item : items) {
      batch.add(mapper.mapTransaction(userId, account.getId(), item, accountCurrency));
    }
    batch.sort(BY_TIME_THEN_ID);
    return batch;
  }

  private Duration rereadOverlap() {
    Duration overlap = properties.rereadOverlap();
    return overlap == null || overlap.isNegative() ? Duration.ZERO : overlap;
  }

  private <T> T storeCall(String operation, Supplier<T> action) {
    return storeRetry.execute(operation, () -> {
      try {
        return action.get();
      } catch (StoreWriteException ex) {
        throw ex;
      } catch (RuntimeException ex) {
        throw new StoreWriteException(operation + " failed: " + ex.getMessage(), ex);
      }
    }, ex -> ex instanceof StoreWriteException, sleeper);
  }

  private static boolean isRetryableProviderError(RuntimeException ex) {
    return ex instanceof BankingProviderException && ((BankingProviderException) ex).isRetryable();
  }
}
