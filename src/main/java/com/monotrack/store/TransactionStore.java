package com.monotrack.store;

import com.monotrack.model.BankTransaction;
import java.util.Collection;
import java.util.List;
import java.util.Set;

public interface TransactionStore {
  /**
   * The subset of {@code ids} already stored for the account.
   */
  Set<String> findExistingIds(String userId, String accountId, Collection<String> ids);

  /**
   * Idempotent batch write keyed by {@code (userId, accountId, id)}. The whole batch is applied
   * or none of it is.
   */
  UpsertResult upsertAll(String userId, String accountId, List<BankTransaction> transactions);

  /**
   * All of a user's transactions, across accounts, with {@code from <= time < toExclusive},
   * ordered by time then id.
   */
  List<BankTransaction> findByUserAndTimeRange(String userId, long from, long toExclusive);

  record UpsertResult(int inserted, int updated) {}
}
