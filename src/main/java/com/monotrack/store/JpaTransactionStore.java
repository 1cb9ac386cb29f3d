package com.monotrack.store;

import com.monotrack.model.BankTransaction;
import com.monotrack.repository.BankTransactionRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaTransactionStore implements TransactionStore {
  private final BankTransactionRepository transactionRepository;
  private final Clock clock;

  public JpaTransactionStore(BankTransactionRepository transactionRepository, Clock clock) {
    this.transactionRepository = transactionRepository;
    this.clock = clock;
  }

  @Override
  @Transactional(readOnly = true)
  public Set<String> findExistingIds(String userId, String accountId, Collection<String> ids) {
    if (ids.isEmpty()) {
      return Set.of();
    }
    return new HashSet<>(transactionRepository.findExistingIds(userId, accountId, ids));
  }

  @Override
  @Transactional
  public UpsertResult upsertAll(String userId, String accountId, List<BankTransaction> transactions) {
    if (transactions.isEmpty()) {
      return new UpsertResult(0, 0);
    }
    Set<String> ids = new HashSet<>();
    for (BankTransaction tx : transactions) {
      if (!userId.equals(tx.getUserId()) || !accountId.equals(tx.getAccountId())) {
        throw new IllegalArgumentException("Transaction " + tx.getId() + " is outside " + userId + "/" + accountId);
      }
      ids.add(tx.getId());
    }
    try {
      Set<String> existing = findExistingIds(userId, accountId, ids);
      Instant now = clock.instant();
      transactions.forEach(tx -> tx.setSyncedAt(now));
      transactionRepository.saveAllAndFlush(transactions);
      int updated = existing.size();
      return new UpsertResult(ids.size() - updated, updated);
    } catch (DataAccessException ex) {
      throw new StoreWriteException("Failed to upsert " + transactions.size()
          + " transactions for account " + accountId, ex);
    }
  }

  @Override
  @Transactional(readOnly = true)
  public List<BankTransaction> findByUserAndTimeRange(String userId, long from, long toExclusive) {
    return transactionRepository.findUserTransactionsInRange(userId, from, toExclusive);
  }
}
