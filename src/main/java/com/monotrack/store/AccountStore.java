package com.monotrack.store;

import com.monotrack.model.BankAccount;
import java.util.List;
import java.util.Optional;

public interface AccountStore {
  List<BankAccount> findAll(String userId);

  Optional<BankAccount> find(String userId, String accountId);

  /**
   * Writes every account keyed by {@code (userId, id)}. Records are stored as given; merging with
   * the stored copy happens before this call.
   */
  void upsertAll(String userId, List<BankAccount> accounts);
}
