package com.monotrack.store;

import com.monotrack.model.AccountKey;
import com.monotrack.model.BankAccount;
import com.monotrack.repository.BankAccountRepository;
import java.util.List;
import java.util.Optional;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class JpaAccountStore implements AccountStore {
  private final BankAccountRepository accountRepository;

  public JpaAccountStore(BankAccountRepository accountRepository) {
    this.accountRepository = accountRepository;
  }

  @Override
  @Transactional(readOnly = true)
  public List<BankAccount> findAll(String userId) {
    return accountRepository.findByUserIdOrderByIdAsc(userId);
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<BankAccount> find(String userId, String accountId) {
    return accountRepository.findById(new AccountKey(userId, accountId));
  }

  @Override
  @Transactional
  public void upsertAll(String userId, List<BankAccount> accounts) {
    for (BankAccount account : accounts) {
      if (!userId.equals(account.getUserId())) {
        throw new IllegalArgumentException("Account " + account.getId() + " does not belong to user " + userId);
      }
    }
    try {
      accountRepository.saveAllAndFlush(accounts);
    } catch (DataAccessException ex) {
      throw new StoreWriteException("Failed to upsert " + accounts.size() + " accounts for user " + userId, ex);
    }
  }
}
