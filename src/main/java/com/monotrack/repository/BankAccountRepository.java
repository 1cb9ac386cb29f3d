package com.monotrack.repository;

import com.monotrack.model.AccountKey;
import com.monotrack.model.BankAccount;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BankAccountRepository extends JpaRepository<BankAccount, AccountKey> {
  List<BankAccount> findByUserIdOrderByIdAsc(String userId);
}
