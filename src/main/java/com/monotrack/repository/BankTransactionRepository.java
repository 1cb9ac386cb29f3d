package com.monotrack.repository;

import com.monotrack.model.BankTransaction;
import com.monotrack.model.TransactionKey;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface BankTransactionRepository extends JpaRepository<BankTransaction, TransactionKey> {
  @Query("select t.id from BankTransaction t " +
      "where t.userId = :userId and t.accountId = :accountId and t.id in :ids")
  List<String> findExistingIds(
      @Param("userId") String userId,
      @Param("accountId") String accountId,
      @Param("ids") Collection<String> ids);

  @Query("select t from BankTransaction t " +
      "where t.userId = :userId and t.time >= :from and t.time < :to " +
      "order by t.time asc, t.id asc")
  List<BankTransaction> findUserTransactionsInRange(
      @Param("userId") String userId,
      @Param("from") long from,
      @Param("to") long to);
}
