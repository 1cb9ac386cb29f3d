package com.monotrack.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "transactions", indexes = @Index(name = "idx_transactions_user_time", columnList = "user_id, tx_time"))
@IdClass(TransactionKey.class)
@Getter
@Setter
public class BankTransaction {
  private static final int DEFAULT_VARCHAR_LIMIT = 255;

  @Id
  @Column(name = "user_id", length = 128)
  private String userId;

  @Id
  @Column(name = "account_id", length = 128)
  private String accountId;

  @Id
  @Column(length = 128)
  private String id;

  @Column(name = "tx_time", nullable = false)
  private long time;

  @Column
  private String description;

  @Column(nullable = false)
  private long amount;

  @Column
  private Long operationAmount;

  @Column(nullable = false)
  private long balance;

  @Column
  private Long commissionRate;

  @Column
  private Long cashbackAmount;

  @Column(nullable = false)
  private boolean hold;

  @Column(name = "comment_text")
  private String comment;

  @Column
  private Integer mcc;

  @Column
  private Integer originalMcc;

  @Embedded
  private CurrencyInfo currency;

  @Column
  private Instant syncedAt;

  public boolean isSpend() {
    return amount < 0;
  }

  public boolean isEarn() {
    return amount > 0;
  }

  @PrePersist
  @PreUpdate
  void normalizeLengths() {
    description = truncate(description, DEFAULT_VARCHAR_LIMIT);
    comment = truncate(comment, DEFAULT_VARCHAR_LIMIT);
  }

  private static String truncate(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max);
  }
}
