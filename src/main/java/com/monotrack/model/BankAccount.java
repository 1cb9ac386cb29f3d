package com.monotrack.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

/**
 * A Monobank card or jar mirrored for one user.
 *
 * <p>{@code budget} and {@code invested} belong to the application. Sync never overwrites them;
 * see {@link com.monotrack.service.CanonicalMapper}.
 */
@Entity
@Table(name = "accounts")
@IdClass(AccountKey.class)
@Getter
@Setter
public class BankAccount {
  @Id
  @Column(name = "user_id", length = 128)
  private String userId;

  @Id
  @Column(length = 128)
  private String id;

  @Enumerated(EnumType.STRING)
  @Column(name = "account_type", nullable = false, length = 16)
  private AccountType type;

  @Column
  private String sendId;

  @Embedded
  private CurrencyInfo currency;

  @Column(nullable = false)
  private long balance;

  @Column
  private Long creditLimit;

  @Column(nullable = false)
  private boolean active;

  @Column
  private String title;

  @Column(columnDefinition = "text")
  private String description;

  @Column
  private Long goal;

  @Column(length = 64)
  private String maskedPan;

  @Column(length = 64)
  private String iban;

  @Column(length = 32)
  private String cashbackType;

  @Column(nullable = false)
  private boolean budget;

  @Column(nullable = false)
  private long invested;

  @Column
  private Instant lastSyncedAt;

  @Column(nullable = false)
  private Instant createdAt;

  @PrePersist
  void prePersist() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
