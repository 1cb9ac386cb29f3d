package com.monotrack.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "sync_watermarks")
@IdClass(WatermarkKey.class)
@Getter
@Setter
public class SyncWatermark {
  @Id
  @Column(name = "user_id", length = 128)
  private String userId;

  @Id
  @Column(name = "account_id", length = 128)
  private String accountId;

  @Column(nullable = false)
  private long lastSyncedTime;

  @Column(nullable = false)
  private Instant updatedAt;

  @PrePersist
  @PreUpdate
  void touch() {
    updatedAt = Instant.now();
  }
}
