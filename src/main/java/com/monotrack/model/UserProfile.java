package com.monotrack.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "users")
@Getter
@Setter
public class UserProfile {
  @Id
  @Column(length = 128)
  private String id;

  @Column
  private String username;

  @Column(nullable = false)
  private boolean active;

  @Column(length = 512)
  private String monoToken;

  @Column(nullable = false)
  private boolean dailyReport;

  @Column
  private Long telegramId;

  @ElementCollection
  @CollectionTable(name = "user_family_members", joinColumns = @JoinColumn(name = "user_id"))
  @Column(name = "member_id", length = 128)
  private List<String> familyMembers = new ArrayList<>();

  @Column(nullable = false)
  private Instant createdAt;

  @PrePersist
  void prePersist() {
    if (createdAt == null) {
      createdAt = Instant.now();
    }
  }
}
