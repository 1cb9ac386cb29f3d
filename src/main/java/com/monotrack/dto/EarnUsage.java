package com.monotrack.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class EarnUsage {
  private String txId;
  private String accountId;
  private long time;
  private String description;
  private long amount;
  private long allocated;
  private long remaining;
}
