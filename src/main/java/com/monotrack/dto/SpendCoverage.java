package com.monotrack.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * How much of one spend was paid for by income, and from which earn transactions.
 * Amounts are positive minor units.
 */
@Getter
@AllArgsConstructor
public class SpendCoverage {
  public static final String REASON_INSUFFICIENT_INCOME = "insufficient_income";

  private String txId;
  private String accountId;
  private long time;
  private String description;
  private long amount;
  private boolean covered;
  private long coveredAmount;
  private long uncoveredAmount;
  private List<CoverageSource> sources;
  private String reason;
}
