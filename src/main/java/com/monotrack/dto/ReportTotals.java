package com.monotrack.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class ReportTotals {
  private long spendTotal;
  private long earnTotal;
  private long net;
}
