package com.monotrack.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CoverageSource {
  private String txId;
  private long amount;
}
