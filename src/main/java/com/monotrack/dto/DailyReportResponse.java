package com.monotrack.dto;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.Setter;

@Getter
@AllArgsConstructor
public class DailyReportResponse {
  private String userId;
  private String date;
  private String timezone;
  private ReportTotals totals;
  private List<SpendCoverage> spends;
  private List<EarnUsage> earns;
  @Setter
  private String reportText;
}
