package com.monotrack.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.monotrack.config.ReportProperties;
import com.monotrack.dto.CoverageSource;
import com.monotrack.dto.DailyReportResponse;
import com.monotrack.dto.EarnUsage;
import com.monotrack.dto.ReportTotals;
import com.monotrack.dto.SpendCoverage;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MarkdownReportRenderer")
class MarkdownReportRendererTest {
  private final MarkdownReportRenderer renderer = new MarkdownReportRenderer(new ReportProperties("UTC", "UAH"));

  @Test
  @DisplayName("Renders totals, coverage sources and uncovered remainders")
  void rendersReport() {
    long nine = Instant.parse("2024-05-01T09:00:00Z").getEpochSecond();
    long noon = Instant.parse("2024-05-01T12:00:00Z").getEpochSecond();
    DailyReportResponse report = new DailyReportResponse(
        "u1",
        "2024-05-01",
        "UTC",
        new ReportTotals(40_000, 25_050, -14_950),
        List.of(new SpendCoverage("S1", "card", noon, "Groceries", 40_000, false, 25_050, 14_950,
            List.of(new CoverageSource("E1", 25_050)), SpendCoverage.REASON_INSUFFICIENT_INCOME)),
        List.of(new EarnUsage("E1", "jar", nine, "Salary", 25_050, 25_050, 0)),
        null);

    String text = renderer.render(report);

    assertThat(text).startsWith("## Daily transactions report");
    assertThat(text).contains("- **Total spends**: 400.00 UAH");
    assertThat(text).contains("- **Net**: -149.50 UAH");
    assertThat(text).contains("❌ **400.00 UAH** — Groceries (12:00)");
    assertThat(text).contains("Covered by: 250.50 UAH from `E1` (Salary)");
    assertThat(text).contains("Uncovered: **149.50 UAH**");
    assertThat(text).contains("💰 **250.50 UAH** — Salary (09:00)");
  }

  @Test
  @DisplayName("Empty day still renders headings")
  void emptyDay() {
    DailyReportResponse report = new DailyReportResponse("u1", "2024-05-01", "Europe/Kyiv",
        new ReportTotals(0, 0, 0), List.of(), List.of(), null);

    String text = renderer.render(report);

    assertThat(text).contains("### Spends (0)").contains("### Earnings (0)").contains("0.00 UAH");
  }
}
