package com.monotrack.service;

import com.monotrack.config.ReportProperties;
import com.monotrack.dto.CoverageSource;
import com.monotrack.dto.DailyReportResponse;
import com.monotrack.dto.EarnUsage;
import com.monotrack.dto.SpendCoverage;
import java.math.BigDecimal;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class MarkdownReportRenderer implements ReportRenderer {
  private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("HH:mm");
  private static final String NO_DESCRIPTION = "(no description)";

  private final ReportProperties properties;

  public MarkdownReportRenderer(ReportProperties properties) {
    this.properties = properties;
  }

  @Override
  public String render(DailyReportResponse report) {
    ZoneId zone = zoneOf(report.getTimezone());
    Map<String, EarnUsage> earnsById = new HashMap<>();
    for (EarnUsage earn : report.getEarns()) {
      earnsById.put(earn.getTxId(), earn);
    }

    List<String> lines = new ArrayList<>();
    lines.add("## Daily transactions report — " + report.getDate() + " (" + report.getTimezone() + ")");
    lines.add("");
    lines.add("- **Total spends**: " + money(report.getTotals().getSpendTotal()));
    lines.add("- **Total earnings**: " + money(report.getTotals().getEarnTotal()));
    lines.add("- **Net**: " + money(report.getTotals().getNet()));
    lines.add("");

    lines.add("### Spends (" + report.getSpends().size() + ")");
    lines.add("");
    for (SpendCoverage spend : report.getSpends()) {
      String icon = spend.isCovered() ? "✅" : "❌";
      lines.add("- " + icon + " **" + money(spend.getAmount()) + "** — " + label(spend.getDescription())
          + " (" + time(spend.getTime(), zone) + ")");
      if (!spend.getSources().isEmpty()) {
        List<String> parts = new ArrayList<>();
        for (CoverageSource source : spend.getSources()) {
          EarnUsage earn = earnsById.get(source.getTxId());
          String sourceLabel = earn == null || earn.getDescription() == null || earn.getDescription().isBlank()
              ? source.getTxId()
              : earn.getDescription();
          parts.add(money(source.getAmount()) + " from `" + source.getTxId() + "` (" + sourceLabel + ")");
        }
        lines.add("  - Covered by: " + String.join("; ", parts));
      }
      if (!spend.isCovered()) {
        lines.add("  - Uncovered: **" + money(spend.getUncoveredAmount()) + "**");
      }
    }

    lines.add("");
    lines.add("### Earnings (" + report.getEarns().size() + ")");
    lines.add("");
    for (EarnUsage earn : report.getEarns()) {
      lines.add("- 💰 **" + money(earn.getAmount()) + "** — " + label(earn.getDescription())
          + " (" + time(earn.getTime(), zone) + ")"
          + (earn.getRemaining() > 0 ? ", unused " + money(earn.getRemaining()) : ""));
    }

    lines.add("");
    lines.add("### Notes");
    lines.add("");
    lines.add("- Coverage is computed across **all accounts** (cards + jars) for the selected day.");
    lines.add("- Income is allocated to spends in time order; holds are not counted.");
    lines.add("");
    return String.join("\n", lines);
  }

  private String money(long minorUnits) {
    String currency = properties.displayCurrency() == null ? "UAH" : properties.displayCurrency();
    return BigDecimal.valueOf(minorUnits, 2).toPlainString() + " " + currency;
  }

  private static String label(String description) {
    return description == null || description.isBlank() ? NO_DESCRIPTION : description;
  }

  private static String time(long epochSeconds, ZoneId zone) {
    return TIME_FORMAT.format(Instant.ofEpochSecond(epochSeconds).atZone(zone));
  }

  private static ZoneId zoneOf(String timezone) {
    if (timezone == null) {
      return ZoneOffset.UTC;
    }
    try {
      return ZoneId.of(timezone);
    } catch (DateTimeException ex) {
      return ZoneOffset.UTC;
    }
  }
}
