package com.monotrack.service;

import com.monotrack.config.ReportProperties;
import com.monotrack.dto.DailyReportResponse;
import com.monotrack.model.BankTransaction;
import com.monotrack.store.TransactionStore;
import com.monotrack.store.UserDirectory;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

@Service
public class DailyReportService {
  private static final Logger log = LoggerFactory.getLogger(DailyReportService.class);
  private static final String FALLBACK_TIMEZONE = "Europe/Kyiv";

  private final UserDirectory userDirectory;
  private final TransactionStore transactionStore;
  private final CoverageEngine coverageEngine;
  private final ReportRenderer renderer;
  private final ReportProperties properties;
  private final Clock clock;

  public DailyReportService(UserDirectory userDirectory,
                            TransactionStore transactionStore,
                            CoverageEngine coverageEngine,
                            ReportRenderer renderer,
                            ReportProperties properties,
                            Clock clock) {
    this.userDirectory = userDirectory;
    this.transactionStore = transactionStore;
    this.coverageEngine = coverageEngine;
    this.renderer = renderer;
    this.properties = properties;
    this.clock = clock;
  }

  public DailyReportResponse dailyReport(String userId, String date, String timezone, boolean render) {
    if (userDirectory.findUser(userId).isEmpty()) {
      throw new ResponseStatusException(HttpStatus.NOT_FOUND, "User not found");
    }
    String zoneName = timezone == null || timezone.isBlank() ? defaultTimezone() : timezone;
    ZoneId zone = resolveZone(zoneName);
    LocalDate day = parseDate(date, zone);

    DailyReportResponse report = computeDailyCoverage(userId, day, zone);
    if (render) {
      try {
        report.setReportText(renderer.render(report));
      } catch (RuntimeException ex) {
        log.warn("Report rendering failed for user {} on {}: {}", userId, report.getDate(), ex.getMessage());
      }
    }
    return report;
  }

  /**
   * Coverage for the calendar day {@code date} in {@code zone}. Nothing is stored; the same
   * transactions always give the same report.
   */
  public DailyReportResponse computeDailyCoverage(String userId, LocalDate date, ZoneId zone) {
    long from = date.atStartOfDay(zone).toEpochSecond();
    long to = date.plusDays(1).atStartOfDay(zone).toEpochSecond();
    List<BankTransaction> transactions;
    try {
      transactions = transactionStore.findByUserAndTimeRange(userId, from, to);
    } catch (RuntimeException ex) {
      throw new ReportUnavailableException("Could not read transactions for user " + userId, ex);
    }
    CoverageResult coverage = coverageEngine.compute(transactions);
    return new DailyReportResponse(
        userId,
        date.toString(),
        zone.getId(),
        coverage.totals(),
        coverage.spends(),
        coverage.earns(),
        null);
  }

  private String defaultTimezone() {
    String configured = properties.defaultTimezone();
    return configured == null || configured.isBlank() ? FALLBACK_TIMEZONE : configured;
  }

  private ZoneId resolveZone(String zoneName) {
    try {
      return ZoneId.of(zoneName);
    } catch (DateTimeException ex) {
      log.warn("Unknown timezone {}, using UTC", zoneName);
      return ZoneId.of("UTC");
    }
  }

  private LocalDate parseDate(String date, ZoneId zone) {
    if (date == null || date.isBlank()) {
      return LocalDate.now(clock.withZone(zone));
    }
    try {
      return LocalDate.parse(date);
    } catch (DateTimeParseException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid date format, expected YYYY-MM-DD");
    }
  }
}
