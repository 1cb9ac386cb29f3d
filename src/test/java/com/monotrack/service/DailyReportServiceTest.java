package com.monotrack.service;

import static com.monotrack.support.TestData.tx;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.monotrack.config.ReportProperties;
import com.monotrack.dto.DailyReportResponse;
import com.monotrack.dto.SpendCoverage;
import com.monotrack.store.SyncUser;
import com.monotrack.store.TransactionStore;
import com.monotrack.support.InMemoryTransactionStore;
import com.monotrack.support.InMemoryUserDirectory;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

@ExtendWith(MockitoExtension.class)
@DisplayName("DailyReportService")
class DailyReportServiceTest {
  private static final long KYIV_DAY_START = Instant.parse("2024-04-30T21:00:00Z").getEpochSecond();

  @Mock
  private ReportRenderer renderer;

  private final Clock clock = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
  private InMemoryUserDirectory users;
  private InMemoryTransactionStore transactions;
  private DailyReportService service;

  @BeforeEach
  void setUp() {
    users = new InMemoryUserDirectory().add(new SyncUser("u1", true, "token-1"));
    transactions = new InMemoryTransactionStore();
    service = new DailyReportService(users, transactions, new CoverageEngine(), renderer,
        new ReportProperties("Europe/Kyiv", "UAH"), clock);
  }

  @Test
  @DisplayName("Report covers exactly the local calendar day across all accounts")
  void coversLocalDay() {
    transactions.upsertAll("u1", "card", List.of(
        tx("u1", "card", "before", KYIV_DAY_START - 1, 90_000),
        tx("u1", "card", "S1", KYIV_DAY_START + 3_600, -30_000)));
    transactions.upsertAll("u1", "jar", List.of(
        tx("u1", "jar", "E1", KYIV_DAY_START + 60, 50_000),
        tx("u1", "jar", "after", KYIV_DAY_START + 86_400, -1_000)));
    when(renderer.render(any())).thenReturn("text");

    DailyReportResponse report = service.dailyReport("u1", "2024-05-01", null, true);

    assertThat(report.getTimezone()).isEqualTo("Europe/Kyiv");
    assertThat(report.getSpends()).extracting(SpendCoverage::getTxId).containsExactly("S1");
    assertThat(report.getSpends().get(0).isCovered()).isTrue();
    assertThat(report.getTotals().getEarnTotal()).isEqualTo(50_000);
    assertThat(report.getTotals().getNet()).isEqualTo(20_000);
    assertThat(report.getReportText()).isEqualTo("text");
  }

  @Test
  @DisplayName("Renderer failure still returns the structured report")
  void rendererFailureIsNotFatal() {
    transactions.upsertAll("u1", "card", List.of(tx("u1", "card", "S1", KYIV_DAY_START + 10, -500)));
    when(renderer.render(any())).thenThrow(new IllegalStateException("template broken"));

    DailyReportResponse report = service.dailyReport("u1", "2024-05-01", "Europe/Kyiv", true);

    assertThat(report.getReportText()).isNull();
    assertThat(report.getSpends()).hasSize(1);
  }

  @Test
  @DisplayName("Rendering can be skipped")
  void renderDisabled() {
    DailyReportResponse report = service.dailyReport("u1", "2024-05-01", "UTC", false);

    assertThat(report.getReportText()).isNull();
    verify(renderer, never()).render(any());
  }

  @Test
  @DisplayName("Unknown timezone falls back to UTC")
  void unknownTimezone() {
    DailyReportResponse report = service.dailyReport("u1", "2024-05-01", "Mars/Olympus", false);

    assertThat(report.getTimezone()).isEqualTo("UTC");
  }

  @Test
  @DisplayName("Missing date means today in the requested zone")
  void defaultsToToday() {
    DailyReportResponse report = service.dailyReport("u1", null, "Europe/Kyiv", false);

    assertThat(report.getDate()).isEqualTo("2024-05-01");
  }

  @Test
  @DisplayName("Malformed date is a bad request")
  void malformedDate() {
    assertThatThrownBy(() -> service.dailyReport("u1", "2024-13-40", "UTC", false))
        .isInstanceOfSatisfying(ResponseStatusException.class,
            ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST));
  }

  @Test
  @DisplayName("Unknown user is not found")
  void unknownUser() {
    assertThatThrownBy(() -> service.dailyReport("nobody", "2024-05-01", "UTC", false))
        .isInstanceOfSatisfying(ResponseStatusException.class,
            ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND));
  }

  @Test
  @DisplayName("Unreadable transactions surface as one report error")
  void storeReadFailure() {
    TransactionStore broken = mock(TransactionStore.class);
    when(broken.findByUserAndTimeRange(eq("u1"), anyLong(), anyLong()))
        .thenThrow(new IllegalStateException("connection refused"));
    DailyReportService failing = new DailyReportService(users, broken, new CoverageEngine(), renderer,
        new ReportProperties("Europe/Kyiv", "UAH"), clock);

    assertThatThrownBy(() -> failing.dailyReport("u1", "2024-05-01", "UTC", true))
        .isInstanceOf(ReportUnavailableException.class)
        .hasCauseInstanceOf(IllegalStateException.class);
  }
}
