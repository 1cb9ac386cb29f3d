package com.monotrack.service;

import static com.monotrack.support.TestData.item;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.monotrack.config.SyncProperties;
import com.monotrack.dto.SyncSummary;
import com.monotrack.dto.UserSyncResult;
import com.monotrack.model.AccountType;
import com.monotrack.model.BankAccount;
import com.monotrack.provider.ProviderAccount;
import com.monotrack.provider.ProviderCredentialException;
import com.monotrack.store.SyncUser;
import com.monotrack.store.UserDirectoryUnavailableException;
import com.monotrack.support.FakeBankingClient;
import com.monotrack.support.InMemoryAccountStore;
import com.monotrack.support.InMemoryTransactionStore;
import com.monotrack.support.InMemoryUserDirectory;
import com.monotrack.support.InMemoryWatermarkStore;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SyncOrchestrator")
class SyncOrchestratorTest {
  private static final long NOW = 1_700_000_000L;

  private final Clock clock = Clock.fixed(Instant.ofEpochSecond(NOW), ZoneOffset.UTC);
  private final Sleeper sleeper = duration -> { };

  private ExecutorService executor;
  private InMemoryUserDirectory users;
  private InMemoryAccountStore accounts;
  private InMemoryTransactionStore transactions;
  private FakeBankingClient client;
  private SyncOrchestrator orchestrator;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(2);
    users = new InMemoryUserDirectory();
    accounts = new InMemoryAccountStore();
    transactions = new InMemoryTransactionStore();
    client = new FakeBankingClient(Duration.ofDays(31), 500);

    RequestThrottle throttle = new RequestThrottle(Duration.ZERO, clock, sleeper);
    RetryPolicy retry = new RetryPolicy(2, Duration.ZERO, 1.0, Duration.ZERO);
    CanonicalMapper mapper = new CanonicalMapper();
    TransactionSyncEngine engine = new TransactionSyncEngine(client, mapper, users, accounts, transactions,
        new InMemoryWatermarkStore(), throttle, retry, retry, sleeper, clock,
        new SyncProperties(7, null, 2, null, null));
    orchestrator = new SyncOrchestrator(users, client, mapper, accounts, engine, throttle, retry, retry,
        sleeper, clock, executor);
  }

  @AfterEach
  void tearDown() {
    executor.shutdownNow();
  }

  private static ProviderAccount card(String id) {
    return new ProviderAccount(id, AccountType.CARD, "send-" + id, 980, 10_000, 0L,
        null, null, null, "537541******1234", "UA000000000000000000000000000", "UAH");
  }

  @Test
  @DisplayName("One user's credential failure does not stop the others")
  void isolatesUserFailures() {
    users.add(new SyncUser("u1", true, "token-1")).add(new SyncUser("u2", true, "token-2"));
    client.accounts("token-1", card("acc1"))
        .items("acc1", item("t1", NOW - 3_600, -500), item("t2", NOW - 1_800, 900))
        .failWith("token-2", new ProviderCredentialException("Monobank rejected the token"));

    SyncSummary summary = orchestrator.runAccountSync();

    assertThat(summary.getStatus()).isEqualTo(SyncSummary.STATUS_COMPLETED_WITH_ERRORS);
    assertThat(summary.getProcessedUsers()).isEqualTo(1);
    assertThat(summary.getFailedUsers()).isEqualTo(1);
    assertThat(summary.getTotalAccountsSynced()).isEqualTo(1);
    assertThat(summary.getTotalTransactionsSynced()).isEqualTo(2);
    UserSyncResult failed = summary.getUsers().stream()
        .filter(user -> user.getUserId().equals("u2")).findFirst().orElseThrow();
    assertThat(failed.getErrorCode()).isEqualTo("CREDENTIAL_ERROR");
    assertThat(accounts.find("u1", "acc1")).isPresent();
  }

  @Test
  @DisplayName("Active user without a token is recorded as a credential failure")
  void missingToken() {
    users.add(new SyncUser("u1", true, " "));

    SyncSummary summary = orchestrator.runAccountSync();

    assertThat(summary.getFailedUsers()).isEqualTo(1);
    assertThat(summary.getUsers().get(0).getErrorCode()).isEqualTo("CREDENTIAL_ERROR");
    assertThat(client.statementCalls()).isEmpty();
  }

  @Test
  @DisplayName("Failure to list users aborts the run")
  void directoryFailureIsFatal() {
    users.setUnavailable(true);

    assertThatThrownBy(() -> orchestrator.runAccountSync())
        .isInstanceOf(UserDirectoryUnavailableException.class);
  }

  @Test
  @DisplayName("No active users gives an empty successful summary")
  void noUsers() {
    users.add(new SyncUser("u1", false, "token-1"));

    SyncSummary summary = orchestrator.runAccountSync();

    assertThat(summary.getStatus()).isEqualTo(SyncSummary.STATUS_SUCCESS);
    assertThat(summary.getUsers()).isEmpty();
  }

  @Test
  @DisplayName("Account re-sync keeps the budget flag set in the app")
  void keepsBudgetFlag() {
    users.add(new SyncUser("u1", true, "token-1"));
    client.accounts("token-1", card("acc1"));
    orchestrator.runAccountSync();
    BankAccount stored = accounts.find("u1", "acc1").orElseThrow();
    stored.setBudget(true);

    orchestrator.runAccountSync();

    BankAccount resynced = accounts.find("u1", "acc1").orElseThrow();
    assertThat(resynced.isBudget()).isTrue();
    assertThat(resynced.getLastSyncedAt()).isEqualTo(clock.instant());
  }

  @Test
  @DisplayName("Inactive user is not synced on demand")
  void inactiveUser() {
    users.add(new SyncUser("u1", false, "token-1"));

    UserSyncResult result = orchestrator.syncUser("u1");

    assertThat(result.isSuccess()).isFalse();
    assertThat(result.getErrorCode()).isEqualTo("USER_INACTIVE");
  }

  @Test
  @DisplayName("Transaction-only sync walks the stored accounts")
  void transactionOnlySync() {
    users.add(new SyncUser("u1", true, "token-1"));
    client.accounts("token-1", card("acc1"), card("acc2"))
        .items("acc2", item("t1", NOW - 60, -100));
    orchestrator.syncUser("u1");
    client.items("acc1", item("t2", NOW - 30, 400));

    UserSyncResult result = orchestrator.syncUserTransactions("u1");

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.getAccountsSynced()).isEqualTo(2);
    assertThat(transactions.all()).hasSize(2);
  }
}
