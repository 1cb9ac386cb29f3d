package com.monotrack.service;

import static com.monotrack.support.TestData.item;
import static com.monotrack.support.TestData.uah;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.monotrack.model.AccountType;
import com.monotrack.model.BankAccount;
import com.monotrack.model.BankTransaction;
import com.monotrack.provider.ProviderAccount;
import com.monotrack.provider.StatementItem;
import com.monotrack.support.TestData;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CanonicalMapper")
class CanonicalMapperTest {
  private final CanonicalMapper mapper = new CanonicalMapper();

  private ProviderAccount jar(long balance) {
    return new ProviderAccount("jar1", AccountType.JAR, "send1", 980, balance, null,
        "Holiday", "Trip", 1_000_000L, null, null, null);
  }

  @Test
  @DisplayName("Re-sync keeps app-owned fields of the stored account")
  void preservesAppOwnedFields() {
    BankAccount stored = TestData.account("u1", "jar1");
    stored.setBudget(true);
    stored.setInvested(42_000);
    stored.setCreatedAt(Instant.parse("2024-01-01T00:00:00Z"));
    stored.setBalance(1);

    BankAccount mapped = mapper.mapAccount("u1", jar(55_000), Optional.of(stored));

    assertThat(mapped.isBudget()).isTrue();
    assertThat(mapped.getInvested()).isEqualTo(42_000);
    assertThat(mapped.getCreatedAt()).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    assertThat(mapped.getBalance()).isEqualTo(55_000);
    assertThat(mapped.getTitle()).isEqualTo("Holiday");
    assertThat(mapped.getCurrency().getName()).isEqualTo("UAH");
    assertThat(stored.getBalance()).isEqualTo(1);
  }

  @Test
  @DisplayName("New accounts start with default app-owned fields")
  void newAccountDefaults() {
    BankAccount mapped = mapper.mapAccount("u1", jar(0), Optional.empty());

    assertThat(mapped.isBudget()).isFalse();
    assertThat(mapped.getInvested()).isZero();
    assertThat(mapped.getUserId()).isEqualTo("u1");
    assertThat(mapped.getType()).isEqualTo(AccountType.JAR);
  }

  @Test
  @DisplayName("An explicit update overrides the stored app-owned value")
  void explicitUpdateWins() {
    BankAccount stored = TestData.account("u1", "jar1");
    stored.setBudget(true);
    stored.setInvested(10);

    BankAccount mapped = mapper.mapAccount("u1", jar(0), Optional.of(stored), new AccountFieldUpdate(false, null));

    assertThat(mapped.isBudget()).isFalse();
    assertThat(mapped.getInvested()).isEqualTo(10);
  }

  @Test
  @DisplayName("Statement item maps to a transaction, falling back to the account currency")
  void mapsTransaction() {
    StatementItem withoutCurrency = new StatementItem("t1", 1_700_000_000L, "Coffee", 5814, 5814, true,
        -4_500, -4_500L, null, 0L, 45L, 95_500, "latte", null, null);

    BankTransaction tx = mapper.mapTransaction("u1", "acc1", withoutCurrency, uah());

    assertThat(tx.getId()).isEqualTo("t1");
    assertThat(tx.getAccountId()).isEqualTo("acc1");
    assertThat(tx.getAmount()).isEqualTo(-4_500);
    assertThat(tx.isHold()).isTrue();
    assertThat(tx.isSpend()).isTrue();
    assertThat(tx.getComment()).isEqualTo("latte");
    assertThat(tx.getCurrency()).isEqualTo(uah());
  }

  @Test
  @DisplayName("Statement item without id is rejected")
  void rejectsMissingId() {
    StatementItem noId = item(null, 1L, 100);

    assertThatThrownBy(() -> mapper.mapTransaction("u1", "acc1", noId, uah()))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
