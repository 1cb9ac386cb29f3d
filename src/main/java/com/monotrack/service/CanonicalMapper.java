package com.monotrack.service;

import com.monotrack.model.BankAccount;
import com.monotrack.model.BankTransaction;
import com.monotrack.model.CurrencyInfo;
import com.monotrack.provider.ProviderAccount;
import com.monotrack.provider.StatementItem;
import com.monotrack.provider.monobank.MonobankCurrencies;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Translates provider payloads into stored records. Never mutates its inputs and never reads the
 * clock, so the same payload always maps to the same record.
 */
@Component
public class CanonicalMapper {

  public BankAccount mapAccount(String userId, ProviderAccount source, Optional<BankAccount> existing) {
    return mapAccount(userId, source, existing, AccountFieldUpdate.none());
  }

  public BankAccount mapAccount(String userId,
                                ProviderAccount source,
                                Optional<BankAccount> existing,
                                AccountFieldUpdate update) {
    BankAccount account = new BankAccount();
    account.setUserId(userId);
    account.setId(source.id());
    account.setType(source.type());
    account.setSendId(source.sendId());
    account.setCurrency(MonobankCurrencies.resolve(source.currencyCode()));
    account.setBalance(source.balance());
    account.setCreditLimit(source.creditLimit());
    account.setActive(true);
    account.setTitle(source.title());
    account.setDescription(source.description());
    account.setGoal(source.goal());
    account.setMaskedPan(source.maskedPan());
    account.setIban(source.iban());
    account.setCashbackType(source.cashbackType());

    boolean budget = existing.map(BankAccount::isBudget).orElse(false);
    long invested = existing.map(BankAccount::getInvested).orElse(0L);
    if (update.budget() != null) {
      budget = update.budget();
    }
    if (update.invested() != null) {
      invested = update.invested();
    }
    account.setBudget(budget);
    account.setInvested(invested);
    existing.ifPresent(previous -> {
      account.setCreatedAt(previous.getCreatedAt());
      account.setLastSyncedAt(previous.getLastSyncedAt());
    });
    return account;
  }

  public BankTransaction mapTransaction(String userId,
                                        String accountId,
                                        StatementItem item,
                                        CurrencyInfo accountCurrency) {
    if (item.id() == null || item.id().isBlank()) {
      throw new IllegalArgumentException("Statement item without id for account " + accountId);
    }
    BankTransaction tx = new BankTransaction();
    tx.setUserId(userId);
    tx.setAccountId(accountId);
    tx.setId(item.id());
    tx.setTime(item.time());
    tx.setDescription(item.description());
    tx.setAmount(item.amount());
    tx.setOperationAmount(item.operationAmount());
    tx.setBalance(item.balance());
    tx.setCommissionRate(item.commissionRate());
    tx.setCashbackAmount(item.cashbackAmount());
    tx.setHold(item.hold());
    tx.setComment(item.comment());
    tx.setMcc(item.mcc());
    tx.setOriginalMcc(item.originalMcc());
    CurrencyInfo currency = MonobankCurrencies.resolve(item.currencyCode());
    tx.setCurrency(currency != null ? currency : copyOf(accountCurrency));
    return tx;
  }

  private static CurrencyInfo copyOf(CurrencyInfo currency) {
    if (currency == null) {
      return null;
    }
    return new CurrencyInfo(currency.getCode(), currency.getName(), currency.getSymbol(), currency.getFlag());
  }
}
