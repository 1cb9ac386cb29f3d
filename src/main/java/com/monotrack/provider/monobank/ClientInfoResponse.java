package com.monotrack.provider.monobank;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.monotrack.model.AccountType;
import com.monotrack.provider.ProviderAccount;
import java.util.ArrayList;
import java.util.List;

/**
 * Body of {@code GET /personal/client-info}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClientInfoResponse(
    String clientId,
    String name,
    List<Card> accounts,
    List<Jar> jars
) {
  public List<ProviderAccount> toProviderAccounts() {
    List<ProviderAccount> result = new ArrayList<>();
    if (accounts != null) {
      for (Card card : accounts) {
        String maskedPan = card.maskedPan() == null || card.maskedPan().isEmpty() ? null : card.maskedPan().get(0);
        result.add(new ProviderAccount(
            card.id(),
            AccountType.CARD,
            card.sendId(),
            card.currencyCode(),
            card.balance(),
            card.creditLimit(),
            null,
            null,
            null,
            maskedPan,
            card.iban(),
            card.cashbackType()));
      }
    }
    if (jars != null) {
      for (Jar jar : jars) {
        result.add(new ProviderAccount(
            jar.id(),
            AccountType.JAR,
            jar.sendId(),
            jar.currencyCode(),
            jar.balance(),
            null,
            jar.title(),
            jar.description(),
            jar.goal(),
            null,
            null,
            null));
      }
    }
    return result;
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Card(
      String id,
      String sendId,
      long balance,
      Long creditLimit,
      String type,
      int currencyCode,
      String cashbackType,
      List<String> maskedPan,
      String iban
  ) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Jar(
      String id,
      String sendId,
      String title,
      String description,
      int currencyCode,
      long balance,
      Long goal
  ) {}
}
