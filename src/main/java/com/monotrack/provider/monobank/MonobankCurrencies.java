package com.monotrack.provider.monobank;

import com.monotrack.model.CurrencyInfo;
import java.util.Currency;
import java.util.Map;

/**
 * Resolves ISO 4217 numeric codes, as Monobank reports them, to display data.
 */
public final class MonobankCurrencies {
  private static final Map<Integer, CurrencyInfo> KNOWN = Map.of(
      980, new CurrencyInfo(980, "UAH", "₴", "🇺🇦"),
      840, new CurrencyInfo(840, "USD", "$", "🇺🇸"),
      978, new CurrencyInfo(978, "EUR", "€", "🇪🇺"));

  private MonobankCurrencies() {
  }

  public static CurrencyInfo resolve(Integer numericCode) {
    if (numericCode == null) {
      return null;
    }
    CurrencyInfo known = KNOWN.get(numericCode);
    if (known != null) {
      return new CurrencyInfo(known.getCode(), known.getName(), known.getSymbol(), known.getFlag());
    }
    for (Currency currency : Currency.getAvailableCurrencies()) {
      if (currency.getNumericCode() == numericCode) {
        return new CurrencyInfo(numericCode, currency.getCurrencyCode(), currency.getCurrencyCode(), "");
      }
    }
    return new CurrencyInfo(numericCode, "Unknown", "", "");
  }
}
