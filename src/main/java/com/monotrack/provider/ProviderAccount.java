package com.monotrack.provider;

import com.monotrack.model.AccountType;

public record ProviderAccount(
    String id,
    AccountType type,
    String sendId,
    int currencyCode,
    long balance,
    Long creditLimit,
    String title,
    String description,
    Long goal,
    String maskedPan,
    String iban,
    String cashbackType
) {}
