package com.monotrack.provider;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record StatementItem(
    String id,
    long time,
    String description,
    Integer mcc,
    Integer originalMcc,
    boolean hold,
    long amount,
    Long operationAmount,
    Integer currencyCode,
    Long commissionRate,
    Long cashbackAmount,
    long balance,
    String comment,
    String counterName,
    String counterIban
) {}
