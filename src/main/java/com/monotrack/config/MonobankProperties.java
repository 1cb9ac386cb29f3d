package com.monotrack.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monotrack.providers.monobank")
public record MonobankProperties(
    String baseUrl,
    Duration connectTimeout,
    Duration readTimeout,
    Duration minRequestInterval,
    Long maxStatementWindowSeconds,
    Integer statementPageLimit,
    Boolean debugLogResponses
) {}
