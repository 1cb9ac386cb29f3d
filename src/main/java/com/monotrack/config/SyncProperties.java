package com.monotrack.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "monotrack.sync")
public record SyncProperties(
    int lookbackDays,
    Duration rereadOverlap,
    int userConcurrency,
    Retry providerRetry,
    Retry storeRetry
) {
  public record Retry(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {}
}
