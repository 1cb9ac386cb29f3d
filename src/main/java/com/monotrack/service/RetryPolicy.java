package com.monotrack.service;

import com.monotrack.config.SyncProperties;
import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry with exponential backoff. Attempt {@code n} (1-based) that fails with a
 * retryable error waits {@code initialBackoff * multiplier^(n-1)}, capped at {@code maxBackoff}.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
  private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
    maxBackoff = maxBackoff == null ? initialBackoff : maxBackoff;
    multiplier = multiplier < 1.0 ? 1.0 : multiplier;
  }

  public static RetryPolicy from(SyncProperties.Retry retry) {
    if (retry == null) {
      return noRetry();
    }
    return new RetryPolicy(retry.maxAttempts(), retry.initialBackoff(), retry.multiplier(), retry.maxBackoff());
  }

  public static RetryPolicy noRetry() {
    return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO);
  }

  public Duration backoffFor(int attempt) {
    double factor = Math.pow(multiplier, Math.max(0, attempt - 1));
    long millis = (long) Math.min(initialBackoff.toMillis() * factor, (double) maxBackoff.toMillis());
    return Duration.ofMillis(Math.max(0, millis));
  }

  public <T> T execute(String operation,
                       Supplier<T> action,
                       Predicate<RuntimeException> retryable,
                       Sleeper sleeper) {
    int attempt = 1;
    while (true) {
      try {
        return action.get();
      } catch (RuntimeException ex) {
        if (attempt >= maxAttempts || !retryable.test(ex)) {
          throw ex;
        }
        Duration backoff = backoffFor(attempt);
        log.warn("{} failed on attempt {}/{} ({}), retrying in {} ms",
            operation, attempt, maxAttempts, ex.getMessage(), backoff.toMillis());
        sleeper.sleep(backoff);
        attempt++;
      }
    }
  }
}
