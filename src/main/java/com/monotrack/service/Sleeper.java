package com.monotrack.service;

import java.time.Duration;

@FunctionalInterface
public interface Sleeper {
  void sleep(Duration duration);

  static Sleeper threadSleep() {
    return duration -> {
      if (duration.isZero() || duration.isNegative()) {
        return;
      }
      try {
        Thread.sleep(duration.toMillis());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        throw new IllegalStateException("Interrupted while waiting " + duration, ex);
      }
    };
  }
}
