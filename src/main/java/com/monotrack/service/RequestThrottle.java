package com.monotrack.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps a fixed minimum gap between provider calls made with the same credential.
 * Calls for different credentials never wait on each other. A credential whose last call is at
 * least one interval old is forgotten, since its next call would not wait anyway.
 */
public class RequestThrottle {
  private final Duration minInterval;
  private final Clock clock;
  private final Sleeper sleeper;
  private final Map<String, Slot> slots = new ConcurrentHashMap<>();

  public RequestThrottle(Duration minInterval, Clock clock, Sleeper sleeper) {
    this.minInterval = minInterval == null ? Duration.ZERO : minInterval;
    this.clock = clock;
    this.sleeper = sleeper;
  }

  public void acquire(String credential) {
    if (minInterval.isZero() || minInterval.isNegative()) {
      return;
    }
    evictIdle();
    Slot slot = slots.computeIfAbsent(credential, key -> new Slot());
    while (!slot.acquire()) {
      // evicted between lookup and lock
      slots.remove(credential, slot);
      slot = slots.computeIfAbsent(credential, key -> new Slot());
    }
  }

  int trackedCredentials() {
    return slots.size();
  }

  private void evictIdle() {
    Instant cutoff = clock.instant().minus(minInterval);
    slots.forEach((credential, slot) -> {
      if (slot.retireIfIdleSince(cutoff)) {
        slots.remove(credential, slot);
      }
    });
  }

  private final class Slot {
    private final ReentrantLock lock = new ReentrantLock();
    private Instant lastCall;
    private boolean retired;

    boolean acquire() {
      lock.lock();
      try {
        if (retired) {
          return false;
        }
        if (lastCall != null) {
          Duration wait = Duration.between(clock.instant(), lastCall.plus(minInterval));
          if (!wait.isNegative() && !wait.isZero()) {
            sleeper.sleep(wait);
          }
        }
        lastCall = clock.instant();
        return true;
      } finally {
        lock.unlock();
      }
    }

    // Never blocks: a slot busy waiting out its interval is not idle.
    boolean retireIfIdleSince(Instant cutoff) {
      if (!lock.tryLock()) {
        return false;
      }
      try {
        if (retired || lastCall == null || lastCall.isAfter(cutoff)) {
          return false;
        }
        retired = true;
        return true;
      } finally {
        lock.unlock();
      }
    }
  }
}
