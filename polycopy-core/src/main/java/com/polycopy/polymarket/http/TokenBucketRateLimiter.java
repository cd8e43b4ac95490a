package com.polycopy.polymarket.http;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

public final class TokenBucketRateLimiter implements RequestRateLimiter {

  private final double permitsPerNano;
  private final double capacity;
  private final Clock clock;

  private double available;
  private long lastRefillNanos;

  public TokenBucketRateLimiter(double requestsPerSecond, int burst, Clock clock) {
    if (requestsPerSecond <= 0) {
      throw new IllegalArgumentException("requestsPerSecond must be > 0");
    }
    if (burst <= 0) {
      throw new IllegalArgumentException("burst must be > 0");
    }
    this.permitsPerNano = requestsPerSecond / TimeUnit.SECONDS.toNanos(1);
    this.capacity = burst;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.available = burst;
    this.lastRefillNanos = nowNanos();
  }

  @Override
  public void acquire() {
    while (true) {
      long waitNanos = tryReserve();
      if (waitNanos <= 0) {
        return;
      }
      LockSupport.parkNanos(waitNanos);
      if (Thread.currentThread().isInterrupted()) {
        throw new IllegalStateException("interrupted while waiting for a request permit");
      }
    }
  }

  /**
   * Takes a permit when one is available and returns 0, otherwise returns the nanos until the next one.
   */
  synchronized long tryReserve() {
    long now = nowNanos();
    long elapsed = Math.max(0, now - lastRefillNanos);
    available = Math.min(capacity, available + elapsed * permitsPerNano);
    lastRefillNanos = now;
    if (available >= 1.0) {
      available -= 1.0;
      return 0;
    }
    return (long) Math.ceil((1.0 - available) / permitsPerNano);
  }

  private long nowNanos() {
    return TimeUnit.MILLISECONDS.toNanos(clock.millis());
  }
}
