package com.polycopy.polymarket.http;

import java.time.Clock;

/**
 * Gate in front of outbound requests. Implementations block the calling thread until a permit is
 * available.
 */
public interface RequestRateLimiter {

  void acquire();

  static RequestRateLimiter noop() {
    return () -> {
    };
  }

  static RequestRateLimiter tokenBucket(double requestsPerSecond, int burst, Clock clock) {
    if (requestsPerSecond <= 0 || burst <= 0) {
      return noop();
    }
    return new TokenBucketRateLimiter(requestsPerSecond, burst, clock);
  }
}
