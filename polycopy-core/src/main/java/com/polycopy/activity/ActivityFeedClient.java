package com.polycopy.activity;

import java.time.Instant;

/**
 * Paged source of a wallet's activity, oldest first.
 */
public interface ActivityFeedClient {

  ActivityPage fetch(String walletAddress, Instant start, Instant end, int limit, int offset);

  /**
   * Largest page the feed serves; larger limits are truncated to this.
   */
  default int maxPageSize() {
    return Integer.MAX_VALUE;
  }
}
