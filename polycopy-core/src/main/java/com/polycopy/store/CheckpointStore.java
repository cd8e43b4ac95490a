package com.polycopy.store;

import java.time.Instant;
import java.util.Optional;

/**
 * Durable per-wallet ingestion cursor.
 */
public interface CheckpointStore {

  Optional<Instant> get(String walletAddress);

  /**
   * Record {@code timestamp} as the last ingested activity time. Implementations never move a
   * stored checkpoint backwards.
   */
  void set(String walletAddress, Instant timestamp);
}
