package com.polycopy.store;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryCheckpointStore implements CheckpointStore {

  private final Map<String, Instant> checkpoints = new ConcurrentHashMap<>();

  @Override
  public Optional<Instant> get(String walletAddress) {
    return Optional.ofNullable(checkpoints.get(key(walletAddress)));
  }

  @Override
  public void set(String walletAddress, Instant timestamp) {
    Objects.requireNonNull(timestamp, "timestamp");
    checkpoints.merge(key(walletAddress), timestamp, (prev, next) -> next.isAfter(prev) ? next : prev);
  }

  private static String key(String walletAddress) {
    return Objects.requireNonNull(walletAddress, "walletAddress").toLowerCase(Locale.ROOT);
  }
}
