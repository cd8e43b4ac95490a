package com.polycopy.domain;

import java.util.Locale;
import java.util.Optional;

public enum ActivityType {
  TRADE,
  SPLIT,
  MERGE,
  REDEEM,
  REWARD,
  CONVERSION;

  public static Optional<ActivityType> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(valueOf(raw.trim().toUpperCase(Locale.ROOT)));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
