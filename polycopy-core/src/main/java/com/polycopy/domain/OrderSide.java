package com.polycopy.domain;

import java.util.Locale;
import java.util.Optional;

public enum OrderSide {
  BUY,
  SELL;

  public static Optional<OrderSide> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    return switch (raw.trim().toUpperCase(Locale.ROOT)) {
      case "BUY" -> Optional.of(BUY);
      case "SELL" -> Optional.of(SELL);
      default -> Optional.empty();
    };
  }
}
