package com.polycopy.store;

import com.polycopy.domain.Activity;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

public record TradeRecord(
    String transactionHash,
    String walletAddress,
    String marketId,
    String outcome,
    BigDecimal amount,
    BigDecimal price,
    Instant timestamp
) {

  public TradeRecord {
    Objects.requireNonNull(transactionHash, "transactionHash");
    Objects.requireNonNull(walletAddress, "walletAddress");
    Objects.requireNonNull(marketId, "marketId");
    Objects.requireNonNull(timestamp, "timestamp");
    if (amount == null) {
      amount = BigDecimal.ZERO;
    }
    if (price == null) {
      price = BigDecimal.ZERO;
    }
  }

  /**
   * Record for a TRADE activity carrying both a transaction hash and a condition id; empty otherwise.
   */
  public static Optional<TradeRecord> of(Activity activity) {
    if (activity == null || !activity.isTrade()) {
      return Optional.empty();
    }
    Optional<String> tx = activity.transactionHashValue();
    Optional<String> market = activity.conditionIdValue();
    if (tx.isEmpty() || market.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new TradeRecord(
        tx.get(),
        activity.walletAddress(),
        market.get(),
        activity.outcome(),
        activity.size(),
        activity.price(),
        activity.timestamp()));
  }
}
