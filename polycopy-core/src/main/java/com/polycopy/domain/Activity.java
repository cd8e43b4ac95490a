package com.polycopy.domain;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * One on-chain action observed for a wallet, as reported by the activity feed.
 *
 * {@code side} is only meaningful for {@link ActivityType#TRADE}. A zero {@code cashAmount}
 * means the USDC value has to be derived from {@code size * price}.
 */
public record Activity(
    String walletAddress,
    ActivityType type,
    String transactionHash,
    String conditionId,
    String outcome,
    OrderSide side,
    BigDecimal size,
    BigDecimal price,
    BigDecimal cashAmount,
    Instant timestamp,
    String asset,
    String title,
    String slug
) {

  public Activity {
    Objects.requireNonNull(walletAddress, "walletAddress");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(timestamp, "timestamp");
    if (size == null) {
      size = BigDecimal.ZERO;
    }
    if (price == null) {
      price = BigDecimal.ZERO;
    }
    if (cashAmount == null) {
      cashAmount = BigDecimal.ZERO;
    }
  }

  public boolean isTrade() {
    return type == ActivityType.TRADE;
  }

  public Optional<String> transactionHashValue() {
    return nonBlank(transactionHash);
  }

  public Optional<String> conditionIdValue() {
    return nonBlank(conditionId);
  }

  public Optional<String> outcomeValue() {
    return nonBlank(outcome);
  }

  public Optional<OrderSide> sideValue() {
    return Optional.ofNullable(side);
  }

  /**
   * Limit price carried by the trade, absent when the feed reported none or zero.
   */
  public Optional<BigDecimal> priceValue() {
    return price.signum() > 0 ? Optional.of(price) : Optional.empty();
  }

  /**
   * USDC value of the action: the reported cash amount when positive, otherwise {@code size * price}.
   */
  public BigDecimal tradeValue() {
    if (cashAmount.signum() > 0) {
      return cashAmount;
    }
    return size.multiply(price);
  }

  /**
   * Identity of the action within its transaction. One transaction can settle several fills, so the
   * hash alone is not enough to recognise a re-delivered record.
   */
  public String dedupKey() {
    return String.join("|",
        Objects.toString(transactionHash, ""),
        Objects.toString(asset, ""),
        Objects.toString(conditionId, ""),
        Objects.toString(outcome, ""),
        side == null ? "" : side.name(),
        size.toPlainString(),
        price.toPlainString(),
        Long.toString(timestamp.getEpochSecond()));
  }

  private static Optional<String> nonBlank(String value) {
    return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
  }
}
