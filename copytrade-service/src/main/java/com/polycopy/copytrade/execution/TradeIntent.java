package com.polycopy.copytrade.execution;

import com.polycopy.domain.OrderSide;
import com.polycopy.domain.OrderType;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Objects;

/**
 * Normalized order a follower wants placed.
 *
 * @param amount   notional in USDC
 * @param price    limit price; required for {@link OrderType#LIMIT}, informational otherwise
 * @param expiresAt good-till-date expiry for limit orders, {@code null} for fill-or-kill
 */
public record TradeIntent(
        String followerName,
        String tokenId,
        String conditionId,
        String outcome,
        OrderSide side,
        BigDecimal amount,
        BigDecimal price,
        OrderType orderType,
        Instant expiresAt,
        String sourceTransactionHash
) {

    public TradeIntent {
        Objects.requireNonNull(tokenId, "tokenId");
        Objects.requireNonNull(side, "side");
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(orderType, "orderType");
        if (orderType == OrderType.LIMIT && (price == null || price.signum() <= 0)) {
            throw new IllegalArgumentException("limit intent requires a positive price");
        }
    }
}
