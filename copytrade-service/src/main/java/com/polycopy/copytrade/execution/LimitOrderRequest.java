package com.polycopy.copytrade.execution;

import com.polycopy.domain.OrderSide;

import java.math.BigDecimal;

/**
 * Body of {@code POST /api/polymarket/orders/limit}. {@code size} is in shares.
 */
public record LimitOrderRequest(
        String tokenId,
        OrderSide side,
        BigDecimal price,
        BigDecimal size,
        String orderType,
        Long expirationSeconds
) {
}
