package com.polycopy.copytrade.execution;

import com.polycopy.domain.OrderSide;

import java.math.BigDecimal;

/**
 * Body of {@code POST /api/polymarket/orders/market}. {@code amount} is USDC notional.
 */
public record MarketOrderRequest(
        String tokenId,
        OrderSide side,
        BigDecimal amount,
        BigDecimal price,
        String orderType
) {
}
