package com.polycopy.copytrade.engine;

import com.polycopy.config.PolycopyProperties;
import com.polycopy.domain.CopyMode;
import com.polycopy.domain.OrderType;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.Objects;

/**
 * Validated sizing and order policy of one follower.
 */
public record CopyStrategy(
        CopyMode copyMode,
        BigDecimal scalePercentage,
        BigDecimal minTriggerAmount,
        BigDecimal minTradeAmount,
        BigDecimal maxTradeAmount,
        OrderType orderType,
        Duration limitOrderDuration
) {

    public CopyStrategy {
        Objects.requireNonNull(copyMode, "copyMode");
        if (copyMode == CopyMode.SCALE && (scalePercentage == null || scalePercentage.signum() <= 0)) {
            throw new IllegalArgumentException("scale_percentage is required and must be > 0 for SCALE copy mode");
        }
        minTriggerAmount = nonNegative(minTriggerAmount, "minTriggerAmount");
        minTradeAmount = nonNegative(minTradeAmount, "minTradeAmount");
        maxTradeAmount = nonNegative(maxTradeAmount, "maxTradeAmount");
        if (maxTradeAmount.signum() > 0 && minTradeAmount.compareTo(maxTradeAmount) > 0) {
            throw new IllegalArgumentException("minTradeAmount %s exceeds maxTradeAmount %s"
                    .formatted(minTradeAmount, maxTradeAmount));
        }
        if (orderType == null) {
            orderType = OrderType.MARKET;
        }
        if (limitOrderDuration == null) {
            limitOrderDuration = Duration.ofHours(2);
        }
    }

    public static CopyStrategy from(PolycopyProperties.CopyStrategy props) {
        return new CopyStrategy(
                props.copyMode(),
                props.scalePercentage(),
                props.minTriggerAmount(),
                props.minTradeAmount(),
                props.maxTradeAmount(),
                props.orderType(),
                Duration.ofSeconds(props.limitOrderDurationSeconds()));
    }

    public static CopyStrategy scale(BigDecimal percentage) {
        return new CopyStrategy(CopyMode.SCALE, percentage, null, null, null, OrderType.MARKET, null);
    }

    public CopyStrategy withLimits(BigDecimal minTrigger, BigDecimal minTrade, BigDecimal maxTrade) {
        return new CopyStrategy(copyMode, scalePercentage, minTrigger, minTrade, maxTrade, orderType, limitOrderDuration);
    }

    public CopyStrategy withOrderType(OrderType type) {
        return new CopyStrategy(copyMode, scalePercentage, minTriggerAmount, minTradeAmount, maxTradeAmount, type, limitOrderDuration);
    }

    private static BigDecimal nonNegative(BigDecimal value, String name) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be >= 0");
        }
        return value;
    }
}
