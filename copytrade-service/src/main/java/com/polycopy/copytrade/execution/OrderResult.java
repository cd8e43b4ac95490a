package com.polycopy.copytrade.execution;

public record OrderResult(
        String orderId,
        String status,
        boolean paper
) {
}
