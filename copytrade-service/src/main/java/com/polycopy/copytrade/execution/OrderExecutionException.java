package com.polycopy.copytrade.execution;

public class OrderExecutionException extends TradeExecutionException {

    public OrderExecutionException(String message) {
        super(message);
    }

    public OrderExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
