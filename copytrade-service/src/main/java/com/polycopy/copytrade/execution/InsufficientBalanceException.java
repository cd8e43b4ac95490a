package com.polycopy.copytrade.execution;

public class InsufficientBalanceException extends TradeExecutionException {

    public InsufficientBalanceException(String message) {
        super(message);
    }

    public InsufficientBalanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
