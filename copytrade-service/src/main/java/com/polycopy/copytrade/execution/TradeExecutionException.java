package com.polycopy.copytrade.execution;

/**
 * Classified failure of a trade submission. Subclasses decide whether the engine retries.
 */
public abstract class TradeExecutionException extends RuntimeException {

    protected TradeExecutionException(String message) {
        super(message);
    }

    protected TradeExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isRetryable() {
        return false;
    }
}
