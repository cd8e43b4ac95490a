package com.polycopy.copytrade.execution;

/**
 * Transport-level failure (timeout, refused connection, gateway unavailable). Retried with backoff.
 */
public class NetworkException extends TradeExecutionException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
