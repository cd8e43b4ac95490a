package com.polycopy.copytrade.execution;

import com.polycopy.polymarket.http.PolymarketHttpException;

import java.io.IOException;
import java.net.ConnectException;
import java.net.http.HttpTimeoutException;
import java.util.Locale;

/**
 * Maps raw failures from the executor into the {@link TradeExecutionException} taxonomy.
 */
public final class ExecutionFailureClassifier {

    private ExecutionFailureClassifier() {
    }

    public static TradeExecutionException classify(Throwable error) {
        if (error instanceof TradeExecutionException tee) {
            return tee;
        }
        String text = describe(error);
        String lower = text.toLowerCase(Locale.ROOT);

        if (mentionsBalance(lower)) {
            return new InsufficientBalanceException("Insufficient balance: " + text, error);
        }
        if (error instanceof PolymarketHttpException http && http.isServerUnavailable()) {
            return new NetworkException("Executor unavailable (HTTP " + http.getStatusCode() + "): " + text, error);
        }
        if (isTransportFailure(error) || mentionsNetwork(lower)) {
            return new NetworkException("Network error: " + text, error);
        }
        return new OrderExecutionException("Order execution failed: " + text, error);
    }

    /**
     * Classify a rejection reported in a successful HTTP response.
     */
    public static TradeExecutionException classifyRejection(String reason) {
        String text = reason == null || reason.isBlank() ? "order rejected" : reason;
        String lower = text.toLowerCase(Locale.ROOT);
        if (mentionsBalance(lower)) {
            return new InsufficientBalanceException("Insufficient balance: " + text);
        }
        if (mentionsNetwork(lower)) {
            return new NetworkException("Network error: " + text);
        }
        return new OrderExecutionException("Order rejected: " + text);
    }

    private static boolean isTransportFailure(Throwable error) {
        Throwable t = error;
        while (t != null) {
            if (t instanceof HttpTimeoutException || t instanceof ConnectException) {
                return true;
            }
            t = t.getCause();
        }
        return error instanceof PolymarketHttpException http
                && http.getStatusCode() < 0
                && error.getCause() instanceof IOException;
    }

    private static boolean mentionsBalance(String lower) {
        return lower.contains("balance") || lower.contains("insufficient");
    }

    private static boolean mentionsNetwork(String lower) {
        return lower.contains("network") || lower.contains("timeout") || lower.contains("timed out")
                || lower.contains("connection");
    }

    private static String describe(Throwable error) {
        StringBuilder sb = new StringBuilder(String.valueOf(error.getMessage()));
        if (error instanceof PolymarketHttpException http && http.getResponseBody() != null
                && !sb.toString().contains(http.getResponseBody())) {
            sb.append(' ').append(http.getResponseBody());
        }
        return sb.toString();
    }
}
