package com.polycopy.copytrade.execution;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.polycopy.polymarket.http.HttpRequestFactory;
import com.polycopy.polymarket.http.PolymarketHttpTransport;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP client for the executor service, which signs and posts orders to the CLOB.
 */
public class ExecutorApiClient {

    private final HttpRequestFactory requestFactory;
    private final PolymarketHttpTransport transport;
    private final Duration timeout;

    public ExecutorApiClient(URI baseUri, PolymarketHttpTransport transport, Duration timeout) {
        this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
        this.transport = Objects.requireNonNull(transport, "transport");
        this.timeout = timeout == null ? Duration.ofSeconds(15) : timeout;
    }

    public OrderSubmissionResult placeMarketOrder(MarketOrderRequest request) {
        return post("/api/polymarket/orders/market", request);
    }

    public OrderSubmissionResult placeLimitOrder(LimitOrderRequest request) {
        return post("/api/polymarket/orders/limit", request);
    }

    private OrderSubmissionResult post(String path, Object body) {
        String json;
        try {
            json = transport.objectMapper().writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("failed to serialize " + body.getClass().getSimpleName(), e);
        }
        HttpRequest request = requestFactory.request(path, Map.of())
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .build();
        return transport.sendJson(request, OrderSubmissionResult.class);
    }
}
