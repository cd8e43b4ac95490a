package com.polycopy.polymarket.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.polymarket.http.HttpRequestFactory;
import com.polycopy.polymarket.http.PolymarketHttpTransport;
import lombok.NonNull;

import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class PolymarketDataApiClient {

  public static final int MAX_PAGE_LIMIT = 500;

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final Duration timeout;

  public PolymarketDataApiClient(@NonNull URI baseUri, @NonNull PolymarketHttpTransport transport, Duration timeout) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeout = timeout == null || timeout.isZero() ? Duration.ofSeconds(30) : timeout;
  }

  /**
   * Fetch a page of a user's on-chain activity between {@code start} and {@code end}, oldest first.
   *
   * The data-api takes both bounds as epoch seconds and treats them as inclusive.
   */
  public JsonNode getActivity(String userAddress, Instant start, Instant end, int limit, int offset) {
    if (userAddress == null || userAddress.isBlank()) {
      throw new IllegalArgumentException("userAddress must not be blank");
    }
    Map<String, String> query = new LinkedHashMap<>();
    query.put("user", userAddress);
    query.put("limit", Integer.toString(Math.min(MAX_PAGE_LIMIT, Math.max(1, limit))));
    query.put("offset", Integer.toString(Math.max(0, offset)));
    if (start != null) {
      query.put("start", Long.toString(start.getEpochSecond()));
    }
    if (end != null) {
      query.put("end", Long.toString(end.getEpochSecond()));
    }
    query.put("sortBy", "TIMESTAMP");
    query.put("sortDirection", "ASC");
    return getArray("/activity", query);
  }

  private JsonNode getArray(String path, Map<String, String> query) {
    HttpRequest request = requestFactory.request(path, query)
        .GET()
        .timeout(timeout)
        .header("Accept", "application/json")
        .build();
    return transport.sendJson(request, JsonNode.class);
  }
}
