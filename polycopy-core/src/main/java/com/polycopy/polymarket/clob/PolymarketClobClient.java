package com.polycopy.polymarket.clob;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.polymarket.http.HttpRequestFactory;
import com.polycopy.polymarket.http.PolymarketHttpTransport;
import lombok.NonNull;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpRequest;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Read-only CLOB endpoints. Order placement goes through the executor service.
 */
public final class PolymarketClobClient {

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final Duration timeout;

  public PolymarketClobClient(@NonNull URI baseUri, @NonNull PolymarketHttpTransport transport, Duration timeout) {
    this.requestFactory = new HttpRequestFactory(Objects.requireNonNull(baseUri, "baseUri"));
    this.transport = Objects.requireNonNull(transport, "transport");
    this.timeout = timeout == null || timeout.isZero() ? Duration.ofSeconds(30) : timeout;
  }

  public JsonNode getMarket(String conditionId) {
    if (conditionId == null || conditionId.isBlank()) {
      throw new IllegalArgumentException("conditionId must not be blank");
    }
    String path = "/markets/" + URLEncoder.encode(conditionId, StandardCharsets.UTF_8);
    HttpRequest request = requestFactory.request(path, Map.of())
        .GET()
        .timeout(timeout)
        .header("Accept", "application/json")
        .build();
    return transport.sendJson(request, JsonNode.class);
  }

  /**
   * Token id of {@code outcome} within a {@code /markets/{conditionId}} payload, matched
   * case-insensitively against {@code tokens[].outcome}.
   */
  public static Optional<String> tokenIdForOutcome(JsonNode market, String outcome) {
    if (market == null || outcome == null) {
      return Optional.empty();
    }
    JsonNode tokens = market.path("tokens");
    if (!tokens.isArray()) {
      return Optional.empty();
    }
    for (JsonNode token : tokens) {
      String o = token.path("outcome").asText("");
      if (o.equalsIgnoreCase(outcome.trim())) {
        String tokenId = token.path("token_id").asText("");
        return tokenId.isBlank() ? Optional.empty() : Optional.of(tokenId);
      }
    }
    return Optional.empty();
  }
}
