package com.polycopy.polymarket.http;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * Sends JSON requests through a shared {@link HttpClient}, applying the rate limiter and mapping
 * failures to {@link PolymarketHttpException}.
 */
@Slf4j
public class PolymarketHttpTransport {

  private static final int MAX_ERROR_BODY_CHARS = 512;

  private final HttpClient httpClient;
  private final ObjectMapper objectMapper;
  private final RequestRateLimiter rateLimiter;

  public PolymarketHttpTransport(HttpClient httpClient, ObjectMapper objectMapper, RequestRateLimiter rateLimiter) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.rateLimiter = rateLimiter == null ? RequestRateLimiter.noop() : rateLimiter;
  }

  public ObjectMapper objectMapper() {
    return objectMapper;
  }

  public <T> T sendJson(HttpRequest request, Class<T> responseType) {
    String body = send(request);
    if (body == null || body.isBlank()) {
      body = "null";
    }
    try {
      return objectMapper.readValue(body, responseType);
    } catch (IOException e) {
      throw new PolymarketHttpException(
          "failed to parse response from %s %s".formatted(request.method(), request.uri()), e);
    }
  }

  public String send(HttpRequest request) {
    rateLimiter.acquire();
    HttpResponse<String> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    } catch (IOException e) {
      throw new PolymarketHttpException(
          "%s %s failed: %s".formatted(request.method(), request.uri(), e), e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PolymarketHttpException("interrupted during %s %s".formatted(request.method(), request.uri()), e);
    }

    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      String body = truncate(response.body());
      log.debug("http {} {} -> {} body={}", request.method(), request.uri(), status, body);
      throw new PolymarketHttpException(status, body,
          "%s %s returned HTTP %d: %s".formatted(request.method(), request.uri().getPath(), status, body));
    }
    return response.body();
  }

  private static String truncate(String body) {
    if (body == null) {
      return "";
    }
    return body.length() <= MAX_ERROR_BODY_CHARS ? body : body.substring(0, MAX_ERROR_BODY_CHARS) + "...";
  }
}
