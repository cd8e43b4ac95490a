package com.polycopy.polymarket.http;

import lombok.Getter;

/**
 * Non-2xx response from a Polymarket or executor endpoint. {@code statusCode} is {@code -1}
 * when the request never produced a response.
 */
@Getter
public class PolymarketHttpException extends RuntimeException {

  private final int statusCode;
  private final String responseBody;

  public PolymarketHttpException(int statusCode, String responseBody, String message) {
    super(message);
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public PolymarketHttpException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
    this.responseBody = null;
  }

  public boolean isServerUnavailable() {
    return statusCode == 502 || statusCode == 503 || statusCode == 504;
  }
}
