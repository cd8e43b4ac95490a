package com.polycopy.activity;

/**
 * Result of handing one batch to one subscriber.
 *
 * @param failure what the subscriber threw, or {@code null} if it returned normally
 */
public record DispatchOutcome(
    String subscriberName,
    String walletAddress,
    int batchSize,
    Throwable failure
) {

  public static DispatchOutcome succeeded(String subscriberName, String walletAddress, int batchSize) {
    return new DispatchOutcome(subscriberName, walletAddress, batchSize, null);
  }

  public boolean isSuccess() {
    return failure == null;
  }
}
