package com.polycopy.activity;

import com.polycopy.domain.Activity;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * In-process fan-out of activity batches to per-wallet subscribers.
 */
public interface ActivityBroker extends AutoCloseable {

  /**
   * Attach {@code subscriber} to {@code walletAddress}. Subscribing the same instance twice
   * delivers every batch to it twice.
   */
  void subscribe(String walletAddress, ActivitySubscriber subscriber);

  /**
   * Hand {@code batch} to every subscriber of {@code walletAddress} without waiting for them.
   *
   * @return one future per subscriber, completed once that subscriber has processed the batch;
   *     empty when there is nothing to deliver
   */
  List<CompletableFuture<DispatchOutcome>> publish(String walletAddress, List<Activity> batch);

  int subscriberCount(String walletAddress);

  /**
   * Subscriber counts keyed by wallet.
   */
  Map<String, Integer> subscriptions();

  /**
   * Stop accepting batches and wait for in-flight dispatches to finish.
   */
  @Override
  void close();
}
