package com.polycopy.activity;

import com.polycopy.domain.Activity;

import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Receives every batch published for the wallets it is subscribed to, one batch at a time.
 */
@FunctionalInterface
public interface ActivitySubscriber {

  void onActivities(String walletAddress, List<Activity> batch);

  /**
   * Label used in logs and {@link DispatchOutcome}s.
   */
  default String name() {
    return getClass().getSimpleName();
  }

  static ActivitySubscriber named(String name, Consumer<List<Activity>> consumer) {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(consumer, "consumer");
    return new ActivitySubscriber() {
      @Override
      public void onActivities(String walletAddress, List<Activity> batch) {
        consumer.accept(batch);
      }

      @Override
      public String name() {
        return name;
      }
    };
  }
}
