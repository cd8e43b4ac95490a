package com.polycopy.activity;

import com.polycopy.domain.Activity;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Broker backed by a fixed pool of dispatch workers.
 *
 * Each subscription owns a lane: its batches run one after another in publish order, while
 * different subscriptions proceed in parallel on the shared pool. A subscriber that throws only
 * fails its own dispatch.
 */
@Slf4j
public class InMemoryActivityBroker implements ActivityBroker {

  private final ThreadPoolExecutor executor;
  private final Duration shutdownTimeout;
  private final Map<String, CopyOnWriteArrayList<Subscription>> subscriptions = new ConcurrentHashMap<>();
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public InMemoryActivityBroker(int maxWorkers, Duration shutdownTimeout) {
    if (maxWorkers < 1) {
      throw new IllegalArgumentException("maxWorkers must be >= 1");
    }
    this.shutdownTimeout = shutdownTimeout == null ? Duration.ofSeconds(30) : shutdownTimeout;
    this.executor = new ThreadPoolExecutor(
        maxWorkers,
        maxWorkers,
        60L,
        TimeUnit.SECONDS,
        new LinkedBlockingQueue<>(),
        new DispatchThreadFactory());
    this.executor.allowCoreThreadTimeOut(true);
  }

  @Override
  public void subscribe(String walletAddress, ActivitySubscriber subscriber) {
    Objects.requireNonNull(subscriber, "subscriber");
    String key = key(walletAddress);
    subscriptions.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(new Subscription(subscriber));
    log.info("subscribed {} to wallet {}", subscriber.name(), key);
  }

  @Override
  public List<CompletableFuture<DispatchOutcome>> publish(String walletAddress, List<Activity> batch) {
    if (batch == null || batch.isEmpty()) {
      return List.of();
    }
    String key = key(walletAddress);
    List<Subscription> subs = subscriptions.get(key);
    if (subs == null || subs.isEmpty()) {
      log.debug("no subscribers for wallet {}, dropping {} activities", key, batch.size());
      return List.of();
    }
    if (closed.get()) {
      log.warn("broker closed, dropping {} activities for wallet {}", batch.size(), key);
      return List.of();
    }

    List<Activity> snapshot = List.copyOf(batch);
    List<CompletableFuture<DispatchOutcome>> units = new ArrayList<>(subs.size());
    for (Subscription sub : subs) {
      units.add(sub.enqueue(key, snapshot));
    }
    return units;
  }

  @Override
  public int subscriberCount(String walletAddress) {
    List<Subscription> subs = subscriptions.get(key(walletAddress));
    return subs == null ? 0 : subs.size();
  }

  @Override
  public Map<String, Integer> subscriptions() {
    Map<String, Integer> out = new LinkedHashMap<>();
    subscriptions.forEach((wallet, subs) -> out.put(wallet, subs.size()));
    return out;
  }

  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    List<CompletableFuture<?>> tails = new ArrayList<>();
    for (List<Subscription> subs : subscriptions.values()) {
      for (Subscription sub : subs) {
        tails.add(sub.tail());
      }
    }
    log.info("closing activity broker, draining {} lanes (timeout {}s)", tails.size(), shutdownTimeout.toSeconds());
    try {
      CompletableFuture.allOf(tails.toArray(new CompletableFuture[0]))
          .get(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      log.warn("activity broker drain timed out after {}s, {} tasks still queued",
          shutdownTimeout.toSeconds(), executor.getQueue().size());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("interrupted while draining activity broker");
    } catch (ExecutionException e) {
      log.warn("activity broker drain failed: {}", e.toString());
    }
    executor.shutdownNow();
  }

  public boolean isClosed() {
    return closed.get();
  }

  private static String key(String walletAddress) {
    return Objects.requireNonNull(walletAddress, "walletAddress").trim().toLowerCase(Locale.ROOT);
  }

  private static Throwable unwrap(Throwable t) {
    if (t instanceof CompletionException && t.getCause() != null) {
      return t.getCause();
    }
    return t;
  }

  private final class Subscription {

    private final ActivitySubscriber subscriber;
    private CompletableFuture<DispatchOutcome> tail = CompletableFuture.completedFuture(null);

    private Subscription(ActivitySubscriber subscriber) {
      this.subscriber = subscriber;
    }

    synchronized CompletableFuture<DispatchOutcome> enqueue(String walletAddress, List<Activity> batch) {
      CompletableFuture<DispatchOutcome> unit = tail
          .thenApplyAsync(previous -> dispatch(walletAddress, batch), executor)
          .exceptionally(t -> new DispatchOutcome(subscriber.name(), walletAddress, batch.size(), unwrap(t)));
      tail = unit;
      return unit;
    }

    synchronized CompletableFuture<DispatchOutcome> tail() {
      return tail;
    }

    private DispatchOutcome dispatch(String walletAddress, List<Activity> batch) {
      try {
        subscriber.onActivities(walletAddress, batch);
        return DispatchOutcome.succeeded(subscriber.name(), walletAddress, batch.size());
      } catch (Exception e) {
        log.error("subscriber {} failed on {} activities for wallet {}", subscriber.name(), batch.size(), walletAddress, e);
        return new DispatchOutcome(subscriber.name(), walletAddress, batch.size(), e);
      }
    }
  }

  private static final class DispatchThreadFactory implements ThreadFactory {

    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable r) {
      Thread t = new Thread(r, "activity-dispatch-" + counter.incrementAndGet());
      t.setDaemon(true);
      return t;
    }
  }
}
