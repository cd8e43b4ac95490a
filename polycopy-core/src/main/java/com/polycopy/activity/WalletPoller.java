package com.polycopy.activity;

import com.polycopy.config.PolycopyProperties;
import com.polycopy.domain.Activity;
import com.polycopy.store.CheckpointStore;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polls the activity feed for each watched wallet on a dedicated thread and publishes new
 * activity to the broker.
 *
 * A cycle pages forward from the wallet's checkpoint until the feed returns a short page. The
 * checkpoint advances, and is persisted, after each page has been handed to the broker. A failed
 * cycle leaves the checkpoint where it was so the next cycle fetches the same page again.
 */
@Slf4j
public class WalletPoller {

  private final ActivityFeedClient feed;
  private final ActivityBroker broker;
  private final CheckpointStore checkpointStore;
  private final PolycopyProperties.Monitoring settings;
  private final Clock clock;

  private final Map<String, WalletState> wallets = new ConcurrentHashMap<>();
  private final List<Thread> threads = new CopyOnWriteArrayList<>();
  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final AtomicBoolean started = new AtomicBoolean(false);

  public WalletPoller(@NonNull ActivityFeedClient feed,
                      @NonNull ActivityBroker broker,
                      @NonNull CheckpointStore checkpointStore,
                      @NonNull PolycopyProperties.Monitoring settings,
                      @NonNull Clock clock) {
    this.feed = feed;
    this.broker = broker;
    this.checkpointStore = checkpointStore;
    this.settings = settings;
    this.clock = clock;
  }

  /**
   * Start one polling thread per wallet. Can only be called once.
   */
  public void start(Collection<String> walletAddresses) {
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("wallet poller already started");
    }
    log.info("starting wallet poller: wallets={} pollInterval={}s batchSize={} resumeFromCheckpoint={}",
        walletAddresses.size(), settings.pollIntervalSeconds(), pageSize(), settings.resumeFromCheckpoint());
    for (String wallet : walletAddresses) {
      WalletState state = state(wallet);
      Thread t = new Thread(() -> runLoop(state), "wallet-poller-" + shortAddress(state.walletAddress));
      t.setDaemon(true);
      threads.add(t);
      t.start();
    }
  }

  /**
   * Signal every loop to stop after its current fetch or sleep and wait up to {@code timeout} for them.
   */
  public void stop(Duration timeout) {
    stopSignal.countDown();
    long deadline = System.nanoTime() + timeout.toNanos();
    for (Thread t : threads) {
      long remainingMillis = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
      if (remainingMillis <= 0) {
        break;
      }
      try {
        t.join(remainingMillis);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      }
    }
    long alive = threads.stream().filter(Thread::isAlive).count();
    if (alive > 0) {
      log.warn("{} wallet poller threads still running after {}s", alive, timeout.toSeconds());
    } else {
      log.info("wallet poller stopped");
    }
  }

  public boolean isStopping() {
    return stopSignal.getCount() == 0;
  }

  /**
   * Run a single cycle for {@code walletAddress}: fetch and publish until caught up.
   *
   * @return the number of activities published
   */
  public int pollOnce(String walletAddress) {
    WalletState state = state(walletAddress);
    state.cycles.incrementAndGet();
    state.lastPollAtMillis = clock.millis();

    Instant start = state.checkpoint;
    int batchSize = pageSize();
    int offset = 0;
    int published = 0;
    while (true) {
      Instant end = clock.instant().plusSeconds(settings.lookaheadSeconds());
      ActivityPage fetched = feed.fetch(state.walletAddress, start, end, batchSize, offset);
      if (fetched == null || fetched.isEmpty()) {
        break;
      }
      List<Activity> page = fetched.activities();

      List<Activity> fresh = state.undelivered(page);
      if (!fresh.isEmpty()) {
        broker.publish(state.walletAddress, fresh);
        published += fresh.size();
        state.published.addAndGet(fresh.size());
      }
      if (state.advance(page)) {
        checkpointStore.set(state.walletAddress, state.checkpoint);
      }

      if (fetched.rowCount() < batchSize || isStopping()) {
        break;
      }
      offset += batchSize;
    }

    if (published > 0) {
      log.info("wallet {} published={} checkpoint={}", state.walletAddress, published, state.checkpoint);
    }
    return published;
  }

  public List<WalletStatus> status() {
    List<WalletStatus> out = new ArrayList<>(wallets.size());
    for (WalletState s : wallets.values()) {
      out.add(new WalletStatus(
          s.walletAddress,
          s.checkpoint,
          s.cycles.get(),
          s.published.get(),
          s.failures.get(),
          s.lastPollAtMillis == 0 ? null : Instant.ofEpochMilli(s.lastPollAtMillis)));
    }
    return out;
  }

  /**
   * Current in-memory checkpoint for {@code walletAddress}, initialising the wallet if needed.
   */
  public Instant checkpoint(String walletAddress) {
    return state(walletAddress).checkpoint;
  }

  private void runLoop(WalletState state) {
    log.info("polling wallet {} from {}", state.walletAddress, state.checkpoint);
    while (!isStopping()) {
      try {
        pollOnce(state.walletAddress);
      } catch (Exception e) {
        state.failures.incrementAndGet();
        log.error("poll cycle failed for wallet {} at checkpoint {}: {}", state.walletAddress, state.checkpoint, e.toString(), e);
      }
      try {
        if (stopSignal.await(settings.pollIntervalSeconds(), TimeUnit.SECONDS)) {
          break;
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        break;
      }
    }
    log.info("stopped polling wallet {} at checkpoint {}", state.walletAddress, state.checkpoint);
  }

  private WalletState state(String walletAddress) {
    String key = walletAddress.trim().toLowerCase(Locale.ROOT);
    return wallets.computeIfAbsent(key, this::initialState);
  }

  private WalletState initialState(String walletAddress) {
    Instant initial = null;
    if (settings.resumeFromCheckpoint()) {
      initial = checkpointStore.get(walletAddress).orElse(null);
    }
    if (initial == null) {
      initial = clock.instant();
    }
    log.debug("wallet {} initial checkpoint {}", walletAddress, initial);
    return new WalletState(walletAddress, initial);
  }

  // a page the feed truncates would otherwise read as the last one
  private int pageSize() {
    return Math.max(1, Math.min(settings.batchSize(), feed.maxPageSize()));
  }

  private static String shortAddress(String address) {
    return address.length() <= 10 ? address : address.substring(0, 10);
  }

  public record WalletStatus(
      String walletAddress,
      Instant checkpoint,
      long cycles,
      long publishedActivities,
      long failures,
      Instant lastPollAt
  ) {
  }

  private static final class WalletState {

    private final String walletAddress;
    private volatile Instant checkpoint;
    // keys of activities already delivered whose timestamp equals the checkpoint
    private final Set<String> boundaryKeys = new HashSet<>();
    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong published = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private volatile long lastPollAtMillis;

    private WalletState(String walletAddress, Instant checkpoint) {
      this.walletAddress = walletAddress;
      this.checkpoint = checkpoint;
    }

    synchronized List<Activity> undelivered(List<Activity> page) {
      List<Activity> out = new ArrayList<>(page.size());
      for (Activity a : page) {
        if (a.timestamp().isBefore(checkpoint)) {
          continue;
        }
        if (a.timestamp().equals(checkpoint) && boundaryKeys.contains(a.dedupKey())) {
          continue;
        }
        out.add(a);
      }
      return out;
    }

    /**
     * @return true if the checkpoint moved
     */
    synchronized boolean advance(List<Activity> page) {
      Instant pageMax = checkpoint;
      for (Activity a : page) {
        if (a.timestamp().isAfter(pageMax)) {
          pageMax = a.timestamp();
        }
      }
      boolean moved = pageMax.isAfter(checkpoint);
      if (moved) {
        boundaryKeys.clear();
        checkpoint = pageMax;
      }
      for (Activity a : page) {
        if (a.timestamp().equals(checkpoint)) {
          boundaryKeys.add(a.dedupKey());
        }
      }
      return moved;
    }
  }
}
