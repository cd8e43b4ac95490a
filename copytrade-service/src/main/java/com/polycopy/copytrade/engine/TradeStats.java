package com.polycopy.copytrade.engine;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-follower counters, mirrored to Micrometer under {@code copytrade.*}.
 */
public class TradeStats {

    private final AtomicLong totalActivities = new AtomicLong();
    private final AtomicLong filteredOut = new AtomicLong();
    private final AtomicLong tradesAttempted = new AtomicLong();
    private final AtomicLong tradesSucceeded = new AtomicLong();
    private final AtomicLong tradesFailed = new AtomicLong();

    private final Counter activitiesCounter;
    private final Counter filteredCounter;
    private final Counter attemptedCounter;
    private final Counter succeededCounter;
    private final Counter failedCounter;

    public TradeStats(String followerName, MeterRegistry meterRegistry) {
        this.activitiesCounter = counter("copytrade.activities.received", "Activities received from followed wallets", followerName, meterRegistry);
        this.filteredCounter = counter("copytrade.activities.filtered", "Activities rejected by type or trigger threshold", followerName, meterRegistry);
        this.attemptedCounter = counter("copytrade.trades.attempted", "Copy trades attempted", followerName, meterRegistry);
        this.succeededCounter = counter("copytrade.trades.succeeded", "Copy trades accepted by the gateway", followerName, meterRegistry);
        this.failedCounter = counter("copytrade.trades.failed", "Copy trades that failed after classification or retries", followerName, meterRegistry);
    }

    void received(int count) {
        totalActivities.addAndGet(count);
        activitiesCounter.increment(count);
    }

    void filtered() {
        filteredOut.incrementAndGet();
        filteredCounter.increment();
    }

    void attempted() {
        tradesAttempted.incrementAndGet();
        attemptedCounter.increment();
    }

    void succeeded() {
        tradesSucceeded.incrementAndGet();
        succeededCounter.increment();
    }

    void failed() {
        tradesFailed.incrementAndGet();
        failedCounter.increment();
    }

    public Snapshot snapshot() {
        return new Snapshot(
                totalActivities.get(),
                filteredOut.get(),
                tradesAttempted.get(),
                tradesSucceeded.get(),
                tradesFailed.get());
    }

    private static Counter counter(String name, String description, String follower, MeterRegistry registry) {
        return Counter.builder(name)
                .description(description)
                .tag("follower", follower)
                .register(registry);
    }

    public record Snapshot(
            long totalActivities,
            long filteredOut,
            long tradesAttempted,
            long tradesSucceeded,
            long tradesFailed
    ) {
    }
}
