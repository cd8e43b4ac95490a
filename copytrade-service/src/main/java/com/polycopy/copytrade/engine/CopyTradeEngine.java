package com.polycopy.copytrade.engine;

import com.polycopy.activity.ActivityBroker;
import com.polycopy.activity.ActivitySubscriber;
import com.polycopy.copytrade.execution.InsufficientBalanceException;
import com.polycopy.copytrade.execution.OrderExecutionException;
import com.polycopy.copytrade.execution.OrderResult;
import com.polycopy.copytrade.execution.TradeExecutionException;
import com.polycopy.copytrade.execution.TradeExecutionGateway;
import com.polycopy.copytrade.execution.TradeIntent;
import com.polycopy.domain.Activity;
import com.polycopy.domain.OrderSide;
import com.polycopy.domain.OrderType;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Copies trades of followed wallets for one follower.
 *
 * For each activity received from the broker:
 * 1. Non-trades and trades below the trigger amount are filtered out
 * 2. Trades missing market, outcome or side are skipped
 * 3. The copy amount is sized from the follower's strategy and clamped to its min/max
 * 4. The outcome is resolved to a token and the order submitted, retrying network failures
 */
@Slf4j
public class CopyTradeEngine implements ActivitySubscriber {

    static final int MAX_ATTEMPTS = 3;
    static final BigDecimal ALLOCATE_FRACTION = new BigDecimal("0.10");

    private final String followerName;
    private final CopyStrategy strategy;
    private final TradeExecutionGateway gateway;
    private final Sleeper sleeper;
    private final Clock clock;
    private final TradeStats stats;

    public CopyTradeEngine(
            String followerName,
            CopyStrategy strategy,
            TradeExecutionGateway gateway,
            Sleeper sleeper,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.followerName = Objects.requireNonNull(followerName, "followerName");
        this.strategy = Objects.requireNonNull(strategy, "strategy");
        this.gateway = Objects.requireNonNull(gateway, "gateway");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.stats = new TradeStats(followerName, meterRegistry);
    }

    /**
     * Subscribe this engine to {@code targetWallet}'s activity.
     */
    public void follow(ActivityBroker broker, String targetWallet) {
        broker.subscribe(targetWallet, this);
        log.info("{} now copying {} ({} mode, {} orders)", followerName, targetWallet,
                strategy.copyMode(), strategy.orderType());
    }

    @Override
    public String name() {
        return "copy-trader:" + followerName;
    }

    @Override
    public void onActivities(String walletAddress, List<Activity> batch) {
        stats.received(batch.size());
        for (Activity activity : batch) {
            try {
                process(activity);
            } catch (RuntimeException e) {
                log.error("{} failed to process activity {} from {}", followerName,
                        activity.transactionHash(), walletAddress, e);
                stats.failed();
            }
        }
    }

    public TradeStats.Snapshot stats() {
        return stats.snapshot();
    }

    public String followerName() {
        return followerName;
    }

    public CopyStrategy strategy() {
        return strategy;
    }

    public void logStats() {
        TradeStats.Snapshot s = stats.snapshot();
        log.info("=== Copy trade stats: {} ===", followerName);
        log.info("  Total activities: {}", s.totalActivities());
        log.info("  Filtered out:     {}", s.filteredOut());
        log.info("  Trades attempted: {}", s.tradesAttempted());
        log.info("  Trades succeeded: {}", s.tradesSucceeded());
        log.info("  Trades failed:    {}", s.tradesFailed());
    }

    private void process(Activity activity) {
        if (!activity.isTrade()) {
            log.debug("{} skipping {} activity {}", followerName, activity.type(), activity.transactionHash());
            stats.filtered();
            return;
        }

        BigDecimal tradeValue = activity.tradeValue();
        if (tradeValue.compareTo(strategy.minTriggerAmount()) < 0) {
            log.debug("{} trade value ${} below trigger ${}, skipping {}", followerName, tradeValue,
                    strategy.minTriggerAmount(), activity.transactionHash());
            stats.filtered();
            return;
        }

        Optional<String> conditionId = activity.conditionIdValue();
        Optional<String> outcome = activity.outcomeValue();
        Optional<OrderSide> side = activity.sideValue();
        if (conditionId.isEmpty() || outcome.isEmpty() || side.isEmpty()) {
            log.warn("{} incomplete trade {} (conditionId={} outcome={} side={}), skipping", followerName,
                    activity.transactionHash(), activity.conditionId(), activity.outcome(), activity.side());
            return;
        }

        BigDecimal amount = copyAmount(tradeValue);
        if (amount.signum() <= 0) {
            log.warn("{} computed non-positive copy amount ${} for {}, skipping", followerName, amount,
                    activity.transactionHash());
            return;
        }

        log.info("{} copying {} {} ${} of '{}' ({}) -> ${}", followerName, side.get(), outcome.get(),
                tradeValue, activity.title() == null ? conditionId.get() : activity.title(), activity.walletAddress(), amount);

        stats.attempted();

        Optional<String> tokenId;
        try {
            tokenId = gateway.resolveInstrument(conditionId.get(), outcome.get());
        } catch (RuntimeException e) {
            log.error("{} instrument lookup failed for {} / {}: {}", followerName, conditionId.get(), outcome.get(), e.toString());
            stats.failed();
            return;
        }
        if (tokenId.isEmpty()) {
            log.error("{} no token for outcome '{}' in market {}", followerName, outcome.get(), conditionId.get());
            stats.failed();
            return;
        }

        TradeIntent intent;
        try {
            intent = intent(activity, tokenId.get(), side.get(), amount);
        } catch (OrderExecutionException e) {
            log.error("{} {}", followerName, e.getMessage());
            stats.failed();
            return;
        }

        if (executeWithRetry(intent).isPresent()) {
            stats.succeeded();
        } else {
            stats.failed();
        }
    }

    /**
     * Copy size in USDC for a trade of {@code tradeValue}, before any order type adjustment.
     */
    BigDecimal copyAmount(BigDecimal tradeValue) {
        BigDecimal amount = switch (strategy.copyMode()) {
            case SCALE -> tradeValue.multiply(strategy.scalePercentage()).movePointLeft(2);
            case ALLOCATE -> {
                // fixed fraction until portfolio-aware allocation exists
                log.warn("{} ALLOCATE mode uses a fixed {}% of the observed trade", followerName,
                        ALLOCATE_FRACTION.movePointRight(2).stripTrailingZeros().toPlainString());
                yield tradeValue.multiply(ALLOCATE_FRACTION);
            }
        };

        if (strategy.minTradeAmount().signum() > 0 && amount.compareTo(strategy.minTradeAmount()) < 0) {
            log.debug("{} raising ${} to min trade ${}", followerName, amount, strategy.minTradeAmount());
            amount = strategy.minTradeAmount();
        }
        if (strategy.maxTradeAmount().signum() > 0 && amount.compareTo(strategy.maxTradeAmount()) > 0) {
            log.debug("{} capping ${} at max trade ${}", followerName, amount, strategy.maxTradeAmount());
            amount = strategy.maxTradeAmount();
        }
        return amount;
    }

    private TradeIntent intent(Activity activity, String tokenId, OrderSide side, BigDecimal amount) {
        BigDecimal price = activity.priceValue().orElse(null);
        Instant expiresAt = null;
        if (strategy.orderType() == OrderType.LIMIT) {
            if (price == null) {
                throw new OrderExecutionException("Order execution failed: limit order for %s needs a price"
                        .formatted(activity.transactionHash()));
            }
            expiresAt = clock.instant().plus(strategy.limitOrderDuration());
        }
        return new TradeIntent(
                followerName,
                tokenId,
                activity.conditionId(),
                activity.outcome(),
                side,
                amount,
                price,
                strategy.orderType(),
                expiresAt,
                activity.transactionHash());
    }

    private Optional<OrderResult> executeWithRetry(TradeIntent intent) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            try {
                OrderResult result = gateway.submit(intent);
                log.info("{} order placed: {} (status: {}, attempt {})", followerName, result.orderId(),
                        result.status(), attempt + 1);
                return Optional.of(result);
            } catch (InsufficientBalanceException e) {
                log.error("{} insufficient balance: {}", followerName, e.getMessage());
                return Optional.empty();
            } catch (TradeExecutionException e) {
                if (!e.isRetryable()) {
                    log.error("{} {}", followerName, e.getMessage());
                    return Optional.empty();
                }
                if (attempt + 1 >= MAX_ATTEMPTS) {
                    log.error("{} giving up after {} attempts: {}", followerName, MAX_ATTEMPTS, e.getMessage());
                    return Optional.empty();
                }
                Duration backoff = Duration.ofSeconds(1L << attempt);
                log.warn("{} retryable error on attempt {}/{}, retrying in {}s: {}", followerName, attempt + 1,
                        MAX_ATTEMPTS, backoff.toSeconds(), e.getMessage());
                try {
                    sleeper.sleep(backoff);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("{} interrupted during backoff, abandoning trade", followerName);
                    return Optional.empty();
                }
            } catch (RuntimeException e) {
                log.error("{} unexpected error submitting order for {}", followerName, intent.sourceTransactionHash(), e);
                return Optional.empty();
            }
        }
        return Optional.empty();
    }
}
