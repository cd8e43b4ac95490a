package com.polycopy.copytrade.engine;

import com.polycopy.activity.ActivityBroker;
import com.polycopy.activity.DispatchOutcome;
import com.polycopy.activity.InMemoryActivityBroker;
import com.polycopy.copytrade.execution.InsufficientBalanceException;
import com.polycopy.copytrade.execution.NetworkException;
import com.polycopy.copytrade.execution.OrderExecutionException;
import com.polycopy.copytrade.execution.TradeExecutionException;
import com.polycopy.copytrade.execution.TradeIntent;
import com.polycopy.domain.Activity;
import com.polycopy.domain.ActivityType;
import com.polycopy.domain.CopyMode;
import com.polycopy.domain.OrderSide;
import com.polycopy.domain.OrderType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CopyTradeEngineTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");
    private static final String TARGET = "0xtarget";

    private StubTradeExecutionGateway gateway;
    private List<Duration> sleeps;
    private SimpleMeterRegistry meterRegistry;
    private Clock fixedClock;

    @BeforeEach
    void setUp() {
        gateway = new StubTradeExecutionGateway();
        sleeps = new ArrayList<>();
        meterRegistry = new SimpleMeterRegistry();
        fixedClock = Clock.fixed(NOW, ZoneId.of("UTC"));
    }

    @Test
    void scaleModeCopiesPercentageOfTradeValue() {
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));

        engine.onActivities(TARGET, List.of(trade("0x1", "100", null)));

        assertThat(gateway.getSubmitted()).hasSize(1);
        TradeIntent intent = gateway.getSubmitted().get(0);
        assertThat(intent.amount()).isEqualByComparingTo("20");
        assertThat(intent.tokenId()).isEqualTo("token-yes");
        assertThat(intent.side()).isEqualTo(OrderSide.BUY);
        assertThat(intent.orderType()).isEqualTo(OrderType.MARKET);
        assertThat(intent.expiresAt()).isNull();
        assertThat(intent.followerName()).isEqualTo("alpha");
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(1, 0, 1, 1, 0));
    }

    @Test
    void tradeValueFallsBackToSizeTimesPrice() {
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(50)));

        engine.onActivities(TARGET, List.of(trade("0x1", null, "0.5")));

        // 200 shares at 0.5 = $100, half of it copied
        assertThat(gateway.getSubmitted().get(0).amount()).isEqualByComparingTo("50");
    }

    @Test
    void amountIsClampedToMinAndMax() {
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(10))
                .withLimits(BigDecimal.ZERO, BigDecimal.TEN, BigDecimal.valueOf(200)));

        engine.onActivities(TARGET, List.of(
                trade("0xsmall", "50", null),
                trade("0xlarge", "5000", null)));

        assertThat(gateway.getSubmitted()).extracting(TradeIntent::amount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(BigDecimal.TEN, BigDecimal.valueOf(200));
    }

    @Test
    void allocateModeUsesFixedTenPercent() {
        CopyStrategy allocate = new CopyStrategy(CopyMode.ALLOCATE, null, null, null, null, null, null);
        CopyTradeEngine engine = engine(allocate);

        engine.onActivities(TARGET, List.of(trade("0x1", "250", null)));

        assertThat(gateway.getSubmitted().get(0).amount()).isEqualByComparingTo("25");
    }

    @Test
    void nonTradesAndTradesBelowTriggerAreFilteredOut() {
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20))
                .withLimits(BigDecimal.valueOf(50), null, null));

        engine.onActivities(TARGET, List.of(
                activity(ActivityType.REDEEM, "0xr", "100"),
                trade("0xsmall", "49.99", null),
                trade("0xok", "50", null)));

        assertThat(gateway.getSubmitted()).extracting(TradeIntent::sourceTransactionHash).containsExactly("0xok");
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(3, 2, 1, 1, 0));
    }

    @Test
    void incompleteTradeIsSkippedWithoutCounting() {
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));
        Activity noOutcome = new Activity(TARGET, ActivityType.TRADE, "0x1", "0xcond", null, OrderSide.BUY,
                BigDecimal.TEN, new BigDecimal("0.5"), BigDecimal.TEN, NOW, null, null, null);

        engine.onActivities(TARGET, List.of(noOutcome));

        assertThat(gateway.getSubmitted()).isEmpty();
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(1, 0, 0, 0, 0));
    }

    @Test
    void networkErrorsAreRetriedWithExponentialBackoff() {
        gateway.failNext(new NetworkException("timeout"), new NetworkException("timeout"));
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));

        engine.onActivities(TARGET, List.of(trade("0x1", "100", null)));

        assertThat(gateway.getSubmitted()).hasSize(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(1, 0, 1, 1, 0));
    }

    @Test
    void exhaustedRetriesCountAsOneFailedTrade() {
        gateway.failNext(new NetworkException("a"), new NetworkException("b"), new NetworkException("c"));
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));

        engine.onActivities(TARGET, List.of(trade("0x1", "100", null)));

        assertThat(gateway.getSubmitted()).hasSize(3);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2));
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(1, 0, 1, 0, 1));
    }

    @Test
    void terminalFailuresAreNotRetried() {
        gateway.failNext(
                new InsufficientBalanceException("not enough USDC"),
                new OrderExecutionException("rejected"),
                new IllegalStateException("bug"));
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));

        engine.onActivities(TARGET, List.of(
                trade("0x1", "100", null),
                trade("0x2", "100", null),
                trade("0x3", "100", null)));

        assertThat(gateway.getSubmitted()).hasSize(3);
        assertThat(sleeps).isEmpty();
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(3, 0, 3, 0, 3));
    }

    @Test
    void anyRetryableExecutionFailureIsRetried() {
        gateway.failNext(new TradeExecutionException("order book busy") {
            @Override
            public boolean isRetryable() {
                return true;
            }
        });
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));

        engine.onActivities(TARGET, List.of(trade("0x1", "100", null)));

        assertThat(gateway.getSubmitted()).hasSize(2);
        assertThat(sleeps).containsExactly(Duration.ofSeconds(1));
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(1, 0, 1, 1, 0));
    }

    @Test
    void unexpectedErrorWhileProcessingCountsAsFailedAndBatchContinues() {
        gateway.failNext(new NetworkException("timeout"));
        Sleeper broken = duration -> {
            throw new IllegalStateException("scheduler gone");
        };
        CopyTradeEngine engine = new CopyTradeEngine("alpha", CopyStrategy.scale(BigDecimal.valueOf(20)),
                gateway, broken, fixedClock, meterRegistry);

        engine.onActivities(TARGET, List.of(trade("0x1", "100", null), trade("0x2", "100", null)));

        assertThat(gateway.getSubmitted()).hasSize(2);
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(2, 0, 2, 1, 1));
    }

    @Test
    void instrumentResolutionFailureCountsAsFailedWithoutSubmitting() {
        gateway.failResolution(new IllegalStateException("clob down"));
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));

        engine.onActivities(TARGET, List.of(trade("0x1", "100", null)));

        assertThat(gateway.getSubmitted()).isEmpty();
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(1, 0, 1, 0, 1));
    }

    @Test
    void unknownInstrumentCountsAsFailed() {
        gateway.unknownInstrument();
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));

        engine.onActivities(TARGET, List.of(trade("0x1", "100", null)));

        assertThat(gateway.getSubmitted()).isEmpty();
        assertThat(engine.stats().tradesFailed()).isEqualTo(1);
    }

    @Test
    void limitOrdersCarryPriceAndGoodTillDateExpiry() {
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)).withOrderType(OrderType.LIMIT));

        engine.onActivities(TARGET, List.of(trade("0x1", "100", "0.42")));

        TradeIntent intent = gateway.getSubmitted().get(0);
        assertThat(intent.orderType()).isEqualTo(OrderType.LIMIT);
        assertThat(intent.price()).isEqualByComparingTo("0.42");
        assertThat(intent.expiresAt()).isEqualTo(NOW.plusSeconds(7_200));
    }

    @Test
    void limitOrderWithoutPriceFails() {
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)).withOrderType(OrderType.LIMIT));

        engine.onActivities(TARGET, List.of(trade("0x1", "100", null)));

        assertThat(gateway.getSubmitted()).isEmpty();
        assertThat(engine.stats()).isEqualTo(new TradeStats.Snapshot(1, 0, 1, 0, 1));
    }

    @Test
    void countersArePublishedToMeterRegistry() {
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));

        engine.onActivities(TARGET, List.of(trade("0x1", "100", null), activity(ActivityType.MERGE, "0x2", "1")));

        assertThat(meterRegistry.get("copytrade.activities.received").tag("follower", "alpha").counter().count())
                .isEqualTo(2.0);
        assertThat(meterRegistry.get("copytrade.activities.filtered").tag("follower", "alpha").counter().count())
                .isEqualTo(1.0);
        assertThat(meterRegistry.get("copytrade.trades.succeeded").tag("follower", "alpha").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void followSubscribesEngineThroughTheBroker() throws Exception {
        CopyTradeEngine engine = engine(CopyStrategy.scale(BigDecimal.valueOf(20)));
        try (ActivityBroker broker = new InMemoryActivityBroker(2, Duration.ofSeconds(5))) {
            engine.follow(broker, TARGET);

            List<CompletableFuture<DispatchOutcome>> units = broker.publish(TARGET, List.of(trade("0x1", "100", null)));

            assertThat(units).hasSize(1);
            assertThat(units.get(0).get(5, TimeUnit.SECONDS).subscriberName()).isEqualTo("copy-trader:alpha");
        }
        assertThat(engine.stats().tradesSucceeded()).isEqualTo(1);
    }

    @Test
    void scaleWithoutPercentageIsRejected() {
        assertThatThrownBy(() -> new CopyStrategy(CopyMode.SCALE, null, null, null, null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("scale_percentage");
    }

    private CopyTradeEngine engine(CopyStrategy strategy) {
        return new CopyTradeEngine("alpha", strategy, gateway, sleeps::add, fixedClock, meterRegistry);
    }

    private static Activity trade(String tx, String cash, String price) {
        return new Activity(TARGET, ActivityType.TRADE, tx, "0xcond", "Yes", OrderSide.BUY,
                BigDecimal.valueOf(200),
                price == null ? null : new BigDecimal(price),
                cash == null ? null : new BigDecimal(cash),
                NOW, "123", "Will it rain?", "will-it-rain");
    }

    private static Activity activity(ActivityType type, String tx, String cash) {
        return new Activity(TARGET, type, tx, "0xcond", "Yes", null,
                BigDecimal.ONE, null, new BigDecimal(cash), NOW, null, null, null);
    }
}
