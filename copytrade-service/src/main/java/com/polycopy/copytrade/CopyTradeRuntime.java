package com.polycopy.copytrade;

import com.polycopy.activity.ActivityBroker;
import com.polycopy.activity.WalletPoller;
import com.polycopy.config.PolycopyProperties;
import com.polycopy.copytrade.engine.CopyStrategy;
import com.polycopy.copytrade.engine.CopyTradeEngine;
import com.polycopy.copytrade.engine.Sleeper;
import com.polycopy.copytrade.execution.TradeExecutionGateway;
import com.polycopy.copytrade.store.TradeRecorder;
import com.polycopy.store.TradeRecordSink;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Builds one engine per enabled follower, wires engines and the trade recorder to the broker,
 * and starts and stops the poller with the application.
 */
@Slf4j
@Component
public class CopyTradeRuntime {

    private final PolycopyProperties properties;
    private final ActivityBroker broker;
    private final WalletPoller poller;
    private final TradeRecorder tradeRecorder;
    private final Map<String, CopyTradeEngine> engines = new LinkedHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    public CopyTradeRuntime(
            PolycopyProperties properties,
            ActivityBroker broker,
            WalletPoller poller,
            TradeExecutionGateway gateway,
            TradeRecordSink tradeRecordSink,
            Sleeper backoffSleeper,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.properties = properties;
        this.broker = broker;
        this.poller = poller;
        this.tradeRecorder = new TradeRecorder(tradeRecordSink);

        for (PolycopyProperties.Follower follower : properties.followers()) {
            if (!follower.enabled()) {
                log.info("follower {} is disabled, skipping", follower.name());
                continue;
            }
            if (engines.containsKey(follower.name())) {
                throw new IllegalStateException("duplicate follower name: " + follower.name());
            }
            CopyStrategy strategy;
            try {
                strategy = CopyStrategy.from(follower.copyStrategy());
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("invalid copy strategy for follower %s: %s"
                        .formatted(follower.name(), e.getMessage()), e);
            }
            engines.put(follower.name(),
                    new CopyTradeEngine(follower.name(), strategy, gateway, backoffSleeper, clock, meterRegistry));
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        List<String> wallets = properties.watchedWallets();

        log.info("============================================================");
        log.info("  polycopy - starting");
        log.info("  Mode: {}", properties.mode());
        log.info("  Watched wallets: {}", wallets.size());
        log.info("  Followers: {}", engines.keySet());
        log.info("============================================================");

        if (wallets.isEmpty()) {
            log.warn("no wallets configured under polycopy.monitoring.wallets or follower targets, nothing to poll");
            return;
        }

        for (String wallet : wallets) {
            broker.subscribe(wallet, tradeRecorder);
        }
        for (PolycopyProperties.Follower follower : properties.followers()) {
            CopyTradeEngine engine = engines.get(follower.name());
            if (engine == null) {
                continue;
            }
            for (String target : properties.targetsOf(follower)) {
                engine.follow(broker, target);
            }
        }
        poller.start(wallets);
    }

    @PreDestroy
    public void stop() {
        if (!started.get()) {
            return;
        }
        log.info("stopping polycopy");
        Duration timeout = Duration.ofSeconds(properties.queue().shutdownTimeoutSeconds());
        poller.stop(timeout);
        broker.close();
        engines.values().forEach(CopyTradeEngine::logStats);
        log.info("recorded {} trades this session", tradeRecorder.recordedTrades());
    }

    public List<CopyTradeEngine> engines() {
        return new ArrayList<>(engines.values());
    }

    public boolean isStarted() {
        return started.get();
    }
}
