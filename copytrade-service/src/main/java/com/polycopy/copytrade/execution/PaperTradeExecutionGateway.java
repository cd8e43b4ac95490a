package com.polycopy.copytrade.execution;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Acknowledges every intent locally. Instruments are still resolved against the CLOB so paper runs
 * exercise the same lookup as live ones.
 */
@RequiredArgsConstructor
@Slf4j
public class PaperTradeExecutionGateway implements TradeExecutionGateway {

    private final @NonNull InstrumentResolver instrumentResolver;

    private final AtomicLong orderSeq = new AtomicLong();

    @Override
    public Optional<String> resolveInstrument(String conditionId, String outcome) {
        return instrumentResolver.resolve(conditionId, outcome);
    }

    @Override
    public OrderResult submit(TradeIntent intent) {
        String orderId = "paper-" + orderSeq.incrementAndGet();
        log.info("[PAPER] {} {} {} ${} of {} ({}) price={} expiresAt={} -> {}",
                intent.followerName(), intent.orderType(), intent.side(), intent.amount(),
                intent.outcome(), intent.tokenId(), intent.price(), intent.expiresAt(), orderId);
        return new OrderResult(orderId, "FILLED", true);
    }

    public long submittedOrders() {
        return orderSeq.get();
    }
}
