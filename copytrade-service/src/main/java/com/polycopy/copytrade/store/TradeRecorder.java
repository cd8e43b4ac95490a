package com.polycopy.copytrade.store;

import com.polycopy.activity.ActivitySubscriber;
import com.polycopy.domain.Activity;
import com.polycopy.store.TradeRecord;
import com.polycopy.store.TradeRecordSink;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persists observed trades of watched wallets. Re-delivered trades are ignored by the sink.
 */
@RequiredArgsConstructor
@Slf4j
public class TradeRecorder implements ActivitySubscriber {

    private final @NonNull TradeRecordSink sink;

    private final AtomicLong recorded = new AtomicLong();

    @Override
    public void onActivities(String walletAddress, List<Activity> batch) {
        int inserted = 0;
        for (Activity activity : batch) {
            Optional<TradeRecord> record = TradeRecord.of(activity);
            if (record.isPresent() && sink.insertIfAbsent(record.get())) {
                inserted++;
            }
        }
        recorded.addAndGet(inserted);
        if (inserted > 0) {
            log.info("saved {} new trades for {}", inserted, walletAddress);
        }
    }

    @Override
    public String name() {
        return "trade-recorder";
    }

    public long recordedTrades() {
        return recorded.get();
    }
}
