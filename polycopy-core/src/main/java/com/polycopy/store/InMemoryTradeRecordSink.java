package com.polycopy.store;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class InMemoryTradeRecordSink implements TradeRecordSink {

  private final Map<String, TradeRecord> records = new ConcurrentHashMap<>();

  @Override
  public boolean insertIfAbsent(TradeRecord record) {
    return records.putIfAbsent(record.transactionHash(), record) == null;
  }

  public List<TradeRecord> records() {
    return List.copyOf(records.values());
  }

  public int size() {
    return records.size();
  }
}
