package com.polycopy.store;

public interface TradeRecordSink {

  /**
   * @return {@code true} if the record was stored, {@code false} if its transaction hash was already present
   */
  boolean insertIfAbsent(TradeRecord record);
}
