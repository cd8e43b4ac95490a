package com.polycopy.copytrade.store;

import com.polycopy.store.TradeRecord;
import com.polycopy.store.TradeRecordSink;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;

@RequiredArgsConstructor
public class JdbcTradeRecordStore implements TradeRecordSink {

    static final String INSERT_SQL = """
            INSERT INTO trades (transaction_hash, wallet_address, market_id, outcome, amount, price, timestamp)
            VALUES (?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT (transaction_hash) DO NOTHING
            """;

    private final @NonNull JdbcTemplate jdbcTemplate;

    @Override
    public boolean insertIfAbsent(TradeRecord record) {
        int rows = jdbcTemplate.update(INSERT_SQL,
                record.transactionHash(),
                record.walletAddress(),
                record.marketId(),
                record.outcome(),
                record.amount(),
                record.price(),
                Timestamp.from(record.timestamp()));
        return rows > 0;
    }
}
