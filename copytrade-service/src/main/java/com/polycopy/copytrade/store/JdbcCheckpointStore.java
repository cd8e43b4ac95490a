package com.polycopy.copytrade.store;

import com.polycopy.store.CheckpointStore;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

@RequiredArgsConstructor
public class JdbcCheckpointStore implements CheckpointStore {

    static final String SELECT_SQL = """
            SELECT last_synced_timestamp
            FROM wallet_checkpoints
            WHERE wallet_address = ?
            """;

    // keeps the later of the stored and offered timestamps
    static final String UPSERT_SQL = """
            INSERT INTO wallet_checkpoints (wallet_address, last_synced_timestamp, updated_at)
            VALUES (?, ?, now())
            ON CONFLICT (wallet_address) DO UPDATE
            SET last_synced_timestamp = GREATEST(wallet_checkpoints.last_synced_timestamp, EXCLUDED.last_synced_timestamp),
                updated_at = now()
            """;

    private final @NonNull JdbcTemplate jdbcTemplate;

    @Override
    public Optional<Instant> get(String walletAddress) {
        List<Timestamp> rows = jdbcTemplate.queryForList(SELECT_SQL, Timestamp.class, key(walletAddress));
        if (rows.isEmpty() || rows.get(0) == null) {
            return Optional.empty();
        }
        return Optional.of(rows.get(0).toInstant());
    }

    @Override
    public void set(String walletAddress, Instant timestamp) {
        jdbcTemplate.update(UPSERT_SQL, key(walletAddress), Timestamp.from(timestamp));
    }

    private static String key(String walletAddress) {
        return walletAddress.trim().toLowerCase(Locale.ROOT);
    }
}
