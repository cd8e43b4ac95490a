package com.polycopy.copytrade.config;

import com.polycopy.copytrade.store.JdbcCheckpointStore;
import com.polycopy.copytrade.store.JdbcTradeRecordStore;
import com.polycopy.store.CheckpointStore;
import com.polycopy.store.InMemoryCheckpointStore;
import com.polycopy.store.InMemoryTradeRecordSink;
import com.polycopy.store.TradeRecordSink;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Checkpoint and trade stores: PostgreSQL by default, in-memory with
 * {@code polycopy.persistence.enabled=false}.
 */
@Configuration
public class PersistenceConfiguration {

    @Slf4j
    @Configuration
    @ConditionalOnProperty(prefix = "polycopy.persistence", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class Jdbc {

        @Bean
        CheckpointStore checkpointStore(JdbcTemplate jdbcTemplate) {
            log.info("persistence: JDBC checkpoint and trade stores");
            return new JdbcCheckpointStore(jdbcTemplate);
        }

        @Bean
        TradeRecordSink tradeRecordSink(JdbcTemplate jdbcTemplate) {
            return new JdbcTradeRecordStore(jdbcTemplate);
        }
    }

    @Slf4j
    @Configuration
    @ConditionalOnProperty(prefix = "polycopy.persistence", name = "enabled", havingValue = "false")
    static class InMemory {

        @Bean
        CheckpointStore checkpointStore() {
            log.warn("persistence disabled: checkpoints and trades are kept in memory only");
            return new InMemoryCheckpointStore();
        }

        @Bean
        TradeRecordSink tradeRecordSink() {
            return new InMemoryTradeRecordSink();
        }
    }
}
