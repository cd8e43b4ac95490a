package com.polycopy.copytrade.execution;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.polymarket.clob.PolymarketClobClient;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves (conditionId, outcome) to a CLOB token id. Hits are cached for the lifetime of the
 * process; misses are not, since a market may not be listed on the CLOB yet.
 */
@RequiredArgsConstructor
@Slf4j
public class InstrumentResolver {

    private final @NonNull PolymarketClobClient clobClient;

    private final Map<String, String> cache = new ConcurrentHashMap<>();

    public Optional<String> resolve(String conditionId, String outcome) {
        if (conditionId == null || conditionId.isBlank() || outcome == null || outcome.isBlank()) {
            return Optional.empty();
        }
        String key = conditionId + "|" + outcome.trim().toLowerCase(Locale.ROOT);
        String cached = cache.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }

        JsonNode market = clobClient.getMarket(conditionId);
        Optional<String> tokenId = PolymarketClobClient.tokenIdForOutcome(market, outcome);
        if (tokenId.isPresent()) {
            cache.put(key, tokenId.get());
        } else {
            log.warn("no token for outcome '{}' in market {}", outcome, conditionId);
        }
        return tokenId;
    }

    public int cachedInstruments() {
        return cache.size();
    }
}
