package com.polycopy.copytrade.execution;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.util.Optional;

/**
 * Forwards intents to the executor service: fill-or-kill market orders sized in USDC, and
 * good-till-date limit orders sized in shares at the limit price.
 */
@RequiredArgsConstructor
@Slf4j
public class ExecutorTradeExecutionGateway implements TradeExecutionGateway {

    private static final int SHARE_SCALE = 2;

    private final @NonNull ExecutorApiClient executorApi;
    private final @NonNull InstrumentResolver instrumentResolver;
    private final @NonNull Clock clock;

    @Override
    public Optional<String> resolveInstrument(String conditionId, String outcome) {
        return instrumentResolver.resolve(conditionId, outcome);
    }

    @Override
    public OrderResult submit(TradeIntent intent) {
        OrderSubmissionResult result;
        try {
            result = switch (intent.orderType()) {
                case MARKET -> executorApi.placeMarketOrder(new MarketOrderRequest(
                        intent.tokenId(),
                        intent.side(),
                        intent.amount(),
                        intent.price(),
                        "FOK"));
                case LIMIT -> executorApi.placeLimitOrder(new LimitOrderRequest(
                        intent.tokenId(),
                        intent.side(),
                        intent.price(),
                        shares(intent),
                        "GTD",
                        expirationSeconds(intent)));
            };
        } catch (TradeExecutionException e) {
            throw e;
        } catch (RuntimeException e) {
            throw ExecutionFailureClassifier.classify(e);
        }

        JsonNode resp = result == null ? null : result.clobResponse();
        if (resp != null && resp.has("success") && !resp.path("success").asBoolean(true)) {
            throw ExecutionFailureClassifier.classifyRejection(resp.path("errorMsg").asText(null));
        }
        String orderId = resolveOrderId(resp);
        String status = resp != null && resp.hasNonNull("status") ? resp.get("status").asText() : "UNKNOWN";
        log.info("executor accepted {} {} {} order {} (status: {})",
                intent.followerName(), intent.orderType(), intent.side(), orderId, status);
        return new OrderResult(orderId, status, false);
    }

    private static BigDecimal shares(TradeIntent intent) {
        BigDecimal shares = intent.amount().divide(intent.price(), SHARE_SCALE, RoundingMode.DOWN);
        if (shares.signum() <= 0) {
            throw new OrderExecutionException("Order execution failed: $%s at %s is less than one tick of shares"
                    .formatted(intent.amount(), intent.price()));
        }
        return shares;
    }

    private Long expirationSeconds(TradeIntent intent) {
        if (intent.expiresAt() == null) {
            return null;
        }
        return Math.max(1L, intent.expiresAt().getEpochSecond() - clock.instant().getEpochSecond());
    }

    private static String resolveOrderId(JsonNode resp) {
        if (resp == null) {
            return null;
        }
        if (resp.hasNonNull("orderID")) {
            return resp.get("orderID").asText();
        }
        if (resp.hasNonNull("orderId")) {
            return resp.get("orderId").asText();
        }
        return null;
    }
}
