package com.polycopy.copytrade.execution;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.polycopy.domain.OrderSide;
import com.polycopy.domain.OrderType;
import com.polycopy.polymarket.http.PolymarketHttpException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutorTradeExecutionGatewayTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    @Mock
    private ExecutorApiClient executorApi;

    @Mock
    private InstrumentResolver instrumentResolver;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ExecutorTradeExecutionGateway gateway;

    @BeforeEach
    void setUp() {
        gateway = new ExecutorTradeExecutionGateway(executorApi, instrumentResolver, Clock.fixed(NOW, ZoneId.of("UTC")));
    }

    @Test
    void marketIntentBecomesFillOrKillOrderInUsdc() {
        when(executorApi.placeMarketOrder(any())).thenReturn(accepted("order-1"));

        OrderResult result = gateway.submit(intent(OrderType.MARKET, new BigDecimal("20"), null, null));

        ArgumentCaptor<MarketOrderRequest> captor = ArgumentCaptor.forClass(MarketOrderRequest.class);
        verify(executorApi).placeMarketOrder(captor.capture());
        assertThat(captor.getValue().orderType()).isEqualTo("FOK");
        assertThat(captor.getValue().amount()).isEqualByComparingTo("20");
        assertThat(captor.getValue().tokenId()).isEqualTo("111");
        assertThat(result.orderId()).isEqualTo("order-1");
        assertThat(result.paper()).isFalse();
    }

    @Test
    void limitIntentIsSizedInSharesAtTheLimitPrice() {
        when(executorApi.placeLimitOrder(any())).thenReturn(accepted("order-2"));

        gateway.submit(intent(OrderType.LIMIT, new BigDecimal("21"), new BigDecimal("0.40"), NOW.plusSeconds(7_200)));

        ArgumentCaptor<LimitOrderRequest> captor = ArgumentCaptor.forClass(LimitOrderRequest.class);
        verify(executorApi).placeLimitOrder(captor.capture());
        LimitOrderRequest request = captor.getValue();
        assertThat(request.orderType()).isEqualTo("GTD");
        assertThat(request.size()).isEqualByComparingTo("52.50");
        assertThat(request.price()).isEqualByComparingTo("0.40");
        assertThat(request.expirationSeconds()).isEqualTo(7_200L);
    }

    @Test
    void httpFailuresAreClassified() {
        when(executorApi.placeMarketOrder(any()))
                .thenThrow(new PolymarketHttpException(400, "{\"error\":\"not enough balance\"}", "HTTP 400"))
                .thenThrow(new PolymarketHttpException(504, "", "HTTP 504"));

        TradeIntent intent = intent(OrderType.MARKET, BigDecimal.TEN, null, null);

        assertThatThrownBy(() -> gateway.submit(intent)).isInstanceOf(InsufficientBalanceException.class);
        assertThatThrownBy(() -> gateway.submit(intent)).isInstanceOf(NetworkException.class);
    }

    @Test
    void unsuccessfulClobResponseIsRejected() {
        ObjectNode clob = objectMapper.createObjectNode();
        clob.put("success", false);
        clob.put("errorMsg", "order couldn't be fully filled");
        when(executorApi.placeMarketOrder(any())).thenReturn(new OrderSubmissionResult("LIVE", clob));

        assertThatThrownBy(() -> gateway.submit(intent(OrderType.MARKET, BigDecimal.TEN, null, null)))
                .isInstanceOf(OrderExecutionException.class)
                .hasMessageContaining("fully filled");
    }

    private OrderSubmissionResult accepted(String orderId) {
        ObjectNode clob = objectMapper.createObjectNode();
        clob.put("success", true);
        clob.put("orderID", orderId);
        clob.put("status", "matched");
        return new OrderSubmissionResult("LIVE", clob);
    }

    private static TradeIntent intent(OrderType type, BigDecimal amount, BigDecimal price, Instant expiresAt) {
        return new TradeIntent("alpha", "111", "0xcond", "Yes", OrderSide.BUY, amount, price, type, expiresAt, "0xtx");
    }
}
