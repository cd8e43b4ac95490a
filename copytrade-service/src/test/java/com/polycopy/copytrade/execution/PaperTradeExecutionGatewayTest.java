package com.polycopy.copytrade.execution;

import com.polycopy.domain.OrderSide;
import com.polycopy.domain.OrderType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class PaperTradeExecutionGatewayTest {

    @Mock
    private InstrumentResolver instrumentResolver;

    @Test
    void acknowledgesEveryIntentWithSyntheticOrderIds() {
        PaperTradeExecutionGateway gateway = new PaperTradeExecutionGateway(instrumentResolver);
        TradeIntent intent = new TradeIntent("alpha", "111", "0xcond", "Yes", OrderSide.SELL,
                BigDecimal.TEN, null, OrderType.MARKET, null, "0xtx");

        OrderResult first = gateway.submit(intent);
        OrderResult second = gateway.submit(intent);

        assertThat(first.orderId()).isEqualTo("paper-1");
        assertThat(second.orderId()).isEqualTo("paper-2");
        assertThat(first.paper()).isTrue();
        assertThat(gateway.submittedOrders()).isEqualTo(2);
    }
}
