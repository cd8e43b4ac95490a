package com.polycopy.copytrade.web;

import com.polycopy.activity.ActivityBroker;
import com.polycopy.activity.WalletPoller;
import com.polycopy.config.PolycopyProperties;
import com.polycopy.copytrade.CopyTradeRuntime;
import com.polycopy.copytrade.engine.CopyStrategy;
import com.polycopy.copytrade.engine.CopyTradeEngine;
import com.polycopy.copytrade.execution.TradeExecutionGateway;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CopyTradeStatusControllerTest {

    @Mock
    private CopyTradeRuntime runtime;

    @Mock
    private WalletPoller poller;

    @Mock
    private ActivityBroker broker;

    @Mock
    private TradeExecutionGateway gateway;

    @Test
    void reportsModeFollowersWalletsAndSubscriptions() {
        PolycopyProperties properties = new PolycopyProperties(PolycopyProperties.TradingMode.LIVE,
                null, null, null, null, null, null);
        CopyTradeEngine engine = new CopyTradeEngine("alpha", CopyStrategy.scale(BigDecimal.TEN), gateway,
                duration -> {
                }, Clock.systemUTC(), new SimpleMeterRegistry());
        WalletPoller.WalletStatus wallet = new WalletPoller.WalletStatus("0xabc",
                Instant.parse("2024-01-15T10:00:00Z"), 3, 12, 0, null);
        when(runtime.engines()).thenReturn(List.of(engine));
        when(runtime.isStarted()).thenReturn(true);
        when(poller.status()).thenReturn(List.of(wallet));
        when(broker.subscriptions()).thenReturn(Map.of("0xabc", 2));

        CopyTradeStatusController.CopyTradeStatusResponse body =
                new CopyTradeStatusController(properties, runtime, poller, broker).status().getBody();

        assertThat(body).isNotNull();
        assertThat(body.mode()).isEqualTo("LIVE");
        assertThat(body.running()).isTrue();
        assertThat(body.followers()).singleElement()
                .satisfies(f -> {
                    assertThat(f.name()).isEqualTo("alpha");
                    assertThat(f.copyMode()).isEqualTo("SCALE");
                    assertThat(f.stats().totalActivities()).isZero();
                });
        assertThat(body.wallets()).containsExactly(wallet);
        assertThat(body.subscriptions()).containsEntry("0xabc", 2);
    }
}
