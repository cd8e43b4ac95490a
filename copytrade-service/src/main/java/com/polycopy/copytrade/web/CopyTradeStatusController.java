package com.polycopy.copytrade.web;

import com.polycopy.activity.ActivityBroker;
import com.polycopy.activity.WalletPoller;
import com.polycopy.config.PolycopyProperties;
import com.polycopy.copytrade.CopyTradeRuntime;
import com.polycopy.copytrade.engine.CopyTradeEngine;
import com.polycopy.copytrade.engine.TradeStats;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/copytrade")
@RequiredArgsConstructor
public class CopyTradeStatusController {

    private final @NonNull PolycopyProperties properties;
    private final @NonNull CopyTradeRuntime runtime;
    private final @NonNull WalletPoller poller;
    private final @NonNull ActivityBroker broker;

    @GetMapping("/status")
    public ResponseEntity<CopyTradeStatusResponse> status() {
        List<FollowerStatus> followers = runtime.engines().stream()
                .map(CopyTradeStatusController::followerStatus)
                .toList();
        return ResponseEntity.ok(new CopyTradeStatusResponse(
                properties.mode().name(),
                runtime.isStarted(),
                followers,
                poller.status(),
                broker.subscriptions()
        ));
    }

    private static FollowerStatus followerStatus(CopyTradeEngine engine) {
        return new FollowerStatus(
                engine.followerName(),
                engine.strategy().copyMode().name(),
                engine.strategy().orderType().name(),
                engine.stats());
    }

    public record CopyTradeStatusResponse(
            String mode,
            boolean running,
            List<FollowerStatus> followers,
            List<WalletPoller.WalletStatus> wallets,
            Map<String, Integer> subscriptions
    ) {
    }

    public record FollowerStatus(
            String name,
            String copyMode,
            String orderType,
            TradeStats.Snapshot stats
    ) {
    }
}
