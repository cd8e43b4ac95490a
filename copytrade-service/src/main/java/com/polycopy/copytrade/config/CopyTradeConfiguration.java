package com.polycopy.copytrade.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.polycopy.activity.ActivityBroker;
import com.polycopy.activity.ActivityFeedClient;
import com.polycopy.activity.DataApiActivityFeedClient;
import com.polycopy.activity.InMemoryActivityBroker;
import com.polycopy.activity.WalletPoller;
import com.polycopy.config.PolycopyProperties;
import com.polycopy.copytrade.engine.Sleeper;
import com.polycopy.copytrade.execution.ExecutorApiClient;
import com.polycopy.copytrade.execution.ExecutorTradeExecutionGateway;
import com.polycopy.copytrade.execution.InstrumentResolver;
import com.polycopy.copytrade.execution.PaperTradeExecutionGateway;
import com.polycopy.copytrade.execution.TradeExecutionGateway;
import com.polycopy.polymarket.clob.PolymarketClobClient;
import com.polycopy.polymarket.data.PolymarketDataApiClient;
import com.polycopy.polymarket.http.PolymarketHttpTransport;
import com.polycopy.polymarket.http.RequestRateLimiter;
import com.polycopy.store.CheckpointStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Slf4j
@Configuration
@EnableConfigurationProperties(PolycopyProperties.class)
public class CopyTradeConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient httpClient(PolycopyProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(properties.polymarket().requestTimeoutMillis()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public RequestRateLimiter requestRateLimiter(PolycopyProperties properties, Clock clock) {
        PolycopyProperties.RateLimit rl = properties.polymarket().rateLimit();
        if (!rl.enabled()) {
            return RequestRateLimiter.noop();
        }
        return RequestRateLimiter.tokenBucket(rl.requestsPerSecond(), rl.burst(), clock);
    }

    @Bean
    public PolymarketHttpTransport polymarketHttpTransport(HttpClient httpClient, ObjectMapper objectMapper,
                                                           RequestRateLimiter requestRateLimiter) {
        return new PolymarketHttpTransport(httpClient, objectMapper, requestRateLimiter);
    }

    @Bean
    public PolymarketDataApiClient polymarketDataApiClient(PolycopyProperties properties, PolymarketHttpTransport transport) {
        PolycopyProperties.Polymarket pm = properties.polymarket();
        return new PolymarketDataApiClient(URI.create(pm.dataApiUrl()), transport,
                Duration.ofMillis(pm.requestTimeoutMillis()));
    }

    @Bean
    public PolymarketClobClient polymarketClobClient(PolycopyProperties properties, PolymarketHttpTransport transport) {
        PolycopyProperties.Polymarket pm = properties.polymarket();
        return new PolymarketClobClient(URI.create(pm.clobRestUrl()), transport,
                Duration.ofMillis(pm.requestTimeoutMillis()));
    }

    @Bean
    public ActivityFeedClient activityFeedClient(PolymarketDataApiClient dataApi) {
        return new DataApiActivityFeedClient(dataApi);
    }

    @Bean(destroyMethod = "")
    public ActivityBroker activityBroker(PolycopyProperties properties) {
        PolycopyProperties.Queue queue = properties.queue();
        return new InMemoryActivityBroker(queue.maxWorkers(), Duration.ofSeconds(queue.shutdownTimeoutSeconds()));
    }

    @Bean
    public WalletPoller walletPoller(ActivityFeedClient feed, ActivityBroker broker, CheckpointStore checkpointStore,
                                     PolycopyProperties properties, Clock clock) {
        return new WalletPoller(feed, broker, checkpointStore, properties.monitoring(), clock);
    }

    @Bean
    public InstrumentResolver instrumentResolver(PolymarketClobClient clobClient) {
        return new InstrumentResolver(clobClient);
    }

    @Bean
    public TradeExecutionGateway tradeExecutionGateway(PolycopyProperties properties, InstrumentResolver instrumentResolver,
                                                       PolymarketHttpTransport transport, Clock clock) {
        return switch (properties.mode()) {
            case PAPER -> {
                log.info("trading mode PAPER: orders are acknowledged locally");
                yield new PaperTradeExecutionGateway(instrumentResolver);
            }
            case LIVE -> {
                PolycopyProperties.Executor executor = properties.executor();
                log.info("trading mode LIVE: orders go to executor at {}", executor.baseUrl());
                ExecutorApiClient executorApi = new ExecutorApiClient(URI.create(executor.baseUrl()), transport,
                        Duration.ofMillis(executor.requestTimeoutMillis()));
                yield new ExecutorTradeExecutionGateway(executorApi, instrumentResolver, clock);
            }
        };
    }

    @Bean
    public Sleeper backoffSleeper() {
        return Sleeper.system();
    }
}
