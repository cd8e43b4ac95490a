package com.polycopy.config;

import com.polycopy.domain.CopyMode;
import com.polycopy.domain.OrderType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

@Validated
@ConfigurationProperties(prefix = "polycopy")
public record PolycopyProperties(
    TradingMode mode,
    @Valid Polymarket polymarket,
    @Valid Monitoring monitoring,
    @Valid Queue queue,
    @Valid Executor executor,
    @Valid Persistence persistence,
    @Valid List<Follower> followers
) {

  public PolycopyProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (polymarket == null) {
      polymarket = new Polymarket(null, null, null, null);
    }
    if (monitoring == null) {
      monitoring = new Monitoring(null, null, null, null, null);
    }
    if (queue == null) {
      queue = new Queue(null, null);
    }
    if (executor == null) {
      executor = new Executor(null, null);
    }
    if (persistence == null) {
      persistence = new Persistence(null);
    }
    followers = followers == null ? List.of() : List.copyOf(followers);
  }

  /**
   * Every wallet the poller has to watch: the configured monitoring list plus each enabled
   * follower's targets, lower-cased and de-duplicated in declaration order.
   */
  public List<String> watchedWallets() {
    Set<String> wallets = new LinkedHashSet<>(monitoring.wallets());
    for (Follower follower : followers) {
      if (follower.enabled()) {
        wallets.addAll(follower.targetWallets());
      }
    }
    return List.copyOf(wallets);
  }

  /**
   * Targets for a follower; a follower without explicit targets follows every monitored wallet.
   */
  public List<String> targetsOf(Follower follower) {
    if (!follower.targetWallets().isEmpty()) {
      return follower.targetWallets();
    }
    return monitoring.wallets();
  }

  static List<String> normalizeWallets(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    List<String> out = new ArrayList<>();
    for (String v : values) {
      if (v == null) {
        continue;
      }
      String s = v.trim().toLowerCase(Locale.ROOT);
      if (!s.isEmpty() && !out.contains(s)) {
        out.add(s);
      }
    }
    return List.copyOf(out);
  }

  public enum TradingMode {
    /**
     * Orders are logged and acknowledged locally; nothing reaches the exchange.
     */
    PAPER,
    /**
     * Orders are forwarded to the executor service, which signs and posts them to the CLOB.
     */
    LIVE,
  }

  public record Polymarket(
      String dataApiUrl,
      String clobRestUrl,
      @PositiveOrZero Long requestTimeoutMillis,
      @Valid RateLimit rateLimit
  ) {
    public Polymarket {
      if (dataApiUrl == null || dataApiUrl.isBlank()) {
        dataApiUrl = "https://data-api.polymarket.com";
      }
      if (clobRestUrl == null || clobRestUrl.isBlank()) {
        clobRestUrl = "https://clob.polymarket.com";
      }
      if (requestTimeoutMillis == null) {
        requestTimeoutMillis = 30_000L;
      }
      if (rateLimit == null) {
        rateLimit = new RateLimit(null, null, null);
      }
    }
  }

  public record RateLimit(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double requestsPerSecond,
      @NotNull @PositiveOrZero Integer burst
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (requestsPerSecond == null) {
        requestsPerSecond = 10.0;
      }
      if (burst == null) {
        burst = 20;
      }
    }
  }

  public record Monitoring(
      List<String> wallets,
      @Min(1) Integer pollIntervalSeconds,
      /**
       * Page size of each feed query. The data-api serves at most 500 rows per page.
       */
      @Min(1) @Max(500) Integer batchSize,
      /**
       * Padding added to "now" for the upper bound of each feed query, absorbing clock and feed skew.
       */
      @PositiveOrZero Long lookaheadSeconds,
      /**
       * When true, a wallet's loop starts from its persisted checkpoint (falling back to now).
       * When false, every start begins at the current time and activity during downtime is skipped.
       */
      Boolean resumeFromCheckpoint
  ) {
    public Monitoring {
      wallets = normalizeWallets(wallets);
      if (pollIntervalSeconds == null) {
        pollIntervalSeconds = 5;
      }
      if (batchSize == null) {
        batchSize = 500;
      }
      if (lookaheadSeconds == null) {
        lookaheadSeconds = 3_600L;
      }
      if (resumeFromCheckpoint == null) {
        resumeFromCheckpoint = true;
      }
    }
  }

  public record Queue(
      @Min(1) Integer maxWorkers,
      @PositiveOrZero Long shutdownTimeoutSeconds
  ) {
    public Queue {
      if (maxWorkers == null) {
        maxWorkers = 10;
      }
      if (shutdownTimeoutSeconds == null) {
        shutdownTimeoutSeconds = 30L;
      }
    }
  }

  public record Executor(
      String baseUrl,
      @PositiveOrZero Long requestTimeoutMillis
  ) {
    public Executor {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "http://localhost:8080";
      }
      if (requestTimeoutMillis == null) {
        requestTimeoutMillis = 15_000L;
      }
    }
  }

  public record Persistence(Boolean enabled) {
    public Persistence {
      if (enabled == null) {
        enabled = true;
      }
    }
  }

  public record Follower(
      @NotBlank String name,
      @NotBlank String address,
      Boolean enabled,
      List<String> targetWallets,
      @NotNull @Valid CopyStrategy copyStrategy
  ) {
    public Follower {
      if (enabled == null) {
        enabled = true;
      }
      targetWallets = normalizeWallets(targetWallets);
      Objects.requireNonNull(copyStrategy, "follower '%s' is missing copy-strategy".formatted(name));
    }
  }

  public record CopyStrategy(
      @NotNull CopyMode copyMode,
      @PositiveOrZero BigDecimal scalePercentage,
      @PositiveOrZero BigDecimal minTriggerAmount,
      @PositiveOrZero BigDecimal minTradeAmount,
      /**
       * Upper bound for one copied trade in USDC. 0 disables the cap.
       */
      @PositiveOrZero BigDecimal maxTradeAmount,
      OrderType orderType,
      /**
       * Lifetime of good-till-date limit orders.
       */
      @Min(1) Long limitOrderDurationSeconds
  ) {
    public CopyStrategy {
      if (minTriggerAmount == null) {
        minTriggerAmount = BigDecimal.ZERO;
      }
      if (minTradeAmount == null) {
        minTradeAmount = BigDecimal.ZERO;
      }
      if (maxTradeAmount == null) {
        maxTradeAmount = BigDecimal.ZERO;
      }
      if (orderType == null) {
        orderType = OrderType.MARKET;
      }
      if (limitOrderDurationSeconds == null) {
        limitOrderDurationSeconds = 7_200L;
      }
    }
  }
}
