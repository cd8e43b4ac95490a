package com.polycopy.polymarket.data;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.domain.Activity;
import com.polycopy.domain.ActivityType;
import com.polycopy.domain.OrderSide;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps data-api {@code /activity} rows onto {@link Activity}.
 */
@Slf4j
public final class ActivityParser {

  private static final long EPOCH_MILLIS_THRESHOLD = 1_000_000_000_000L;

  private ActivityParser() {
  }

  /**
   * Number of rows in a page payload, whether or not they parse.
   */
  public static int rowCount(JsonNode page) {
    if (page == null || page.isNull() || page.isMissingNode()) {
      return 0;
    }
    JsonNode rows = page.isArray() ? page : page.path("data");
    return rows.isArray() ? rows.size() : 0;
  }

  public static List<Activity> parsePage(String walletAddress, JsonNode page) {
    if (page == null || page.isNull() || page.isMissingNode()) {
      return List.of();
    }
    JsonNode rows = page.isArray() ? page : page.path("data");
    if (!rows.isArray()) {
      return List.of();
    }
    List<Activity> out = new ArrayList<>(rows.size());
    for (JsonNode row : rows) {
      parse(walletAddress, row).ifPresent(out::add);
    }
    return out;
  }

  public static Optional<Activity> parse(String walletAddress, JsonNode row) {
    if (row == null || !row.isObject()) {
      return Optional.empty();
    }
    Optional<ActivityType> type = ActivityType.parse(text(row, "type"));
    if (type.isEmpty()) {
      log.debug("skipping activity with unknown type={} tx={}", text(row, "type"), text(row, "transactionHash"));
      return Optional.empty();
    }
    Instant ts = timestamp(row.path("timestamp"));
    if (ts == null) {
      log.debug("skipping activity without timestamp tx={}", text(row, "transactionHash"));
      return Optional.empty();
    }
    String wallet = text(row, "proxyWallet");
    if (wallet == null) {
      wallet = walletAddress;
    }

    return Optional.of(new Activity(
        wallet.toLowerCase(Locale.ROOT),
        type.get(),
        text(row, "transactionHash"),
        text(row, "conditionId"),
        text(row, "outcome"),
        OrderSide.parse(text(row, "side")).orElse(null),
        decimal(row.path("size")),
        decimal(row.path("price")),
        decimal(row.path("usdcSize")),
        ts,
        text(row, "asset"),
        text(row, "title"),
        text(row, "slug")
    ));
  }

  static Instant timestamp(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return fromEpoch(node.asLong());
    }
    String s = node.asText("").trim();
    if (s.isEmpty()) {
      return null;
    }
    try {
      return fromEpoch(Long.parseLong(s));
    } catch (NumberFormatException ignored) {
      // not numeric, try ISO-8601 below
    }
    try {
      return Instant.parse(s);
    } catch (RuntimeException e) {
      return null;
    }
  }

  private static Instant fromEpoch(long value) {
    if (value <= 0) {
      return null;
    }
    return value > EPOCH_MILLIS_THRESHOLD ? Instant.ofEpochMilli(value) : Instant.ofEpochSecond(value);
  }

  private static BigDecimal decimal(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return BigDecimal.ZERO;
    }
    if (node.isNumber()) {
      return node.decimalValue();
    }
    String s = node.asText("").trim();
    if (s.isEmpty()) {
      return BigDecimal.ZERO;
    }
    try {
      return new BigDecimal(s);
    } catch (NumberFormatException e) {
      return BigDecimal.ZERO;
    }
  }

  private static String text(JsonNode row, String field) {
    JsonNode v = row.get(field);
    if (v == null || v.isNull()) {
      return null;
    }
    String s = v.asText(null);
    return s == null || s.isBlank() ? null : s.trim();
  }
}
