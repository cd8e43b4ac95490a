package com.polycopy.activity;

import com.fasterxml.jackson.databind.JsonNode;
import com.polycopy.polymarket.data.ActivityParser;
import com.polycopy.polymarket.data.PolymarketDataApiClient;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.time.Instant;

@RequiredArgsConstructor
public class DataApiActivityFeedClient implements ActivityFeedClient {

  private final @NonNull PolymarketDataApiClient dataApi;

  @Override
  public ActivityPage fetch(String walletAddress, Instant start, Instant end, int limit, int offset) {
    JsonNode page = dataApi.getActivity(walletAddress, start, end, limit, offset);
    return new ActivityPage(ActivityParser.parsePage(walletAddress, page), ActivityParser.rowCount(page));
  }

  @Override
  public int maxPageSize() {
    return PolymarketDataApiClient.MAX_PAGE_LIMIT;
  }
}
