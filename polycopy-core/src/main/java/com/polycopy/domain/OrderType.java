package com.polycopy.domain;

public enum OrderType {
  /**
   * Fill-or-kill at the best available price.
   */
  MARKET,
  /**
   * Good-till-date at the target's fill price.
   */
  LIMIT,
}
