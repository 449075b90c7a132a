package com.liquibot.mm.domain;

import java.util.Locale;

public enum OrderSide {
  BUY,
  SELL;

  /**
   * Parses the side as the CLOB reports it ("BUY", "buy", "Sell", ...).
   */
  public static OrderSide fromWire(String value) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException("order side is blank");
    }
    return OrderSide.valueOf(value.trim().toUpperCase(Locale.ROOT));
  }
}
