package com.liquibot.mm.polymarket.clob;

public final class PolymarketClobPaths {

  public static final String TIME = "/time";
  public static final String BOOK = "/book";
  public static final String TICK_SIZE = "/tick-size";
  public static final String NEG_RISK = "/neg-risk";
  public static final String MARKETS = "/markets";
  public static final String SAMPLING_SIMPLIFIED_MARKETS = "/sampling-simplified-markets";
  public static final String ORDERS = "/data/orders";
  public static final String TRADES = "/data/trades";
  public static final String POST_ORDER = "/order";
  public static final String CANCEL_ORDER = "/order";
  public static final String CREATE_API_KEY = "/auth/api-key";
  public static final String DERIVE_API_KEY = "/auth/derive-api-key";

  /**
   * Cursor value the CLOB returns on the last page.
   */
  public static final String END_CURSOR = "LTE=";

  private PolymarketClobPaths() {
  }
}
