package com.liquibot.mm.exchange;

import java.util.Objects;

public record TradeFilter(String makerAddress, String marketId, String tokenId) {

  public TradeFilter {
    Objects.requireNonNull(makerAddress, "makerAddress");
  }

  public static TradeFilter forMaker(String makerAddress) {
    return new TradeFilter(makerAddress, null, null);
  }
}
