package com.liquibot.mm.domain;

import java.util.Objects;

/**
 * A tradeable outcome token of a market: the condition id plus the CLOB token id.
 */
public record Instrument(String marketId, String tokenId) {

  public Instrument {
    Objects.requireNonNull(marketId, "marketId");
    Objects.requireNonNull(tokenId, "tokenId");
    marketId = marketId.trim();
    tokenId = tokenId.trim();
    if (marketId.isEmpty()) {
      throw new IllegalArgumentException("marketId must not be blank");
    }
    if (tokenId.isEmpty()) {
      throw new IllegalArgumentException("tokenId must not be blank");
    }
  }

  @Override
  public String toString() {
    return marketId + ":" + tokenId;
  }
}
