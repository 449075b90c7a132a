package com.liquibot.mm.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A fill reported by the exchange for the account.
 */
public record Trade(
    String id,
    String marketId,
    String tokenId,
    OrderSide side,
    BigDecimal size,
    BigDecimal price,
    String status,
    Instant matchTime
) {

  public static final String STATUS_CONFIRMED = "CONFIRMED";

  public boolean isConfirmed() {
    return STATUS_CONFIRMED.equalsIgnoreCase(status);
  }
}
