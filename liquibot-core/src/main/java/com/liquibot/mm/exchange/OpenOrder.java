package com.liquibot.mm.exchange;

import com.liquibot.mm.domain.OrderSide;

import java.math.BigDecimal;

/**
 * A resting order on the book. {@code id} is only known for the account's own orders.
 */
public record OpenOrder(
    String id,
    String marketId,
    String tokenId,
    OrderSide side,
    BigDecimal price,
    BigDecimal size
) {
}
