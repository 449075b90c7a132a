package com.liquibot.mm.maker.orders;

import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.domain.OrderSide;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * An order owned by the {@link OrderLifecycleManager}. {@code id} is the exchange order id, null while PENDING.
 */
public record ManagedOrder(
        String id,
        Instrument instrument,
        OrderSide side,
        BigDecimal size,
        BigDecimal price,
        Instant placedAt,
        OrderStatus status,
        Instant updatedAt
) {

    ManagedOrder withStatus(OrderStatus next, Instant at) {
        return new ManagedOrder(id, instrument, side, size, price, placedAt, next, at);
    }

    ManagedOrder acknowledged(String orderId, Instant at) {
        return new ManagedOrder(orderId, instrument, side, size, price, placedAt, OrderStatus.LIVE, at);
    }
}
