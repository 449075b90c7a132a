package com.liquibot.mm.maker.orders;

import com.liquibot.mm.domain.OrderSide;

import java.math.BigDecimal;

/**
 * Outcome of {@link OrderLifecycleManager#place}. On failure {@code order} is null.
 */
public record OrderResult(
        boolean success,
        ManagedOrder order,
        OrderSide side,
        BigDecimal submittedPrice,
        BigDecimal submittedSize,
        String errorMessage
) {

    static OrderResult placed(ManagedOrder order) {
        return new OrderResult(true, order, order.side(), order.price(), order.size(), null);
    }

    static OrderResult failed(OrderSide side, BigDecimal price, BigDecimal size, String errorMessage) {
        return new OrderResult(false, null, side, price, size, errorMessage);
    }

    public String orderId() {
        return order == null ? null : order.id();
    }
}
