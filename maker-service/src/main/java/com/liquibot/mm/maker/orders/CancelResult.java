package com.liquibot.mm.maker.orders;

/**
 * Outcome of {@link OrderLifecycleManager#cancel}. {@code status} is null for ids the manager does not track.
 */
public record CancelResult(String orderId, boolean confirmed, OrderStatus status, String message) {
}
