package com.liquibot.mm.maker.orders;

public enum OrderStatus {
    PENDING,
    LIVE,
    CANCELED,
    FAILED,
    /**
     * A cancel was sent but not confirmed; the order may still be resting until reconciled.
     */
    UNKNOWN;

    public boolean isTerminal() {
        return this == CANCELED || this == FAILED;
    }

    /**
     * Whether the order may still be resting on the book.
     */
    public boolean mayBeResting() {
        return this == LIVE || this == UNKNOWN;
    }
}
