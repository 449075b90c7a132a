package com.liquibot.mm.maker.strategy;

import java.time.Duration;

/**
 * Wait between quoting cycles that {@link #stop()} can cut short.
 */
public interface RefreshTicker {

    /**
     * Blocks for up to {@code wait}.
     *
     * @return true when the ticker was stopped, before or during the wait
     */
    boolean await(Duration wait);

    void stop();

    boolean isStopped();
}
