package com.liquibot.mm.maker.strategy;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

public final class LatchRefreshTicker implements RefreshTicker {

    private final CountDownLatch stopped = new CountDownLatch(1);

    @Override
    public boolean await(Duration wait) {
        if (wait == null || wait.isZero() || wait.isNegative()) {
            return isStopped();
        }
        try {
            return stopped.await(wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stop();
            return true;
        }
    }

    @Override
    public void stop() {
        stopped.countDown();
    }

    @Override
    public boolean isStopped() {
        return stopped.getCount() == 0;
    }
}
