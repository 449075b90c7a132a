package com.liquibot.mm.maker.metrics;

import com.liquibot.mm.maker.pricing.MidPriceQuote;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Micrometer meters of the quoting service.
 */
public class MakerMetrics {

    private final MeterRegistry registry;

    private final Counter ordersPlaced;
    private final Counter ordersFailed;
    private final Counter ordersCanceled;
    private final Counter ordersUnknown;
    private final Counter cycles;
    private final Counter cycleErrors;
    private final Counter pnlSnapshotFailures;

    private final AtomicInteger activeRuns = new AtomicInteger();
    private final AtomicReference<BigDecimal> lastTotalPnl = new AtomicReference<>(BigDecimal.ZERO);

    public MakerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.ordersPlaced = Counter.builder("maker.orders.placed")
                .description("Orders acknowledged by the exchange")
                .register(registry);
        this.ordersFailed = Counter.builder("maker.orders.failed")
                .description("Order placements that failed or were rejected")
                .register(registry);
        this.ordersCanceled = Counter.builder("maker.orders.canceled")
                .description("Cancellations confirmed by the exchange")
                .register(registry);
        this.ordersUnknown = Counter.builder("maker.orders.unknown")
                .description("Cancellations that were not confirmed")
                .register(registry);
        this.cycles = Counter.builder("maker.strategy.cycles")
                .description("Completed quoting cycles")
                .register(registry);
        this.cycleErrors = Counter.builder("maker.strategy.cycle.errors")
                .description("Quoting cycles that failed unexpectedly")
                .register(registry);
        this.pnlSnapshotFailures = Counter.builder("maker.pnl.snapshot.failures")
                .description("PnL snapshots that could not be computed")
                .register(registry);

        Gauge.builder("maker.strategy.runs.active", activeRuns, AtomicInteger::get)
                .description("Strategy runs currently quoting or winding down")
                .register(registry);
        Gauge.builder("maker.pnl.total", lastTotalPnl, ref -> ref.get().doubleValue())
                .description("Total PnL of the latest snapshot")
                .register(registry);
    }

    public void orderPlaced() {
        ordersPlaced.increment();
    }

    public void orderFailed() {
        ordersFailed.increment();
    }

    public void orderCanceled() {
        ordersCanceled.increment();
    }

    public void orderUnknown() {
        ordersUnknown.increment();
    }

    public void cycleCompleted() {
        cycles.increment();
    }

    public void cycleFailed() {
        cycleErrors.increment();
    }

    public void midPriceFallback(MidPriceQuote.Source source) {
        registry.counter("maker.pricer.fallbacks", "source", source.name()).increment();
    }

    public void runStarted() {
        activeRuns.incrementAndGet();
    }

    public void runFinished() {
        activeRuns.decrementAndGet();
    }

    public void pnlSnapshot(BigDecimal totalPnl) {
        lastTotalPnl.set(totalPnl);
    }

    public void pnlSnapshotFailed() {
        pnlSnapshotFailures.increment();
    }
}
