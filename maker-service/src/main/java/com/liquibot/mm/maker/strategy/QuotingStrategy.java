package com.liquibot.mm.maker.strategy;

import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.events.MakerEventPublisher;
import com.liquibot.mm.events.MakerEventTypes;
import com.liquibot.mm.maker.metrics.MakerMetrics;
import com.liquibot.mm.maker.orders.CancelResult;
import com.liquibot.mm.maker.orders.ManagedOrder;
import com.liquibot.mm.maker.orders.OrderLifecycleManager;
import com.liquibot.mm.maker.orders.OrderResult;
import com.liquibot.mm.maker.orders.OrderStatus;
import com.liquibot.mm.maker.pricing.MidPriceQuote;
import com.liquibot.mm.maker.pricing.QuotePricer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Two-sided quoting loop for a single {@link QuotingRun}.
 *
 * <p>Each cycle cancels the run's previous quotes and places a fresh buy below and sell above the mid-price. A side
 * whose previous quote could not be confirmed canceled is skipped until reconciliation shows it is gone, so a run
 * never has two resting orders on one side. When the run ends, quotes are canceled before the state becomes DONE.
 *
 * <p>Quote prices round half-even to cents, so a tie goes to the tighter quote: mid 0.50 with a 0.025 offset
 * quotes 0.48/0.52 rather than 0.47/0.53. A quote is never wider than the configured max spread.
 */
@Slf4j
public class QuotingStrategy {

    private static final int PRICE_SCALE = 2;

    private final QuotePricer pricer;
    private final OrderLifecycleManager orders;
    private final Clock clock;
    private final MakerEventPublisher events;
    private final MakerMetrics metrics;
    private final Settings settings;

    public QuotingStrategy(
            QuotePricer pricer,
            OrderLifecycleManager orders,
            Clock clock,
            MakerEventPublisher events,
            MakerMetrics metrics,
            Settings settings
    ) {
        this.pricer = Objects.requireNonNull(pricer, "pricer");
        this.orders = Objects.requireNonNull(orders, "orders");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = Objects.requireNonNull(events, "events");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Runs on the calling thread until the run's duration elapses or a stop is requested, then winds down.
     */
    public RunSummary run(QuotingRun run) {
        Instrument instrument = run.instrument();
        metrics.runStarted();
        try {
            run.start(clock.instant());
            if (events.isEnabled()) {
                events.publish(MakerEventTypes.RUN_STARTED, run.runId(), run.summary());
            }
            log.info("run {} started for {} (size={}, maxSpread={}, until={})",
                    run.runId(), instrument, run.orderSize(), run.maxSpread(), run.endsAt());

            while (run.shouldQuote(clock.instant())) {
                Duration wait;
                try {
                    cycle(run);
                    wait = settings.refreshInterval();
                } catch (RuntimeException e) {
                    run.recordCycleError();
                    metrics.cycleFailed();
                    log.warn("run {} cycle failed for {}, retrying in {} ms", run.runId(), instrument,
                            settings.recoveryInterval().toMillis(), e);
                    wait = settings.recoveryInterval();
                }
                Duration untilDeadline = Duration.between(clock.instant(), run.endsAt());
                if (untilDeadline.compareTo(wait) < 0) {
                    wait = untilDeadline;
                }
                if (run.ticker().await(wait)) {
                    log.info("run {} stop requested", run.runId());
                    break;
                }
            }
        } finally {
            windDown(run);
            metrics.runFinished();
        }

        RunSummary summary = run.summary();
        if (events.isEnabled()) {
            events.publish(MakerEventTypes.RUN_FINISHED, run.runId(), summary);
        }
        log.info("run {} done for {} (cycles={}, errors={}, placed={}, failures={})", run.runId(), instrument,
                summary.cycles(), summary.cycleErrors(), summary.ordersPlaced(), summary.placementFailures());
        return summary;
    }

    void cycle(QuotingRun run) {
        Instrument instrument = run.instrument();
        MidPriceQuote quote = pricer.quote(instrument);
        run.recordQuote(quote);

        BigDecimal mid = quote.price();
        BigDecimal buyPrice = settings.minPrice().max(mid.subtract(run.maxSpread()).setScale(PRICE_SCALE, RoundingMode.HALF_EVEN));
        BigDecimal sellPrice = settings.maxPrice().min(mid.add(run.maxSpread()).setScale(PRICE_SCALE, RoundingMode.HALF_EVEN));

        boolean buyFree = releaseSide(run, OrderSide.BUY);
        boolean sellFree = releaseSide(run, OrderSide.SELL);

        if (buyFree) {
            quote(run, OrderSide.BUY, buyPrice);
        }
        if (sellFree) {
            quote(run, OrderSide.SELL, sellPrice);
        }

        run.recordCycle();
        metrics.cycleCompleted();
        log.debug("run {} cycle: mid={} ({}) buy={}{} sell={}{}", run.runId(), mid, quote.source(),
                buyPrice, buyFree ? "" : " (skipped)", sellPrice, sellFree ? "" : " (skipped)");
    }

    private void quote(QuotingRun run, OrderSide side, BigDecimal price) {
        OrderResult result = orders.place(run.instrument(), side, run.orderSize(), price, settings.feeRateBps());
        if (result.success()) {
            run.recordPlaced(result.orderId());
            run.setActiveOrderId(side, result.orderId());
        } else {
            run.recordPlacementFailure();
        }
    }

    /**
     * Cancels the side's active quote.
     *
     * @return true when nothing of this run rests on that side any more
     */
    private boolean releaseSide(QuotingRun run, OrderSide side) {
        String orderId = run.activeOrderId(side);
        if (orderId == null) {
            return true;
        }
        CancelResult cancel = orders.cancel(orderId);
        if (cancel.confirmed()) {
            run.setActiveOrderId(side, null);
            return true;
        }

        orders.reconcile(run.instrument());
        OrderStatus status = orders.find(orderId).map(ManagedOrder::status).orElse(OrderStatus.CANCELED);
        if (status == OrderStatus.CANCELED || status == OrderStatus.FAILED) {
            run.setActiveOrderId(side, null);
            return true;
        }
        log.warn("run {} keeps {} quote {} ({}), not replacing it this cycle", run.runId(), side, orderId, status);
        return false;
    }

    private void windDown(QuotingRun run) {
        run.windingDown();
        Instrument instrument = run.instrument();
        try {
            for (OrderSide side : OrderSide.values()) {
                String orderId = run.activeOrderId(side);
                if (orderId != null && orders.cancel(orderId).confirmed()) {
                    run.setActiveOrderId(side, null);
                }
            }

            orders.reconcile(instrument);
            for (ManagedOrder order : orders.liveOrders(instrument)) {
                if (!run.placed(order.id())) {
                    continue;
                }
                if (orders.cancel(order.id()).confirmed()) {
                    continue;
                }
                log.warn("run {} could not confirm cancel of {} {} during wind-down", run.runId(), order.side(), order.id());
            }

            for (OrderSide side : OrderSide.values()) {
                String orderId = run.activeOrderId(side);
                if (orderId == null) {
                    continue;
                }
                OrderStatus status = orders.find(orderId).map(ManagedOrder::status).orElse(OrderStatus.CANCELED);
                if (!status.mayBeResting()) {
                    run.setActiveOrderId(side, null);
                }
            }
        } catch (RuntimeException e) {
            log.error("run {} wind-down failed for {}", run.runId(), instrument, e);
        } finally {
            run.finish(clock.instant());
        }
    }

    public record Settings(
            Duration refreshInterval,
            Duration recoveryInterval,
            BigDecimal minPrice,
            BigDecimal maxPrice,
            int feeRateBps
    ) {
        public Settings {
            Objects.requireNonNull(refreshInterval, "refreshInterval");
            Objects.requireNonNull(recoveryInterval, "recoveryInterval");
            Objects.requireNonNull(minPrice, "minPrice");
            Objects.requireNonNull(maxPrice, "maxPrice");
        }
    }
}
