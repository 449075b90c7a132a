package com.liquibot.mm.maker.strategy;

import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.maker.pricing.MidPriceQuote;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * State of one strategy run. Written by the run's own thread; read concurrently for status views.
 */
public final class QuotingRun {

    private static final BigDecimal TWO = BigDecimal.valueOf(2);

    /**
     * Longest run accepted. Keeps {@code start + duration} well inside the range of {@link Instant}.
     */
    public static final Duration MAX_DURATION = Duration.ofDays(366);

    private final String runId;
    private final Instrument instrument;
    private final BigDecimal riskAmount;
    private final BigDecimal orderSize;
    private final BigDecimal maxSpread;
    private final Duration duration;
    private final RefreshTicker ticker;

    private final AtomicLong cycles = new AtomicLong();
    private final AtomicLong cycleErrors = new AtomicLong();
    private final AtomicLong ordersPlaced = new AtomicLong();
    private final AtomicLong placementFailures = new AtomicLong();
    private final Set<String> placedOrderIds = ConcurrentHashMap.newKeySet();

    private volatile StrategyState state = StrategyState.IDLE;
    private volatile boolean stopRequested;
    private volatile Instant startedAt;
    private volatile Instant endsAt;
    private volatile Instant finishedAt;
    private volatile MidPriceQuote lastQuote;
    private volatile String activeBuyOrderId;
    private volatile String activeSellOrderId;

    public QuotingRun(String runId, Instrument instrument, BigDecimal riskAmount, BigDecimal maxSpread, Duration duration, RefreshTicker ticker) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.instrument = Objects.requireNonNull(instrument, "instrument");
        Objects.requireNonNull(riskAmount, "riskAmount");
        Objects.requireNonNull(maxSpread, "maxSpread");
        Objects.requireNonNull(duration, "duration");
        if (riskAmount.signum() <= 0) {
            throw new IllegalArgumentException("riskAmount must be > 0");
        }
        if (maxSpread.signum() < 0 || maxSpread.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("maxSpread must be within [0, 1]");
        }
        if (duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be > 0");
        }
        if (duration.compareTo(MAX_DURATION) > 0) {
            throw new IllegalArgumentException("duration must be at most " + MAX_DURATION.toDays() + " days");
        }
        this.riskAmount = riskAmount;
        this.orderSize = riskAmount.divide(TWO);
        this.maxSpread = maxSpread;
        this.duration = duration;
        this.ticker = ticker == null ? new LatchRefreshTicker() : ticker;
    }

    public String runId() {
        return runId;
    }

    public Instrument instrument() {
        return instrument;
    }

    public BigDecimal riskAmount() {
        return riskAmount;
    }

    /**
     * Size of each quote, half the risk amount.
     */
    public BigDecimal orderSize() {
        return orderSize;
    }

    public BigDecimal maxSpread() {
        return maxSpread;
    }

    public Duration duration() {
        return duration;
    }

    public RefreshTicker ticker() {
        return ticker;
    }

    public StrategyState state() {
        return state;
    }

    public Instant endsAt() {
        return endsAt;
    }

    public boolean isStopRequested() {
        return stopRequested;
    }

    public boolean isActive() {
        return state == StrategyState.IDLE || state == StrategyState.RUNNING || state == StrategyState.WINDING_DOWN;
    }

    public void requestStop() {
        stopRequested = true;
        ticker.stop();
    }

    void start(Instant now) {
        startedAt = now;
        endsAt = now.plus(duration);
        state = StrategyState.RUNNING;
    }

    void windingDown() {
        state = StrategyState.WINDING_DOWN;
    }

    void finish(Instant now) {
        finishedAt = now;
        state = StrategyState.DONE;
    }

    boolean shouldQuote(Instant now) {
        return state == StrategyState.RUNNING && !stopRequested && now.isBefore(endsAt);
    }

    String activeOrderId(OrderSide side) {
        return side == OrderSide.BUY ? activeBuyOrderId : activeSellOrderId;
    }

    void setActiveOrderId(OrderSide side, String orderId) {
        if (side == OrderSide.BUY) {
            activeBuyOrderId = orderId;
        } else {
            activeSellOrderId = orderId;
        }
    }

    void recordQuote(MidPriceQuote quote) {
        lastQuote = quote;
    }

    void recordPlaced(String orderId) {
        placedOrderIds.add(orderId);
        ordersPlaced.incrementAndGet();
    }

    boolean placed(String orderId) {
        return placedOrderIds.contains(orderId);
    }

    void recordPlacementFailure() {
        placementFailures.incrementAndGet();
    }

    void recordCycle() {
        cycles.incrementAndGet();
    }

    void recordCycleError() {
        cycleErrors.incrementAndGet();
    }

    public RunSummary summary() {
        MidPriceQuote quote = lastQuote;
        return new RunSummary(
                runId,
                instrument.marketId(),
                instrument.tokenId(),
                state,
                orderSize,
                maxSpread,
                startedAt,
                endsAt,
                finishedAt,
                cycles.get(),
                cycleErrors.get(),
                ordersPlaced.get(),
                placementFailures.get(),
                quote == null ? null : quote.price(),
                quote == null ? null : quote.source(),
                activeBuyOrderId,
                activeSellOrderId,
                stopRequested
        );
    }
}
