package com.liquibot.mm.maker.pnl;

import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.domain.Trade;
import com.liquibot.mm.events.MakerEventPublisher;
import com.liquibot.mm.events.MakerEventTypes;
import com.liquibot.mm.exchange.ExchangeClient;
import com.liquibot.mm.exchange.RewardsSource;
import com.liquibot.mm.exchange.TradeFilter;
import com.liquibot.mm.maker.metrics.MakerMetrics;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Realized PnL of the account from its confirmed fills, plus reward earnings.
 *
 * <p>A buy costs {@code size * price}; a sell earns {@code size * (1 - price)}. Every successful
 * {@link #snapshot()} appends to an in-memory history whose timestamps strictly increase.
 */
@Slf4j
public class PnlTracker {

    private final ExchangeClient exchange;
    private final RewardsSource rewards;
    private final Clock clock;
    private final MakerEventPublisher events;
    private final MakerMetrics metrics;

    private final List<PnlSnapshot> history = new CopyOnWriteArrayList<>();

    public PnlTracker(ExchangeClient exchange, RewardsSource rewards, Clock clock, MakerEventPublisher events, MakerMetrics metrics) {
        this.exchange = Objects.requireNonNull(exchange, "exchange");
        this.rewards = Objects.requireNonNull(rewards, "rewards");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.events = Objects.requireNonNull(events, "events");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * @return the appended snapshot, or empty when trades or rewards could not be read (history unchanged)
     */
    public synchronized Optional<PnlSnapshot> snapshot() {
        List<Trade> trades;
        BigDecimal rewardTotal;
        try {
            String account = exchange.getAccountAddress();
            trades = exchange.listTrades(TradeFilter.forMaker(account));
            rewardTotal = rewards.getRewardsTotal();
        } catch (RuntimeException e) {
            log.warn("PnL snapshot failed: {}", e.getMessage());
            metrics.pnlSnapshotFailed();
            return Optional.empty();
        }

        BigDecimal buyVolume = BigDecimal.ZERO;
        BigDecimal buyCost = BigDecimal.ZERO;
        BigDecimal sellVolume = BigDecimal.ZERO;
        BigDecimal sellRevenue = BigDecimal.ZERO;
        int confirmed = 0;
        for (Trade trade : trades == null ? List.<Trade>of() : trades) {
            if (trade == null || !trade.isConfirmed() || trade.size() == null || trade.price() == null) {
                continue;
            }
            confirmed++;
            if (trade.side() == OrderSide.BUY) {
                buyVolume = buyVolume.add(trade.size());
                buyCost = buyCost.add(trade.size().multiply(trade.price()));
            } else {
                sellVolume = sellVolume.add(trade.size());
                sellRevenue = sellRevenue.add(trade.size().multiply(BigDecimal.ONE.subtract(trade.price())));
            }
        }

        BigDecimal realized = sellRevenue.subtract(buyCost);
        BigDecimal rewardValue = rewardTotal == null ? BigDecimal.ZERO : rewardTotal;
        PnlSnapshot snapshot = new PnlSnapshot(
                nextTimestamp(),
                realized,
                rewardValue,
                realized.add(rewardValue),
                buyVolume,
                sellVolume,
                confirmed
        );
        history.add(snapshot);
        metrics.pnlSnapshot(snapshot.totalPnl());
        events.publish(MakerEventTypes.PNL_SNAPSHOT, null, snapshot);
        log.debug("PnL snapshot: realized={} rewards={} total={} ({} confirmed trades)",
                realized, rewardValue, snapshot.totalPnl(), confirmed);
        return Optional.of(snapshot);
    }

    public List<PnlSnapshot> history() {
        return List.copyOf(history);
    }

    public Optional<PnlSnapshot> latest() {
        List<PnlSnapshot> copy = history();
        return copy.isEmpty() ? Optional.empty() : Optional.of(copy.get(copy.size() - 1));
    }

    private Instant nextTimestamp() {
        Instant now = clock.instant();
        if (history.isEmpty()) {
            return now;
        }
        Instant last = history.get(history.size() - 1).timestamp();
        return now.isAfter(last) ? now : last.plusMillis(1);
    }
}
