package com.liquibot.mm.maker.strategy;

import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.events.MakerEventTypes;
import com.liquibot.mm.exchange.OrderSpec;
import com.liquibot.mm.exchange.SubmitOrderResponse;
import com.liquibot.mm.maker.metrics.MakerMetrics;
import com.liquibot.mm.maker.orders.OrderLifecycleManager;
import com.liquibot.mm.maker.pricing.MidPriceQuote;
import com.liquibot.mm.maker.pricing.QuotePricer;
import com.liquibot.mm.maker.support.FakeExchangeClient;
import com.liquibot.mm.maker.support.ManualRefreshTicker;
import com.liquibot.mm.maker.support.MutableClock;
import com.liquibot.mm.maker.support.RecordingEventPublisher;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

import static com.liquibot.mm.maker.support.FakeExchangeClient.level;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class QuotingStrategyTest {

    private static final Instant START = Instant.parse("2024-01-15T10:00:00Z");
    private static final Instrument INSTRUMENT = new Instrument("m1", "t1");
    private static final QuotingStrategy.Settings SETTINGS = new QuotingStrategy.Settings(
            Duration.ofSeconds(30),
            Duration.ofSeconds(5),
            new BigDecimal("0.01"),
            new BigDecimal("0.99"),
            0
    );

    private MutableClock clock;
    private MakerMetrics metrics;
    private FakeExchangeClient exchange;
    private RecordingEventPublisher events;
    private final AtomicLong maxRestingPerSide = new AtomicLong();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        metrics = new MakerMetrics(new SimpleMeterRegistry());
        events = new RecordingEventPublisher();
        exchange = new FakeExchangeClient() {
            @Override
            public synchronized SubmitOrderResponse submitOrder(OrderSpec spec) {
                SubmitOrderResponse response = super.submitOrder(spec);
                maxRestingPerSide.accumulateAndGet(Math.max(resting(OrderSide.BUY), resting(OrderSide.SELL)), Math::max);
                return response;
            }
        };
        exchange.book.add(level(OrderSide.BUY, "0.45"));
        exchange.book.add(level(OrderSide.SELL, "0.55"));
    }

    @Test
    void fullRunQuotesBothSidesEachCycleAndLeavesNothingResting() {
        OrderLifecycleManager orders = orders();
        QuotingRun run = run(new BigDecimal("20"), Duration.ofMinutes(2), new ManualRefreshTicker(clock));

        RunSummary summary = strategy(new QuotePricer(exchange, new BigDecimal("0.5"), metrics), orders).run(run);

        assertThat(summary.state()).isEqualTo(StrategyState.DONE);
        assertThat(summary.cycles()).isEqualTo(4);
        assertThat(summary.ordersPlaced()).isEqualTo(8);
        assertThat(summary.lastMidPrice()).isEqualByComparingTo("0.50");
        assertThat(summary.activeBuyOrderId()).isNull();
        assertThat(summary.activeSellOrderId()).isNull();
        assertThat(orders.liveOrders(INSTRUMENT)).isEmpty();
        assertThat(exchange.resting).isEmpty();
        assertThat(maxRestingPerSide.get()).isEqualTo(1);

        assertThat(exchange.submitted).allSatisfy(spec -> assertThat(spec.size()).isEqualByComparingTo("10"));
        assertThat(exchange.submitted).filteredOn(s -> s.side() == OrderSide.BUY)
                .allSatisfy(spec -> assertThat(spec.price()).isEqualByComparingTo("0.47"));
        assertThat(exchange.submitted).filteredOn(s -> s.side() == OrderSide.SELL)
                .allSatisfy(spec -> assertThat(spec.price()).isEqualByComparingTo("0.53"));
    }

    @Test
    void unconfirmedCancelNeverLeadsToSecondOrderOnThatSide() {
        exchange.refuseCancels = true;
        QuotingRun run = run(new BigDecimal("20"), Duration.ofMinutes(2), new ManualRefreshTicker(clock));

        RunSummary summary = strategy(new QuotePricer(exchange, new BigDecimal("0.5"), metrics), orders()).run(run);

        assertThat(exchange.submitted).hasSize(2);
        assertThat(maxRestingPerSide.get()).isEqualTo(1);
        assertThat(summary.ordersPlaced()).isEqualTo(2);
        assertThat(summary.state()).isEqualTo(StrategyState.DONE);
    }

    @Test
    void lostCancelAcknowledgementIsReconciledBeforeReplacing() {
        exchange.silentCancels = true;
        OrderLifecycleManager orders = orders();
        QuotingRun run = run(new BigDecimal("20"), Duration.ofSeconds(60), new ManualRefreshTicker(clock));

        RunSummary summary = strategy(new QuotePricer(exchange, new BigDecimal("0.5"), metrics), orders).run(run);

        assertThat(summary.cycles()).isEqualTo(2);
        assertThat(summary.ordersPlaced()).isEqualTo(4);
        assertThat(maxRestingPerSide.get()).isEqualTo(1);
        assertThat(orders.unresolvedOrders(INSTRUMENT)).isEmpty();
        assertThat(orders.liveOrders(INSTRUMENT)).isEmpty();
        assertThat(exchange.resting).isEmpty();
    }

    @Test
    void stopEndsRunPromptlyAndStillWindsDown() {
        ManualRefreshTicker ticker = new ManualRefreshTicker(clock).stopAfterWait(1);
        OrderLifecycleManager orders = orders();
        QuotingRun run = run(new BigDecimal("20"), Duration.ofMinutes(60), ticker);

        RunSummary summary = strategy(new QuotePricer(exchange, new BigDecimal("0.5"), metrics), orders).run(run);

        assertThat(summary.cycles()).isEqualTo(1);
        assertThat(summary.state()).isEqualTo(StrategyState.DONE);
        assertThat(summary.finishedAt()).isBefore(summary.endsAt());
        assertThat(orders.liveOrders(INSTRUMENT)).isEmpty();
        assertThat(exchange.resting).isEmpty();
    }

    @Test
    void requestStopWakesTicker() {
        LatchRefreshTicker ticker = new LatchRefreshTicker();
        QuotingRun run = run(BigDecimal.TEN, Duration.ofMinutes(5), ticker);

        run.requestStop();

        assertThat(run.isStopRequested()).isTrue();
        assertThat(ticker.await(Duration.ofMinutes(1))).isTrue();
    }

    @Test
    void cycleFailureWaitsRecoveryIntervalAndContinues() {
        QuotePricer pricer = mock(QuotePricer.class);
        when(pricer.quote(any()))
                .thenThrow(new IllegalStateException("boom"))
                .thenReturn(new MidPriceQuote(new BigDecimal("0.5"), null, null, MidPriceQuote.Source.EMPTY_BOOK));
        ManualRefreshTicker ticker = new ManualRefreshTicker(clock);
        QuotingRun run = run(new BigDecimal("20"), Duration.ofSeconds(40), ticker);

        RunSummary summary = strategy(pricer, orders()).run(run);

        assertThat(summary.cycleErrors()).isEqualTo(1);
        assertThat(summary.cycles()).isEqualTo(2);
        assertThat(ticker.waits()).containsExactly(Duration.ofSeconds(5), Duration.ofSeconds(30), Duration.ofSeconds(5));
        assertThat(exchange.resting).isEmpty();
    }

    @Test
    void waitNeverExtendsPastDeadline() {
        ManualRefreshTicker ticker = new ManualRefreshTicker(clock);
        QuotingRun run = run(new BigDecimal("20"), Duration.ofSeconds(45), ticker);

        strategy(new QuotePricer(exchange, new BigDecimal("0.5"), metrics), orders()).run(run);

        assertThat(ticker.waits()).containsExactly(Duration.ofSeconds(30), Duration.ofSeconds(15));
    }

    @Test
    void quotePricesRoundHalfEven() {
        exchange.book.clear();
        QuotingRun run = new QuotingRun("r1", INSTRUMENT, new BigDecimal("20"), new BigDecimal("0.025"),
                Duration.ofSeconds(1), new ManualRefreshTicker(clock));

        strategy(new QuotePricer(exchange, new BigDecimal("0.5"), metrics), orders()).run(run);

        assertThat(exchange.submitted).extracting(OrderSpec::price)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("0.48"), new BigDecimal("0.52"));
    }

    @Test
    void quotePricesAreBoundedNearEdges() {
        exchange.book.clear();
        exchange.book.add(level(OrderSide.SELL, "0.02"));
        QuotingRun run = run(new BigDecimal("20"), Duration.ofSeconds(1), new ManualRefreshTicker(clock));

        strategy(new QuotePricer(exchange, new BigDecimal("0.5"), metrics), orders()).run(run);

        assertThat(exchange.submitted.get(0).price()).isEqualByComparingTo("0.01");
        assertThat(exchange.submitted.get(1).price()).isEqualByComparingTo("0.04");
    }

    @Test
    void runEventsBracketOrderEvents() {
        QuotingRun run = run(new BigDecimal("20"), Duration.ofSeconds(30), new ManualRefreshTicker(clock));

        strategy(new QuotePricer(exchange, new BigDecimal("0.5"), metrics), orders()).run(run);

        assertThat(events.types()).startsWith(MakerEventTypes.RUN_STARTED, MakerEventTypes.ORDER_PLACED, MakerEventTypes.ORDER_PLACED)
                .endsWith(MakerEventTypes.ORDER_CANCELED, MakerEventTypes.ORDER_CANCELED, MakerEventTypes.RUN_FINISHED);
        assertThat(events.events.get(events.events.size() - 1).data()).isInstanceOfSatisfying(RunSummary.class,
                summary -> assertThat(summary.state()).isEqualTo(StrategyState.DONE));
    }

    @Test
    void durationBeyondLimitIsRejected() {
        ManualRefreshTicker ticker = new ManualRefreshTicker(clock);

        assertThatThrownBy(() -> run(BigDecimal.TEN, Duration.ofMinutes(1_000_000_000_000L), ticker))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at most");
        assertThat(run(BigDecimal.TEN, QuotingRun.MAX_DURATION, ticker).duration()).isEqualTo(QuotingRun.MAX_DURATION);
    }

    @Test
    void failureWhileStartingStillFinishesRun() {
        AtomicBoolean failNext = new AtomicBoolean(true);
        Clock failingOnce = new Clock() {
            @Override
            public ZoneId getZone() {
                return clock.getZone();
            }

            @Override
            public Clock withZone(ZoneId zone) {
                return this;
            }

            @Override
            public Instant instant() {
                if (failNext.getAndSet(false)) {
                    throw new DateTimeException("clock unavailable");
                }
                return clock.instant();
            }
        };
        OrderLifecycleManager orders = orders();
        QuotingStrategy strategy = new QuotingStrategy(new QuotePricer(exchange, new BigDecimal("0.5"), metrics), orders,
                failingOnce, events, metrics, SETTINGS);
        QuotingRun run = run(BigDecimal.TEN, Duration.ofMinutes(5), new ManualRefreshTicker(clock));

        assertThatThrownBy(() -> strategy.run(run)).isInstanceOf(DateTimeException.class);

        assertThat(run.state()).isEqualTo(StrategyState.DONE);
        assertThat(run.isActive()).isFalse();
        assertThat(exchange.submitted).isEmpty();
    }

    private QuotingRun run(BigDecimal riskAmount, Duration duration, RefreshTicker ticker) {
        return new QuotingRun("r1", INSTRUMENT, riskAmount, new BigDecimal("0.03"), duration, ticker);
    }

    private OrderLifecycleManager orders() {
        return new OrderLifecycleManager(exchange, new BigDecimal("0.01"), new BigDecimal("0.99"), clock,
                events, metrics);
    }

    private QuotingStrategy strategy(QuotePricer pricer, OrderLifecycleManager orders) {
        return new QuotingStrategy(pricer, orders, clock, events, metrics, SETTINGS);
    }
}
