package com.liquibot.mm.maker.strategy;

import com.liquibot.mm.domain.Instrument;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Starts strategy runs on a fixed worker pool, at most one active run per instrument.
 */
@Slf4j
public class StrategyRunRegistry {

    private static final int MAX_FINISHED_RUNS = 100;
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final QuotingStrategy strategy;
    private final int maxConcurrentRuns;
    private final Supplier<RefreshTicker> tickerFactory;
    private final ExecutorService workers;

    private final Map<String, QuotingRun> runs = new LinkedHashMap<>();

    public StrategyRunRegistry(QuotingStrategy strategy, int maxConcurrentRuns, Supplier<RefreshTicker> tickerFactory) {
        this.strategy = strategy;
        this.maxConcurrentRuns = Math.max(1, maxConcurrentRuns);
        this.tickerFactory = tickerFactory == null ? LatchRefreshTicker::new : tickerFactory;
        AtomicInteger threadIndex = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(this.maxConcurrentRuns, r -> {
            Thread t = new Thread(r, "quoting-run-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized RunSummary start(Instrument instrument, BigDecimal riskAmount, BigDecimal maxSpread, Duration duration) {
        for (QuotingRun existing : runs.values()) {
            if (existing.isActive() && existing.instrument().equals(instrument)) {
                throw new RunRejectedException("instrument " + instrument + " is already quoted by run " + existing.runId());
            }
        }
        if (activeCount() >= maxConcurrentRuns) {
            throw new RunRejectedException("all " + maxConcurrentRuns + " run slots are busy");
        }

        QuotingRun run = new QuotingRun(UUID.randomUUID().toString(), instrument, riskAmount, maxSpread, duration, tickerFactory.get());
        try {
            workers.execute(() -> execute(run));
        } catch (RejectedExecutionException e) {
            throw new RunRejectedException("run registry is shutting down");
        }
        runs.put(run.runId(), run);
        pruneFinished();
        return run.summary();
    }

    public Optional<RunSummary> find(String runId) {
        synchronized (this) {
            return Optional.ofNullable(runs.get(runId)).map(QuotingRun::summary);
        }
    }

    /**
     * Asks the run to stop. It winds down on its own thread.
     */
    public Optional<RunSummary> stop(String runId) {
        QuotingRun run;
        synchronized (this) {
            run = runs.get(runId);
        }
        if (run == null) {
            return Optional.empty();
        }
        run.requestStop();
        log.info("stop requested for run {} ({})", runId, run.instrument());
        return Optional.of(run.summary());
    }

    public synchronized List<RunSummary> summaries() {
        List<RunSummary> out = new ArrayList<>();
        for (QuotingRun run : runs.values()) {
            out.add(run.summary());
        }
        out.sort(Comparator.comparing(RunSummary::startedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        return out;
    }

    public synchronized int activeCount() {
        return (int) runs.values().stream().filter(QuotingRun::isActive).count();
    }

    @PreDestroy
    public void shutdown() {
        List<QuotingRun> active;
        synchronized (this) {
            active = runs.values().stream().filter(QuotingRun::isActive).toList();
        }
        if (!active.isEmpty()) {
            log.info("stopping {} active run(s) before shutdown", active.size());
        }
        active.forEach(QuotingRun::requestStop);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("runs did not wind down within {}s", SHUTDOWN_GRACE.toSeconds());
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            workers.shutdownNow();
        }
    }

    private void execute(QuotingRun run) {
        try {
            strategy.run(run);
        } catch (RuntimeException e) {
            log.error("run {} for {} aborted", run.runId(), run.instrument(), e);
        }
    }

    private void pruneFinished() {
        long finished = runs.values().stream().filter(r -> !r.isActive()).count();
        Iterator<Map.Entry<String, QuotingRun>> it = runs.entrySet().iterator();
        while (finished > MAX_FINISHED_RUNS && it.hasNext()) {
            if (!it.next().getValue().isActive()) {
                it.remove();
                finished--;
            }
        }
    }
}
