package com.liquibot.mm.maker.web;

import com.liquibot.mm.config.MakerProperties;
import com.liquibot.mm.domain.Instrument;
import com.liquibot.mm.maker.strategy.RunSummary;
import com.liquibot.mm.maker.strategy.StrategyRunRegistry;
import jakarta.validation.Valid;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

@RestController
@RequestMapping("/api/strategy")
@RequiredArgsConstructor
public class StrategyController {

    private final @NonNull MakerProperties properties;
    private final @NonNull StrategyRunRegistry runs;

    @GetMapping("/status")
    public ResponseEntity<StrategyStatusResponse> status() {
        MakerProperties.Strategy strategy = properties.strategy();
        return ResponseEntity.ok(new StrategyStatusResponse(
                properties.mode().name(),
                strategy.refreshMillis(),
                strategy.maxConcurrentRuns(),
                runs.activeCount(),
                runs.summaries()
        ));
    }

    @PostMapping("/runs")
    public ResponseEntity<RunSummary> start(@Valid @RequestBody StartRunRequest request) {
        MakerProperties.Strategy strategy = properties.strategy();
        BigDecimal maxSpread = request.maxSpread() == null ? strategy.defaultMaxSpread() : request.maxSpread();
        long minutes = request.durationMinutes() == null ? strategy.defaultDurationMinutes() : request.durationMinutes();
        RunSummary summary = runs.start(
                new Instrument(request.marketId(), request.tokenId()),
                request.riskAmount(),
                maxSpread,
                Duration.ofMinutes(minutes)
        );
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(summary);
    }

    @GetMapping("/runs/{runId}")
    public ResponseEntity<RunSummary> run(@PathVariable String runId) {
        return ResponseEntity.of(runs.find(runId));
    }

    @DeleteMapping("/runs/{runId}")
    public ResponseEntity<RunSummary> stop(@PathVariable String runId) {
        return ResponseEntity.of(runs.stop(runId));
    }

    public record StrategyStatusResponse(
            String mode,
            long refreshMillis,
            int maxConcurrentRuns,
            int activeRuns,
            List<RunSummary> runs
    ) {
    }
}
