package com.liquibot.mm.maker.strategy;

import com.liquibot.mm.maker.pricing.MidPriceQuote;

import java.math.BigDecimal;
import java.time.Instant;

public record RunSummary(
        String runId,
        String marketId,
        String tokenId,
        StrategyState state,
        BigDecimal orderSize,
        BigDecimal maxSpread,
        Instant startedAt,
        Instant endsAt,
        Instant finishedAt,
        long cycles,
        long cycleErrors,
        long ordersPlaced,
        long placementFailures,
        BigDecimal lastMidPrice,
        MidPriceQuote.Source lastMidSource,
        String activeBuyOrderId,
        String activeSellOrderId,
        boolean stopRequested
) {
}
