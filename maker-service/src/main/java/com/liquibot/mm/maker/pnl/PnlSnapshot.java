package com.liquibot.mm.maker.pnl;

import java.math.BigDecimal;
import java.time.Instant;

public record PnlSnapshot(
        Instant timestamp,
        BigDecimal realizedPnl,
        BigDecimal rewards,
        BigDecimal totalPnl,
        BigDecimal buyVolume,
        BigDecimal sellVolume,
        int confirmedTrades
) {
}
