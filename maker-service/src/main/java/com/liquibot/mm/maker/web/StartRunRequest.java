package com.liquibot.mm.maker.web;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.math.BigDecimal;

/**
 * Body of {@code POST /api/strategy/runs}. Omitted spread and duration fall back to {@code maker.strategy.*}.
 */
public record StartRunRequest(
        @NotBlank String marketId,
        @NotBlank String tokenId,
        @NotNull @Positive BigDecimal riskAmount,
        @DecimalMin("0.0") @DecimalMax("1.0") BigDecimal maxSpread,
        // 366 days, the longest run accepted
        @Min(1) @Max(527_040) Long durationMinutes
) {
}
