package com.liquibot.mm.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;

@Validated
@ConfigurationProperties(prefix="maker")
public record MakerProperties(
    TradingMode mode,
    @Valid Polymarket polymarket,
    @Valid Strategy strategy,
    @Valid Pnl pnl,
    @Valid Rewards rewards,
    @Valid Paper paper
) {

  public MakerProperties {
    if (mode == null) {
      mode = TradingMode.PAPER;
    }
    if (polymarket == null) {
      polymarket = defaultPolymarket();
    }
    if (strategy == null) {
      strategy = defaultStrategy();
    }
    if (pnl == null) {
      pnl = defaultPnl();
    }
    if (rewards == null) {
      rewards = defaultRewards();
    }
    if (paper == null) {
      paper = defaultPaper();
    }
  }

  private static Polymarket defaultPolymarket() {
    return new Polymarket(null, null, null, null, null);
  }

  private static Rest defaultRest() {
    return new Rest(null, null);
  }

  private static RateLimit defaultRateLimit() {
    return new RateLimit(null, null, null);
  }

  private static Retry defaultRetry() {
    return new Retry(null, null, null, null);
  }

  private static Auth defaultAuth() {
    return new Auth(null, null, null, null, null, null, null, null);
  }

  private static Strategy defaultStrategy() {
    return new Strategy(null, null, null, null, null, null, null, null, null, null);
  }

  private static Pnl defaultPnl() {
    return new Pnl(null, null);
  }

  private static Rewards defaultRewards() {
    return new Rewards(null);
  }

  private static Paper defaultPaper() {
    return new Paper(null, null);
  }

  public enum TradingMode {
    /**
     * Own orders are simulated in memory; market data still comes from the public CLOB.
     */
    PAPER,
    LIVE,
  }

  public record Polymarket(
      String clobRestUrl,
      @Min(1) Integer chainId,
      Boolean useServerTime,
      @Valid Rest rest,
      @Valid Auth auth
  ) {
    public Polymarket {
      if (clobRestUrl == null || clobRestUrl.isBlank()) {
        clobRestUrl = "https://clob.polymarket.com";
      }
      if (chainId == null) {
        chainId = 137;
      }
      if (useServerTime == null) {
        useServerTime = false;
      }
      if (rest == null) {
        rest = defaultRest();
      }
      if (auth == null) {
        auth = defaultAuth();
      }
    }
  }

  public record Rest(@Valid RateLimit rateLimit, @Valid Retry retry) {
    public Rest {
      if (rateLimit == null) {
        rateLimit = defaultRateLimit();
      }
      if (retry == null) {
        retry = defaultRetry();
      }
    }
  }

  public record RateLimit(
      @NotNull Boolean enabled,
      @NotNull @PositiveOrZero Double requestsPerSecond,
      @NotNull @PositiveOrZero Integer burst
  ) {
    public RateLimit {
      if (enabled == null) {
        enabled = true;
      }
      if (requestsPerSecond == null) {
        requestsPerSecond = 10.0;
      }
      if (burst == null) {
        burst = 20;
      }
    }
  }

  public record Retry(
      @NotNull Boolean enabled,
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @PositiveOrZero Long maxBackoffMillis
  ) {
    public Retry {
      if (enabled == null) {
        enabled = true;
      }
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 200L;
      }
      if (maxBackoffMillis == null) {
        maxBackoffMillis = 2_000L;
      }
    }
  }

  public record Auth(
      String privateKey,
      @NotNull @Min(0) Integer signatureType,
      String funderAddress,
      String apiKey,
      String apiSecret,
      String apiPassphrase,
      @NotNull @PositiveOrZero Long nonce,
      @NotNull Boolean autoCreateOrDeriveApiCreds
  ) {
    public Auth {
      if (signatureType == null) {
        signatureType = 0;
      }
      if (nonce == null) {
        nonce = 0L;
      }
      if (autoCreateOrDeriveApiCreds == null) {
        autoCreateOrDeriveApiCreds = false;
      }
    }
  }

  /**
   * Quoting loop settings. Per-run parameters (risk amount, spread, duration) come with each run request;
   * the values here are defaults and loop timing.
   */
  public record Strategy(
      /**
       * Wait between refresh cycles.
       */
      @NotNull @Min(1) Long refreshMillis,
      /**
       * Wait after a cycle failed unexpectedly.
       */
      @NotNull @Min(1) Long recoveryMillis,
      @NotNull @PositiveOrZero @DecimalMax("1.0") BigDecimal defaultMaxSpread,
      @NotNull @Min(1) Long defaultDurationMinutes,
      @NotNull @Min(0) Integer feeRateBps,
      @NotNull @PositiveOrZero @DecimalMax("1.0") BigDecimal minPrice,
      @NotNull @PositiveOrZero @DecimalMax("1.0") BigDecimal maxPrice,
      /**
       * Mid-price used when the book is empty or cannot be fetched.
       */
      @NotNull @PositiveOrZero @DecimalMax("1.0") BigDecimal fallbackMidPrice,
      @NotNull @Min(1) Integer maxConcurrentRuns,
      /**
       * How long an exchange-reported minimum order size is reused before it is fetched again.
       */
      @NotNull @PositiveOrZero Long minOrderSizeCacheMillis
  ) {
    public Strategy {
      if (refreshMillis == null) {
        refreshMillis = 30_000L;
      }
      if (recoveryMillis == null) {
        recoveryMillis = 5_000L;
      }
      if (defaultMaxSpread == null) {
        defaultMaxSpread = new BigDecimal("0.03");
      }
      if (defaultDurationMinutes == null) {
        defaultDurationMinutes = 60L;
      }
      if (feeRateBps == null) {
        feeRateBps = 0;
      }
      if (minPrice == null) {
        minPrice = new BigDecimal("0.01");
      }
      if (maxPrice == null) {
        maxPrice = new BigDecimal("0.99");
      }
      if (fallbackMidPrice == null) {
        fallbackMidPrice = new BigDecimal("0.5");
      }
      if (maxConcurrentRuns == null) {
        maxConcurrentRuns = 4;
      }
      if (minOrderSizeCacheMillis == null) {
        minOrderSizeCacheMillis = 600_000L;
      }
    }
  }

  public record Pnl(
      @NotNull Boolean pollEnabled,
      @NotNull @Min(1_000) Long pollMillis
  ) {
    public Pnl {
      if (pollEnabled == null) {
        pollEnabled = true;
      }
      if (pollMillis == null) {
        pollMillis = 60_000L;
      }
    }
  }

  /**
   * Liquidity rewards are paid out by the exchange once a day; until a rewards API is wired in,
   * the configured total is reported as-is.
   */
  public record Rewards(@NotNull BigDecimal fixedTotal) {
    public Rewards {
      if (fixedTotal == null) {
        fixedTotal = BigDecimal.ZERO;
      }
    }
  }

  public record Paper(
      @NotNull Boolean fillsEnabled,
      @NotNull @PositiveOrZero BigDecimal defaultMinOrderSize
  ) {
    public Paper {
      if (fillsEnabled == null) {
        fillsEnabled = true;
      }
      if (defaultMinOrderSize == null) {
        defaultMinOrderSize = new BigDecimal("5");
      }
    }
  }
}
