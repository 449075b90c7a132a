package com.liquibot.mm.maker.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.liquibot.mm.config.MakerProperties;
import com.liquibot.mm.events.MakerEventPublisher;
import com.liquibot.mm.exchange.ExchangeClient;
import com.liquibot.mm.exchange.MarketCatalog;
import com.liquibot.mm.exchange.RewardsSource;
import com.liquibot.mm.maker.catalog.MarketCatalogService;
import com.liquibot.mm.maker.metrics.MakerMetrics;
import com.liquibot.mm.maker.orders.OrderLifecycleManager;
import com.liquibot.mm.maker.paper.PaperExchangeClient;
import com.liquibot.mm.maker.pnl.PnlTracker;
import com.liquibot.mm.maker.pricing.QuotePricer;
import com.liquibot.mm.maker.strategy.LatchRefreshTicker;
import com.liquibot.mm.maker.strategy.QuotingStrategy;
import com.liquibot.mm.maker.strategy.StrategyRunRegistry;
import com.liquibot.mm.polymarket.auth.PolymarketAuthContext;
import com.liquibot.mm.polymarket.clob.PolymarketClobClient;
import com.liquibot.mm.polymarket.exchange.ClobMarketCatalog;
import com.liquibot.mm.polymarket.exchange.LiveExchangeClient;
import com.liquibot.mm.polymarket.http.PolymarketHttpTransport;
import com.liquibot.mm.polymarket.http.RequestRateLimiter;
import com.liquibot.mm.polymarket.http.RetryPolicy;
import com.liquibot.mm.polymarket.http.TokenBucketRateLimiter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

/**
 * Wires the quoting core to either the live CLOB or the paper exchange, depending on {@code maker.mode}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(MakerProperties.class)
public class MakerServiceConfiguration {

    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration CATALOG_CACHE_TTL = Duration.ofMinutes(5);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public HttpClient polymarketHttpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(CONNECT_TIMEOUT)
                .build();
    }

    @Bean
    public PolymarketHttpTransport polymarketHttpTransport(MakerProperties properties, HttpClient polymarketHttpClient, ObjectMapper objectMapper, Clock clock) {
        MakerProperties.Rest rest = properties.polymarket().rest();
        RequestRateLimiter limiter = Boolean.TRUE.equals(rest.rateLimit().enabled()) && rest.rateLimit().requestsPerSecond() > 0
                ? new TokenBucketRateLimiter(rest.rateLimit().requestsPerSecond(), Math.max(1, rest.rateLimit().burst()), clock)
                : RequestRateLimiter.noop();
        RetryPolicy retry = new RetryPolicy(
                rest.retry().enabled(),
                rest.retry().maxAttempts(),
                rest.retry().initialBackoffMillis(),
                rest.retry().maxBackoffMillis()
        );
        return new PolymarketHttpTransport(polymarketHttpClient, objectMapper, limiter, retry);
    }

    @Bean
    public PolymarketClobClient polymarketClobClient(MakerProperties properties, PolymarketHttpTransport transport, ObjectMapper objectMapper, Clock clock) {
        MakerProperties.Polymarket polymarket = properties.polymarket();
        return new PolymarketClobClient(
                URI.create(polymarket.clobRestUrl()),
                transport,
                objectMapper,
                clock,
                polymarket.chainId(),
                polymarket.useServerTime()
        );
    }

    @Bean
    public PolymarketAuthContext polymarketAuthContext(MakerProperties properties, PolymarketClobClient clobClient) {
        PolymarketAuthContext auth = new PolymarketAuthContext(properties, clobClient);
        auth.initFromConfig();
        if (properties.mode() == MakerProperties.TradingMode.LIVE) {
            auth.requireSignerCredentials();
            auth.requireApiCreds();
            log.info("LIVE trading as {}", auth.tradingAddress());
        }
        return auth;
    }

    @Bean
    public ExchangeClient exchangeClient(MakerProperties properties, PolymarketClobClient clobClient, PolymarketAuthContext auth, Clock clock) {
        LiveExchangeClient live = new LiveExchangeClient(
                clobClient,
                auth,
                clock,
                Duration.ofMillis(properties.strategy().minOrderSizeCacheMillis())
        );
        if (properties.mode() == MakerProperties.TradingMode.LIVE) {
            return live;
        }
        MakerProperties.Paper paper = properties.paper();
        log.info("PAPER mode: own orders are simulated (fillsEnabled={})", paper.fillsEnabled());
        return new PaperExchangeClient(live, clock, paper.fillsEnabled(), paper.defaultMinOrderSize());
    }

    @Bean
    public MarketCatalog marketCatalog(PolymarketClobClient clobClient) {
        return new ClobMarketCatalog(clobClient);
    }

    @Bean
    public MarketCatalogService marketCatalogService(MarketCatalog marketCatalog, Clock clock) {
        return new MarketCatalogService(marketCatalog, clock, CATALOG_CACHE_TTL);
    }

    @Bean
    public RewardsSource rewardsSource(MakerProperties properties) {
        return RewardsSource.fixed(properties.rewards().fixedTotal());
    }

    @Bean
    public MakerMetrics makerMetrics(MeterRegistry meterRegistry) {
        return new MakerMetrics(meterRegistry);
    }

    @Bean
    public QuotePricer quotePricer(ExchangeClient exchangeClient, MakerProperties properties, MakerMetrics metrics) {
        return new QuotePricer(exchangeClient, properties.strategy().fallbackMidPrice(), metrics);
    }

    @Bean
    public OrderLifecycleManager orderLifecycleManager(
            ExchangeClient exchangeClient,
            MakerProperties properties,
            Clock clock,
            MakerEventPublisher events,
            MakerMetrics metrics
    ) {
        MakerProperties.Strategy strategy = properties.strategy();
        return new OrderLifecycleManager(exchangeClient, strategy.minPrice(), strategy.maxPrice(), clock, events, metrics);
    }

    @Bean
    public QuotingStrategy quotingStrategy(
            QuotePricer pricer,
            OrderLifecycleManager orders,
            MakerProperties properties,
            Clock clock,
            MakerEventPublisher events,
            MakerMetrics metrics
    ) {
        MakerProperties.Strategy strategy = properties.strategy();
        QuotingStrategy.Settings settings = new QuotingStrategy.Settings(
                Duration.ofMillis(strategy.refreshMillis()),
                Duration.ofMillis(strategy.recoveryMillis()),
                strategy.minPrice(),
                strategy.maxPrice(),
                strategy.feeRateBps()
        );
        log.info("quoting settings: refreshMillis={}, recoveryMillis={}, prices=[{}, {}], feeRateBps={}",
                strategy.refreshMillis(), strategy.recoveryMillis(), strategy.minPrice(), strategy.maxPrice(), strategy.feeRateBps());
        return new QuotingStrategy(pricer, orders, clock, events, metrics, settings);
    }

    @Bean
    public StrategyRunRegistry strategyRunRegistry(QuotingStrategy quotingStrategy, MakerProperties properties) {
        return new StrategyRunRegistry(quotingStrategy, properties.strategy().maxConcurrentRuns(), LatchRefreshTicker::new);
    }

    @Bean
    public PnlTracker pnlTracker(
            ExchangeClient exchangeClient,
            RewardsSource rewardsSource,
            Clock clock,
            MakerEventPublisher events,
            MakerMetrics metrics
    ) {
        return new PnlTracker(exchangeClient, rewardsSource, clock, events, metrics);
    }
}
