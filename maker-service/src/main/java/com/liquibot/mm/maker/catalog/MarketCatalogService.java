package com.liquibot.mm.maker.catalog;

import com.liquibot.mm.exchange.MarketCatalog;
import com.liquibot.mm.exchange.MarketDescriptor;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Cached view of the reward-enabled markets, searchable by name.
 */
@Slf4j
public class MarketCatalogService {

    private final MarketCatalog catalog;
    private final Clock clock;
    private final Duration ttl;

    private volatile Cached cached;

    public MarketCatalogService(MarketCatalog catalog, Clock clock, Duration ttl) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = ttl == null ? Duration.ZERO : ttl;
    }

    /**
     * Markets whose name or description contains {@code query} (case-insensitive); all markets for a blank query.
     * A failed refresh serves the previous list when there is one.
     */
    public List<MarketDescriptor> search(String query) {
        List<MarketDescriptor> markets = markets();
        if (query == null || query.isBlank()) {
            return markets;
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        return markets.stream()
                .filter(m -> m.name().toLowerCase(Locale.ROOT).contains(needle)
                        || m.description().toLowerCase(Locale.ROOT).contains(needle)
                        || m.conditionId().toLowerCase(Locale.ROOT).contains(needle))
                .toList();
    }

    public Optional<MarketDescriptor> find(String conditionId) {
        return markets().stream().filter(m -> m.conditionId().equalsIgnoreCase(conditionId)).findFirst();
    }

    private List<MarketDescriptor> markets() {
        Instant now = clock.instant();
        Cached current = cached;
        if (current != null && now.isBefore(current.fetchedAt().plus(ttl))) {
            return current.markets();
        }
        try {
            List<MarketDescriptor> fresh = List.copyOf(catalog.listMarkets());
            cached = new Cached(now, fresh);
            return fresh;
        } catch (RuntimeException e) {
            if (current == null) {
                throw e;
            }
            log.warn("market catalog refresh failed, serving {} cached market(s): {}", current.markets().size(), e.getMessage());
            return current.markets();
        }
    }

    private record Cached(Instant fetchedAt, List<MarketDescriptor> markets) {
    }
}
