package com.liquibot.mm.maker.catalog;

import com.liquibot.mm.exchange.ExchangeClientException;
import com.liquibot.mm.exchange.MarketCatalog;
import com.liquibot.mm.exchange.MarketDescriptor;
import com.liquibot.mm.maker.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MarketCatalogServiceTest {

    private static final MarketDescriptor ELECTION = market("0xaaa111", "Yes", "No");
    private static final MarketDescriptor DERBY = market("0xbbb222", "Lakers", "Celtics");

    @Mock
    private MarketCatalog catalog;
    private MutableClock clock;
    private MarketCatalogService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
        service = new MarketCatalogService(catalog, clock, Duration.ofMinutes(5));
    }

    @Test
    void searchMatchesNameDescriptionAndConditionId() {
        when(catalog.listMarkets()).thenReturn(List.of(ELECTION, DERBY));

        assertThat(service.search(null)).containsExactly(ELECTION, DERBY);
        assertThat(service.search("lakers")).containsExactly(DERBY);
        assertThat(service.search("Market aaa111")).containsExactly(ELECTION);
        assertThat(service.search("0XBBB")).containsExactly(DERBY);
        assertThat(service.search("nothing")).isEmpty();
        assertThat(DERBY.name()).isEqualTo("Lakers vs Celtics");
    }

    @Test
    void listIsCachedUntilTtlExpires() {
        when(catalog.listMarkets()).thenReturn(List.of(ELECTION), List.of(ELECTION, DERBY));

        assertThat(service.search("")).hasSize(1);
        clock.advance(Duration.ofMinutes(4));
        assertThat(service.search("")).hasSize(1);
        clock.advance(Duration.ofMinutes(2));
        assertThat(service.search("")).hasSize(2);

        verify(catalog, times(2)).listMarkets();
    }

    @Test
    void failedRefreshServesPreviousList() {
        when(catalog.listMarkets())
                .thenReturn(List.of(ELECTION))
                .thenThrow(new ExchangeClientException("markets unavailable", 503, null));

        service.search("");
        clock.advance(Duration.ofMinutes(10));

        assertThat(service.find("0xAAA111")).contains(ELECTION);
    }

    @Test
    void failedFirstLoadPropagates() {
        when(catalog.listMarkets()).thenThrow(new ExchangeClientException("markets unavailable", 503, null));

        assertThatThrownBy(() -> service.search("x")).isInstanceOf(ExchangeClientException.class);
    }

    private static MarketDescriptor market(String conditionId, String first, String second) {
        return new MarketDescriptor(
                conditionId,
                List.of(new MarketDescriptor.OutcomeToken(conditionId + "-1", first, new BigDecimal("0.5")),
                        new MarketDescriptor.OutcomeToken(conditionId + "-2", second, new BigDecimal("0.5"))),
                new MarketDescriptor.RewardParams(new BigDecimal("20"), new BigDecimal("3.5")),
                true,
                false
        );
    }
}
