package com.liquibot.mm.maker.web;

import com.liquibot.mm.exchange.MarketDescriptor;
import com.liquibot.mm.maker.catalog.MarketCatalogService;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/markets")
@RequiredArgsConstructor
public class MarketController {

    private final @NonNull MarketCatalogService catalog;

    @GetMapping
    public List<MarketView> markets(@RequestParam(name = "q", required = false) String query) {
        return catalog.search(query).stream().map(MarketView::of).toList();
    }

    @GetMapping("/{conditionId}")
    public ResponseEntity<MarketView> market(@PathVariable String conditionId) {
        return ResponseEntity.of(catalog.find(conditionId).map(MarketView::of));
    }

    public record MarketView(
            String conditionId,
            String name,
            String description,
            List<MarketDescriptor.OutcomeToken> tokens,
            MarketDescriptor.RewardParams rewards,
            boolean active,
            boolean closed
    ) {
        static MarketView of(MarketDescriptor market) {
            return new MarketView(
                    market.conditionId(),
                    market.name(),
                    market.description(),
                    market.tokens(),
                    market.rewards(),
                    market.active(),
                    market.closed()
            );
        }
    }
}
