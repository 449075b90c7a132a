package com.liquibot.mm.polymarket.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.liquibot.mm.exchange.MarketCatalog;
import com.liquibot.mm.exchange.MarketDescriptor;
import com.liquibot.mm.polymarket.clob.PolymarketClobClient;
import com.liquibot.mm.polymarket.clob.PolymarketClobParser;
import com.liquibot.mm.polymarket.clob.PolymarketClobPaths;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Reward-enabled markets from {@code /sampling-simplified-markets}, all pages.
 */
@Slf4j
@RequiredArgsConstructor
public class ClobMarketCatalog implements MarketCatalog {

  private static final int MAX_PAGES = 100;

  private final @NonNull PolymarketClobClient clob;

  @Override
  public List<MarketDescriptor> listMarkets() {
    List<MarketDescriptor> out = new ArrayList<>();
    String cursor = null;
    for (int page = 0; page < MAX_PAGES; page++) {
      JsonNode node = clob.samplingSimplifiedMarkets(cursor);
      out.addAll(PolymarketClobParser.markets(node));
      cursor = PolymarketClobParser.nextCursor(node);
      if (PolymarketClobPaths.END_CURSOR.equals(cursor)) {
        break;
      }
    }
    log.debug("loaded {} sampling markets", out.size());
    return out;
  }
}
