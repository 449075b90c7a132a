package com.liquibot.mm.exchange;

import java.util.List;

/**
 * Source of tradeable, reward-enabled markets.
 */
public interface MarketCatalog {

  List<MarketDescriptor> listMarkets();
}
