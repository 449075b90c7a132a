package com.liquibot.mm.polymarket.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.liquibot.mm.domain.Trade;
import com.liquibot.mm.exchange.CancelOrderResponse;
import com.liquibot.mm.exchange.ExchangeClient;
import com.liquibot.mm.exchange.ExchangeClientException;
import com.liquibot.mm.exchange.OpenOrder;
import com.liquibot.mm.exchange.OrderSpec;
import com.liquibot.mm.exchange.SubmitOrderResponse;
import com.liquibot.mm.exchange.TradeFilter;
import com.liquibot.mm.polymarket.auth.ApiCreds;
import com.liquibot.mm.polymarket.auth.PolymarketAuthContext;
import com.liquibot.mm.polymarket.clob.PolymarketClobClient;
import com.liquibot.mm.polymarket.clob.PolymarketClobParser;
import com.liquibot.mm.polymarket.clob.PolymarketClobPaths;
import com.liquibot.mm.polymarket.clob.PolymarketOrderBuilder;
import com.liquibot.mm.polymarket.clob.SignedOrder;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link ExchangeClient} backed by the real CLOB. Orders are signed locally and posted with L2 auth.
 */
@Slf4j
public class LiveExchangeClient implements ExchangeClient {

  private static final int MAX_PAGES = 50;

  private final PolymarketClobClient clob;
  private final PolymarketAuthContext auth;
  private final Clock clock;
  private final Duration minOrderSizeTtl;

  private final ConcurrentMap<String, BigDecimal> tickSizeByToken = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Boolean> negRiskByToken = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, CachedSize> minOrderSizeByMarket = new ConcurrentHashMap<>();

  public LiveExchangeClient(PolymarketClobClient clob, PolymarketAuthContext auth, Clock clock, Duration minOrderSizeTtl) {
    this.clob = Objects.requireNonNull(clob, "clob");
    this.auth = Objects.requireNonNull(auth, "auth");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.minOrderSizeTtl = minOrderSizeTtl == null ? Duration.ZERO : minOrderSizeTtl;
  }

  @Override
  public SubmitOrderResponse submitOrder(OrderSpec spec) {
    Credentials signer = auth.requireSignerCredentials();
    ApiCreds creds = auth.requireApiCreds();
    String tokenId = spec.instrument().tokenId();

    BigDecimal tickSize = tickSizeByToken.computeIfAbsent(tokenId, clob::getMinimumTickSize);
    boolean negRisk = negRiskByToken.computeIfAbsent(tokenId, clob::isNegRisk);

    PolymarketOrderBuilder builder = new PolymarketOrderBuilder(
        clob.chainId(),
        signer,
        auth.signatureType(),
        auth.funderAddress()
    );
    SignedOrder order = builder.buildLimitOrder(tokenId, spec.side(), spec.price(), spec.size(), tickSize, negRisk, spec.feeRateBps());
    JsonNode response = clob.postOrder(signer, creds, order, spec.orderType());
    SubmitOrderResponse parsed = PolymarketClobParser.submitResponse(response);
    log.debug("POST /order {} {} {}@{} -> {}", spec.instrument(), spec.side(), spec.size(), spec.price(), parsed);
    return parsed;
  }

  @Override
  public CancelOrderResponse cancelOrder(String orderId) {
    JsonNode response = clob.cancelOrder(auth.requireSignerCredentials(), auth.requireApiCreds(), orderId);
    return PolymarketClobParser.cancelResponse(response);
  }

  @Override
  public List<OpenOrder> listOpenOrders(String marketId, String tokenId) {
    return PolymarketClobParser.bookLevels(clob.getOrderBook(tokenId), marketId, tokenId);
  }

  @Override
  public List<OpenOrder> listOwnOpenOrders(String marketId, String tokenId) {
    Credentials signer = auth.requireSignerCredentials();
    ApiCreds creds = auth.requireApiCreds();
    List<OpenOrder> out = new ArrayList<>();
    String cursor = null;
    for (int page = 0; page < MAX_PAGES; page++) {
      JsonNode node = clob.getOpenOrders(signer, creds, marketId, tokenId, cursor);
      out.addAll(PolymarketClobParser.openOrders(node));
      cursor = PolymarketClobParser.nextCursor(node);
      if (PolymarketClobPaths.END_CURSOR.equals(cursor)) {
        return out;
      }
    }
    log.warn("open orders for {}:{} exceeded {} pages, result truncated", marketId, tokenId, MAX_PAGES);
    return out;
  }

  @Override
  public List<Trade> listTrades(TradeFilter filter) {
    Credentials signer = auth.requireSignerCredentials();
    ApiCreds creds = auth.requireApiCreds();
    List<Trade> out = new ArrayList<>();
    String cursor = null;
    for (int page = 0; page < MAX_PAGES; page++) {
      JsonNode node = clob.getTrades(signer, creds, filter.makerAddress(), filter.marketId(), filter.tokenId(), cursor);
      out.addAll(PolymarketClobParser.trades(node));
      cursor = PolymarketClobParser.nextCursor(node);
      if (PolymarketClobPaths.END_CURSOR.equals(cursor)) {
        return out;
      }
    }
    log.warn("trade history for {} exceeded {} pages, result truncated", filter.makerAddress(), MAX_PAGES);
    return out;
  }

  @Override
  public String getAccountAddress() {
    return auth.tradingAddress();
  }

  @Override
  public BigDecimal getMinOrderSize(String marketId) {
    Instant now = clock.instant();
    CachedSize cached = minOrderSizeByMarket.get(marketId);
    if (cached != null && now.isBefore(cached.expiresAt())) {
      return cached.size();
    }
    BigDecimal size = PolymarketClobParser.minimumOrderSize(clob.getMarket(marketId));
    if (size == null) {
      throw new ExchangeClientException("market " + marketId + " has no minimum_order_size");
    }
    minOrderSizeByMarket.put(marketId, new CachedSize(size, now.plus(minOrderSizeTtl)));
    return size;
  }

  private record CachedSize(BigDecimal size, Instant expiresAt) {
  }
}
