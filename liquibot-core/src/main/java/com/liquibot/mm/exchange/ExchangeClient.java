package com.liquibot.mm.exchange;

import com.liquibot.mm.domain.Trade;

import java.math.BigDecimal;
import java.util.List;

/**
 * Narrow view of the exchange used by the quoting core.
 *
 * <p>Implementations must be safe for concurrent use by several strategy runs. Every method may fail with
 * {@link ExchangeClientException} (or another runtime exception); callers treat that as recoverable.
 */
public interface ExchangeClient {

  SubmitOrderResponse submitOrder(OrderSpec spec);

  CancelOrderResponse cancelOrder(String orderId);

  /**
   * Resting orders of all participants for one outcome token.
   */
  List<OpenOrder> listOpenOrders(String marketId, String tokenId);

  /**
   * Resting orders of this account only.
   */
  List<OpenOrder> listOwnOpenOrders(String marketId, String tokenId);

  List<Trade> listTrades(TradeFilter filter);

  String getAccountAddress();

  BigDecimal getMinOrderSize(String marketId);
}
