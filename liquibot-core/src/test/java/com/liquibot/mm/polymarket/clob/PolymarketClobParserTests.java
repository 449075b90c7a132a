package com.liquibot.mm.polymarket.clob;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.domain.Trade;
import com.liquibot.mm.exchange.CancelOrderResponse;
import com.liquibot.mm.exchange.MarketDescriptor;
import com.liquibot.mm.exchange.OpenOrder;
import com.liquibot.mm.exchange.SubmitOrderResponse;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class PolymarketClobParserTests {

  private final ObjectMapper objectMapper = new ObjectMapper();

  @Test
  void bookLevels_mapsBidsAndAsksAndSkipsEmptyLevels() throws Exception {
    JsonNode book = objectMapper.readTree("""
        {
          "market": "0xabc",
          "asset_id": "111",
          "bids": [{"price": "0.45", "size": "100"}, {"price": "0.44", "size": "0"}],
          "asks": [{"price": "0.55", "size": "20.5"}]
        }
        """);

    List<OpenOrder> levels = PolymarketClobParser.bookLevels(book, "0xabc", "111");

    assertThat(levels).hasSize(2);
    assertThat(levels.get(0).side()).isEqualTo(OrderSide.BUY);
    assertThat(levels.get(0).price()).isEqualByComparingTo("0.45");
    assertThat(levels.get(1).side()).isEqualTo(OrderSide.SELL);
    assertThat(levels.get(1).size()).isEqualByComparingTo("20.5");
    assertThat(levels.get(1).id()).isNull();
  }

  @Test
  void openOrders_usesRemainingSize() throws Exception {
    JsonNode page = objectMapper.readTree("""
        {
          "data": [
            {"id": "o1", "market": "0xabc", "asset_id": "111", "side": "BUY",
             "price": "0.40", "original_size": "10", "size_matched": "4"},
            {"id": "o2", "side": "SELL", "price": "0.60"}
          ],
          "next_cursor": "LTE="
        }
        """);

    List<OpenOrder> orders = PolymarketClobParser.openOrders(page);

    assertThat(orders).singleElement().satisfies(o -> {
      assertThat(o.id()).isEqualTo("o1");
      assertThat(o.size()).isEqualByComparingTo("6");
    });
    assertThat(PolymarketClobParser.nextCursor(page)).isEqualTo(PolymarketClobPaths.END_CURSOR);
  }

  @Test
  void trades_readsStatusAndMatchTime() throws Exception {
    JsonNode page = objectMapper.readTree("""
        {
          "data": [
            {"id": "t1", "market": "0xabc", "asset_id": "111", "side": "buy", "size": "10",
             "price": "0.40", "status": "CONFIRMED", "match_time": "1700000000"},
            {"id": "t2", "side": "SELL", "size": "5", "price": "0.7", "status": "MATCHED"}
          ],
          "next_cursor": "MTAw"
        }
        """);

    List<Trade> trades = PolymarketClobParser.trades(page);

    assertThat(trades).hasSize(2);
    assertThat(trades.get(0).isConfirmed()).isTrue();
    assertThat(trades.get(0).side()).isEqualTo(OrderSide.BUY);
    assertThat(trades.get(0).matchTime()).isEqualTo(Instant.ofEpochSecond(1_700_000_000L));
    assertThat(trades.get(1).isConfirmed()).isFalse();
    assertThat(PolymarketClobParser.nextCursor(page)).isEqualTo("MTAw");
  }

  @Test
  void submitResponse_distinguishesAcceptedFromRejected() throws Exception {
    SubmitOrderResponse ok = PolymarketClobParser.submitResponse(objectMapper.readTree("""
        {"success": true, "orderID": "0xorder", "status": "live", "errorMsg": ""}
        """));
    SubmitOrderResponse rejected = PolymarketClobParser.submitResponse(objectMapper.readTree("""
        {"success": false, "errorMsg": "not enough balance / allowance"}
        """));

    assertThat(ok.success()).isTrue();
    assertThat(ok.orderId()).isEqualTo("0xorder");
    assertThat(rejected.success()).isFalse();
    assertThat(rejected.hasOrderId()).isFalse();
    assertThat(rejected.errorMessage()).contains("balance");
  }

  @Test
  void cancelResponse_readsCanceledAndRefusedIds() throws Exception {
    CancelOrderResponse response = PolymarketClobParser.cancelResponse(objectMapper.readTree("""
        {"canceled": ["a"], "not_canceled": {"b": "order already matched"}}
        """));

    assertThat(response.isCanceled("a")).isTrue();
    assertThat(response.isCanceled("b")).isFalse();
    assertThat(response.reasonNotCanceled("b")).isEqualTo("order already matched");
  }

  @Test
  void markets_readsTokensAndRewards() throws Exception {
    JsonNode page = objectMapper.readTree("""
        {
          "data": [
            {
              "condition_id": "0x1234567890abcdef",
              "tokens": [
                {"token_id": "111", "outcome": "Yes", "price": 0.62},
                {"token_id": "222", "outcome": "No", "price": 0.38}
              ],
              "rewards": {"min_size": 50, "max_spread": 3.5},
              "active": true,
              "closed": false
            }
          ],
          "next_cursor": "LTE="
        }
        """);

    List<MarketDescriptor> markets = PolymarketClobParser.markets(page);

    assertThat(markets).singleElement().satisfies(m -> {
      assertThat(m.name()).isEqualTo("Yes vs No");
      assertThat(m.description()).isEqualTo("Market abcdef - Outcomes: Yes, No");
      assertThat(m.rewards().minSize()).isEqualByComparingTo("50");
      assertThat(m.active()).isTrue();
      assertThat(m.tokens()).extracting(MarketDescriptor.OutcomeToken::tokenId).containsExactly("111", "222");
    });
  }

  @Test
  void minimumOrderSize_readsNumberOrString() throws Exception {
    assertThat(PolymarketClobParser.minimumOrderSize(objectMapper.readTree("{\"minimum_order_size\": 15}")))
        .isEqualByComparingTo("15");
    assertThat(PolymarketClobParser.minimumOrderSize(objectMapper.readTree("{\"minimum_order_size\": \"5\"}")))
        .isEqualByComparingTo("5");
    assertThat(PolymarketClobParser.minimumOrderSize(objectMapper.readTree("{}"))).isNull();
  }
}
