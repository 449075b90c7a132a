package com.liquibot.mm.polymarket.clob;

import com.fasterxml.jackson.databind.JsonNode;
import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.domain.Trade;
import com.liquibot.mm.exchange.CancelOrderResponse;
import com.liquibot.mm.exchange.MarketDescriptor;
import com.liquibot.mm.exchange.OpenOrder;
import com.liquibot.mm.exchange.SubmitOrderResponse;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps raw CLOB JSON responses to exchange-neutral types. Malformed entries are skipped, not fatal.
 */
public final class PolymarketClobParser {

  private PolymarketClobParser() {
  }

  /**
   * Flattens a {@code /book} response into anonymous resting orders (bids as BUY, asks as SELL).
   */
  public static List<OpenOrder> bookLevels(JsonNode book, String marketId, String tokenId) {
    List<OpenOrder> out = new ArrayList<>();
    if (book == null || book.isMissingNode() || book.isNull()) {
      return out;
    }
    appendLevels(out, book.path("bids"), OrderSide.BUY, marketId, tokenId);
    appendLevels(out, book.path("asks"), OrderSide.SELL, marketId, tokenId);
    return out;
  }

  private static void appendLevels(List<OpenOrder> out, JsonNode levels, OrderSide side, String marketId, String tokenId) {
    if (!levels.isArray()) {
      return;
    }
    for (JsonNode level : levels) {
      BigDecimal price = decimal(level.path("price"));
      BigDecimal size = decimal(level.path("size"));
      if (price == null || size == null || size.signum() <= 0) {
        continue;
      }
      out.add(new OpenOrder(null, marketId, tokenId, side, price, size));
    }
  }

  /**
   * Parses one page of {@code /data/orders}. Remaining size is original size minus matched size.
   */
  public static List<OpenOrder> openOrders(JsonNode page) {
    List<OpenOrder> out = new ArrayList<>();
    for (JsonNode node : dataArray(page)) {
      String id = text(node, "id");
      String side = text(node, "side");
      BigDecimal price = decimal(node.path("price"));
      BigDecimal original = decimal(node.path("original_size"));
      if (id == null || side == null || price == null || original == null) {
        continue;
      }
      BigDecimal matched = decimal(node.path("size_matched"));
      BigDecimal remaining = matched == null ? original : original.subtract(matched);
      out.add(new OpenOrder(id, text(node, "market"), text(node, "asset_id"), OrderSide.fromWire(side), price, remaining));
    }
    return out;
  }

  /**
   * Parses one page of {@code /data/trades}. {@code match_time} is epoch seconds.
   */
  public static List<Trade> trades(JsonNode page) {
    List<Trade> out = new ArrayList<>();
    for (JsonNode node : dataArray(page)) {
      String id = text(node, "id");
      String side = text(node, "side");
      BigDecimal size = decimal(node.path("size"));
      BigDecimal price = decimal(node.path("price"));
      if (id == null || side == null || size == null || price == null) {
        continue;
      }
      out.add(new Trade(
          id,
          text(node, "market"),
          text(node, "asset_id"),
          OrderSide.fromWire(side),
          size,
          price,
          text(node, "status"),
          epochSeconds(node.path("match_time"))
      ));
    }
    return out;
  }

  public static String nextCursor(JsonNode page) {
    if (page == null || !page.isObject()) {
      return PolymarketClobPaths.END_CURSOR;
    }
    String cursor = text(page, "next_cursor");
    return cursor == null ? PolymarketClobPaths.END_CURSOR : cursor;
  }

  public static SubmitOrderResponse submitResponse(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return SubmitOrderResponse.rejected("empty response");
    }
    String orderId = text(node, "orderID");
    String error = text(node, "errorMsg");
    boolean success = node.has("success") ? node.path("success").asBoolean(false) : orderId != null;
    if (!success || orderId == null) {
      return new SubmitOrderResponse(false, orderId, text(node, "status"), error == null ? "order not accepted" : error);
    }
    return new SubmitOrderResponse(true, orderId, text(node, "status"), error);
  }

  public static CancelOrderResponse cancelResponse(JsonNode node) {
    Set<String> canceled = new HashSet<>();
    Map<String, String> notCanceled = new HashMap<>();
    if (node != null && node.isObject()) {
      for (JsonNode id : node.path("canceled")) {
        if (id.isTextual() && !id.asText().isBlank()) {
          canceled.add(id.asText());
        }
      }
      JsonNode refused = node.path("not_canceled");
      Iterator<Map.Entry<String, JsonNode>> it = refused.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        notCanceled.put(e.getKey(), e.getValue().asText(""));
      }
    }
    return new CancelOrderResponse(canceled, notCanceled);
  }

  public static List<MarketDescriptor> markets(JsonNode page) {
    List<MarketDescriptor> out = new ArrayList<>();
    for (JsonNode node : dataArray(page)) {
      String conditionId = text(node, "condition_id");
      if (conditionId == null) {
        continue;
      }
      List<MarketDescriptor.OutcomeToken> tokens = new ArrayList<>();
      for (JsonNode token : node.path("tokens")) {
        String tokenId = text(token, "token_id");
        if (tokenId == null) {
          continue;
        }
        tokens.add(new MarketDescriptor.OutcomeToken(tokenId, text(token, "outcome"), decimal(token.path("price"))));
      }
      JsonNode rewards = node.path("rewards");
      out.add(new MarketDescriptor(
          conditionId,
          tokens,
          new MarketDescriptor.RewardParams(decimal(rewards.path("min_size")), decimal(rewards.path("max_spread"))),
          node.path("active").asBoolean(false),
          node.path("closed").asBoolean(false)
      ));
    }
    return out;
  }

  public static BigDecimal minimumOrderSize(JsonNode market) {
    if (market == null || !market.isObject()) {
      return null;
    }
    return decimal(market.path("minimum_order_size"));
  }

  static Iterable<JsonNode> dataArray(JsonNode page) {
    if (page == null) {
      return List.of();
    }
    if (page.isArray()) {
      return page;
    }
    JsonNode data = page.path("data");
    return data.isArray() ? data : List.of();
  }

  static BigDecimal decimal(JsonNode node) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      return null;
    }
    if (node.isNumber()) {
      return node.decimalValue();
    }
    String s = node.asText("").trim();
    if (s.isEmpty()) {
      return null;
    }
    try {
      return new BigDecimal(s);
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static Instant epochSeconds(JsonNode node) {
    BigDecimal seconds = decimal(node);
    return seconds == null ? null : Instant.ofEpochSecond(seconds.longValue());
  }

  private static String text(JsonNode node, String field) {
    JsonNode v = node.path(field);
    if (v.isMissingNode() || v.isNull()) {
      return null;
    }
    String s = v.asText();
    return s == null || s.isBlank() ? null : s;
  }
}
