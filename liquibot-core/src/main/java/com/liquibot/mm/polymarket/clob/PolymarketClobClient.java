package com.liquibot.mm.polymarket.clob;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.liquibot.mm.domain.ClobOrderType;
import com.liquibot.mm.exchange.ExchangeClientException;
import com.liquibot.mm.polymarket.auth.ApiCreds;
import com.liquibot.mm.polymarket.auth.PolymarketAuthHeaders;
import com.liquibot.mm.polymarket.http.HttpRequestFactory;
import com.liquibot.mm.polymarket.http.PolymarketHttpTransport;
import lombok.extern.slf4j.Slf4j;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpRequest;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Thin client over the Polymarket CLOB REST API. Returns raw JSON; see {@link PolymarketClobParser}.
 */
@Slf4j
public class PolymarketClobClient {

  private static final Duration HTTP_TIMEOUT = Duration.ofSeconds(10);

  private final HttpRequestFactory requestFactory;
  private final PolymarketHttpTransport transport;
  private final ObjectMapper objectMapper;
  private final Clock clock;
  private final int chainId;
  private final boolean useServerTime;

  public PolymarketClobClient(
      URI baseUri,
      PolymarketHttpTransport transport,
      ObjectMapper objectMapper,
      Clock clock,
      int chainId,
      boolean useServerTime
  ) {
    this.requestFactory = new HttpRequestFactory(baseUri);
    this.transport = Objects.requireNonNull(transport, "transport");
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.chainId = chainId;
    this.useServerTime = useServerTime;
  }

  public int chainId() {
    return chainId;
  }

  public JsonNode getOrderBook(String tokenId) {
    return getPublic(PolymarketClobPaths.BOOK, Map.of("token_id", tokenId));
  }

  public JsonNode getMarket(String conditionId) {
    return getPublic(PolymarketClobPaths.MARKETS + "/" + conditionId, Map.of());
  }

  public BigDecimal getMinimumTickSize(String tokenId) {
    JsonNode node = getPublic(PolymarketClobPaths.TICK_SIZE, Map.of("token_id", tokenId));
    BigDecimal tick = PolymarketClobParser.decimal(node.path("minimum_tick_size"));
    if (tick == null) {
      throw new ExchangeClientException("tick-size response missing minimum_tick_size for token " + tokenId);
    }
    return tick;
  }

  public boolean isNegRisk(String tokenId) {
    return getPublic(PolymarketClobPaths.NEG_RISK, Map.of("token_id", tokenId)).path("neg_risk").asBoolean(false);
  }

  public JsonNode samplingSimplifiedMarkets(String cursor) {
    Map<String, String> query = new LinkedHashMap<>();
    if (cursor != null && !cursor.isBlank()) {
      query.put("next_cursor", cursor);
    }
    return getPublic(PolymarketClobPaths.SAMPLING_SIMPLIFIED_MARKETS, query);
  }

  public JsonNode getOpenOrders(Credentials signer, ApiCreds creds, String marketId, String tokenId, String cursor) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("market", marketId);
    query.put("asset_id", tokenId);
    query.put("next_cursor", cursor);
    return getL2(signer, creds, PolymarketClobPaths.ORDERS, query);
  }

  public JsonNode getTrades(Credentials signer, ApiCreds creds, String makerAddress, String marketId, String tokenId, String cursor) {
    Map<String, String> query = new LinkedHashMap<>();
    query.put("maker_address", makerAddress);
    query.put("market", marketId);
    query.put("asset_id", tokenId);
    query.put("next_cursor", cursor);
    return getL2(signer, creds, PolymarketClobPaths.TRADES, query);
  }

  public JsonNode postOrder(Credentials signer, ApiCreds creds, SignedOrder order, ClobOrderType orderType) {
    ObjectNode wireOrder = objectMapper.createObjectNode();
    wireOrder.put("salt", order.salt());
    wireOrder.put("maker", order.maker());
    wireOrder.put("signer", order.signer());
    wireOrder.put("taker", order.taker());
    wireOrder.put("tokenId", order.tokenId());
    wireOrder.put("makerAmount", order.makerAmount().toString());
    wireOrder.put("takerAmount", order.takerAmount().toString());
    wireOrder.put("expiration", order.expiration().toString());
    wireOrder.put("nonce", order.nonce().toString());
    wireOrder.put("feeRateBps", order.feeRateBps().toString());
    wireOrder.put("side", order.side().name());
    wireOrder.put("signatureType", order.signatureType());
    wireOrder.put("signature", order.signature());

    ObjectNode body = objectMapper.createObjectNode();
    body.set("order", wireOrder);
    body.put("owner", creds.key());
    body.put("orderType", (orderType == null ? ClobOrderType.GTC : orderType).name());

    return sendL2(signer, creds, "POST", PolymarketClobPaths.POST_ORDER, toJson(body));
  }

  public JsonNode cancelOrder(Credentials signer, ApiCreds creds, String orderId) {
    ObjectNode body = objectMapper.createObjectNode();
    body.put("orderID", orderId);
    return sendL2(signer, creds, "DELETE", PolymarketClobPaths.CANCEL_ORDER, toJson(body));
  }

  /**
   * Derives the API key for {@code nonce}, creating it first when the account has none yet.
   */
  public ApiCreds createOrDeriveApiCreds(Credentials signer, long nonce) {
    try {
      return toCreds(sendL1(signer, nonce, "POST", PolymarketClobPaths.CREATE_API_KEY));
    } catch (ExchangeClientException e) {
      log.debug("create api key failed ({}), deriving existing one", e.getMessage());
    }
    return toCreds(sendL1(signer, nonce, "GET", PolymarketClobPaths.DERIVE_API_KEY));
  }

  long timestampSeconds() {
    if (useServerTime) {
      JsonNode node = getPublic(PolymarketClobPaths.TIME, Map.of());
      if (node != null && node.canConvertToLong()) {
        return node.asLong();
      }
      log.debug("unexpected /time response {}, using local clock", node);
    }
    return clock.instant().getEpochSecond();
  }

  private JsonNode getPublic(String path, Map<String, String> query) {
    HttpRequest request = requestFactory.request(path, query)
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .GET()
        .build();
    return transport.sendJson(request, JsonNode.class);
  }

  private JsonNode getL2(Credentials signer, ApiCreds creds, String path, Map<String, String> query) {
    HttpRequest.Builder builder = requestFactory.request(path, query)
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .GET();
    PolymarketAuthHeaders.l2(signer, creds, timestampSeconds(), "GET", path, null).forEach(builder::header);
    return transport.sendJson(builder.build(), JsonNode.class);
  }

  private JsonNode sendL2(Credentials signer, ApiCreds creds, String method, String path, String body) {
    HttpRequest.Builder builder = requestFactory.request(path, Map.of())
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .header("Content-Type", "application/json")
        .method(method, HttpRequest.BodyPublishers.ofString(body));
    PolymarketAuthHeaders.l2(signer, creds, timestampSeconds(), method, path, body).forEach(builder::header);
    return transport.sendJson(builder.build(), JsonNode.class);
  }

  private JsonNode sendL1(Credentials signer, long nonce, String method, String path) {
    HttpRequest.Builder builder = requestFactory.request(path, Map.of())
        .timeout(HTTP_TIMEOUT)
        .header("Accept", "application/json")
        .method(method, HttpRequest.BodyPublishers.noBody());
    PolymarketAuthHeaders.l1(signer, chainId, timestampSeconds(), nonce).forEach(builder::header);
    return transport.sendJson(builder.build(), JsonNode.class);
  }

  private static ApiCreds toCreds(JsonNode node) {
    String key = node == null ? null : node.path("apiKey").asText(null);
    String secret = node == null ? null : node.path("secret").asText(null);
    String passphrase = node == null ? null : node.path("passphrase").asText(null);
    if (key == null || secret == null || passphrase == null) {
      throw new ExchangeClientException("api key response is missing apiKey/secret/passphrase");
    }
    return new ApiCreds(key, secret, passphrase);
  }

  private String toJson(JsonNode node) {
    try {
      return objectMapper.writeValueAsString(node);
    } catch (JsonProcessingException e) {
      throw new ExchangeClientException("Failed serializing request body", e);
    }
  }
}
