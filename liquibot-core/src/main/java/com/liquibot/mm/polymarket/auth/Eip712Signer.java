package com.liquibot.mm.polymarket.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.liquibot.mm.polymarket.clob.SignedOrder;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Sign;
import org.web3j.crypto.StructuredDataEncoder;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.util.Objects;

/**
 * EIP-712 signatures used by the CLOB: the L1 auth message and exchange orders.
 */
public final class Eip712Signer {

  static final String CLOB_AUTH_DOMAIN = "ClobAuthDomain";
  static final String CLOB_AUTH_MESSAGE = "This message attests that I control the given wallet";
  static final String EXCHANGE_DOMAIN = "Polymarket CTF Exchange";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private Eip712Signer() {
  }

  public static String signClobAuth(Credentials credentials, int chainId, long timestampSeconds, long nonce) {
    Objects.requireNonNull(credentials, "credentials");

    ObjectNode root = MAPPER.createObjectNode();
    ObjectNode types = root.putObject("types");
    ArrayNode domainType = types.putArray("EIP712Domain");
    field(domainType, "name", "string");
    field(domainType, "version", "string");
    field(domainType, "chainId", "uint256");
    ArrayNode authType = types.putArray("ClobAuth");
    field(authType, "address", "address");
    field(authType, "timestamp", "string");
    field(authType, "nonce", "uint256");
    field(authType, "message", "string");

    root.put("primaryType", "ClobAuth");
    ObjectNode domain = root.putObject("domain");
    domain.put("name", CLOB_AUTH_DOMAIN);
    domain.put("version", "1");
    domain.put("chainId", chainId);

    ObjectNode message = root.putObject("message");
    message.put("address", credentials.getAddress());
    message.put("timestamp", Long.toString(timestampSeconds));
    message.put("nonce", nonce);
    message.put("message", CLOB_AUTH_MESSAGE);

    return sign(credentials, root);
  }

  /**
   * Signs the order struct of the CTF exchange deployed at {@code verifyingContract}.
   */
  public static String signOrder(Credentials credentials, int chainId, String verifyingContract, SignedOrder order) {
    Objects.requireNonNull(credentials, "credentials");
    Objects.requireNonNull(verifyingContract, "verifyingContract");
    Objects.requireNonNull(order, "order");

    ObjectNode root = MAPPER.createObjectNode();
    ObjectNode types = root.putObject("types");
    ArrayNode domainType = types.putArray("EIP712Domain");
    field(domainType, "name", "string");
    field(domainType, "version", "string");
    field(domainType, "chainId", "uint256");
    field(domainType, "verifyingContract", "address");
    ArrayNode orderType = types.putArray("Order");
    field(orderType, "salt", "uint256");
    field(orderType, "maker", "address");
    field(orderType, "signer", "address");
    field(orderType, "taker", "address");
    field(orderType, "tokenId", "uint256");
    field(orderType, "makerAmount", "uint256");
    field(orderType, "takerAmount", "uint256");
    field(orderType, "expiration", "uint256");
    field(orderType, "nonce", "uint256");
    field(orderType, "feeRateBps", "uint256");
    field(orderType, "side", "uint8");
    field(orderType, "signatureType", "uint8");

    root.put("primaryType", "Order");
    ObjectNode domain = root.putObject("domain");
    domain.put("name", EXCHANGE_DOMAIN);
    domain.put("version", "1");
    domain.put("chainId", chainId);
    domain.put("verifyingContract", verifyingContract);

    ObjectNode message = root.putObject("message");
    message.put("salt", order.salt().toString());
    message.put("maker", order.maker());
    message.put("signer", order.signer());
    message.put("taker", order.taker());
    message.put("tokenId", order.tokenId());
    message.put("makerAmount", order.makerAmount().toString());
    message.put("takerAmount", order.takerAmount().toString());
    message.put("expiration", order.expiration().toString());
    message.put("nonce", order.nonce().toString());
    message.put("feeRateBps", order.feeRateBps().toString());
    message.put("side", order.sideIndex());
    message.put("signatureType", order.signatureType());

    return sign(credentials, root);
  }

  private static String sign(Credentials credentials, ObjectNode typedData) {
    byte[] hash;
    try {
      hash = new StructuredDataEncoder(MAPPER.writeValueAsString(typedData)).hashStructuredData();
    } catch (IOException e) {
      throw new IllegalStateException("Failed encoding EIP-712 payload", e);
    }
    Sign.SignatureData sig = Sign.signMessage(hash, credentials.getEcKeyPair(), false);
    return Numeric.toHexString(sig.getR())
        + Numeric.toHexStringNoPrefix(sig.getS())
        + Numeric.toHexStringNoPrefix(sig.getV());
  }

  private static void field(ArrayNode type, String name, String solidityType) {
    type.addObject().put("name", name).put("type", solidityType);
  }
}
