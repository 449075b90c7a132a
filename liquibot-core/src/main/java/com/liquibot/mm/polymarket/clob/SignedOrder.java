package com.liquibot.mm.polymarket.clob;

import com.liquibot.mm.domain.OrderSide;

import java.math.BigInteger;

public record SignedOrder(
    BigInteger salt,
    String maker,
    String signer,
    String taker,
    String tokenId,
    BigInteger makerAmount,
    BigInteger takerAmount,
    BigInteger expiration,
    BigInteger nonce,
    BigInteger feeRateBps,
    OrderSide side,
    int signatureType,
    String signature
) {

  public int sideIndex() {
    return side == OrderSide.BUY ? 0 : 1;
  }

  public SignedOrder withSignature(String sig) {
    return new SignedOrder(salt, maker, signer, taker, tokenId, makerAmount, takerAmount, expiration, nonce,
        feeRateBps, side, signatureType, sig);
  }
}
