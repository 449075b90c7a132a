package com.liquibot.mm.polymarket.clob;

import com.liquibot.mm.domain.OrderSide;
import com.liquibot.mm.polymarket.auth.Eip712Signer;
import org.web3j.crypto.Credentials;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds and signs GTC limit orders for the CTF exchange.
 */
public final class PolymarketOrderBuilder {

  static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";
  private static final BigDecimal TOKEN_UNITS = BigDecimal.valueOf(1_000_000);
  private static final int SIZE_DECIMALS = 2;

  private final int chainId;
  private final Credentials signer;
  private final int signatureType;
  private final String funderAddress;

  public PolymarketOrderBuilder(int chainId, Credentials signer, int signatureType, String funderAddress) {
    this.chainId = chainId;
    this.signer = Objects.requireNonNull(signer, "signer");
    this.signatureType = signatureType;
    this.funderAddress = funderAddress;
  }

  public SignedOrder buildLimitOrder(
      String tokenId,
      OrderSide side,
      BigDecimal price,
      BigDecimal size,
      BigDecimal tickSize,
      boolean negRisk,
      int feeRateBps
  ) {
    Objects.requireNonNull(tokenId, "tokenId");
    Objects.requireNonNull(side, "side");
    Objects.requireNonNull(price, "price");
    Objects.requireNonNull(size, "size");

    int priceDecimals = priceDecimals(tickSize);
    BigDecimal roundedPrice = price.setScale(priceDecimals, RoundingMode.HALF_EVEN);
    BigDecimal shares = size.setScale(SIZE_DECIMALS, RoundingMode.DOWN);
    BigDecimal notional = shares.multiply(roundedPrice).setScale(priceDecimals + SIZE_DECIMALS, RoundingMode.DOWN);

    BigDecimal makerAmount = side == OrderSide.BUY ? notional : shares;
    BigDecimal takerAmount = side == OrderSide.BUY ? shares : notional;

    String maker = funderAddress != null && !funderAddress.isBlank() ? funderAddress.trim() : signer.getAddress();
    SignedOrder unsigned = new SignedOrder(
        BigInteger.valueOf(ThreadLocalRandom.current().nextLong(1, Integer.MAX_VALUE)),
        maker,
        signer.getAddress(),
        ZERO_ADDRESS,
        tokenId,
        toTokenUnits(makerAmount),
        toTokenUnits(takerAmount),
        BigInteger.ZERO,
        BigInteger.ZERO,
        BigInteger.valueOf(Math.max(0, feeRateBps)),
        side,
        signatureType,
        null
    );
    String signature = Eip712Signer.signOrder(signer, chainId, PolymarketContracts.exchange(chainId, negRisk), unsigned);
    return unsigned.withSignature(signature);
  }

  static int priceDecimals(BigDecimal tickSize) {
    if (tickSize == null || tickSize.signum() <= 0) {
      return 2;
    }
    return Math.max(1, tickSize.stripTrailingZeros().scale());
  }

  static BigInteger toTokenUnits(BigDecimal amount) {
    return amount.multiply(TOKEN_UNITS).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
  }
}
