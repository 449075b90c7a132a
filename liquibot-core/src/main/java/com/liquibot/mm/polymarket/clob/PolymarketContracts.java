package com.liquibot.mm.polymarket.clob;

/**
 * CTF exchange contracts that verify order signatures, per chain.
 */
public final class PolymarketContracts {

  public static final int POLYGON = 137;
  public static final int AMOY = 80002;

  private PolymarketContracts() {
  }

  public static String exchange(int chainId, boolean negRisk) {
    return switch (chainId) {
      case POLYGON -> negRisk
          ? "0xC5d563A36AE78145C45a50134d48A1215220f80a"
          : "0x4bFb41d5B3570DeFd03C39a9A4D8dE6Bd8B8982E";
      case AMOY -> negRisk
          ? "0xd91E80cF2E7be2e162c6513ceD06f1dD0dA35296"
          : "0xdFE02Eb6733538f8Ea35D585af8DE5958AD99E40";
      default -> throw new IllegalArgumentException("Unsupported chainId " + chainId);
    };
  }
}
