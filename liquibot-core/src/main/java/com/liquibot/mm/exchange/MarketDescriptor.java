package com.liquibot.mm.exchange;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

public record MarketDescriptor(
    String conditionId,
    List<OutcomeToken> tokens,
    RewardParams rewards,
    boolean active,
    boolean closed
) {

  public MarketDescriptor {
    tokens = tokens == null ? List.of() : List.copyOf(tokens);
    if (rewards == null) {
      rewards = new RewardParams(null, null);
    }
  }

  /**
   * Display name built from the outcomes, e.g. {@code "Yes vs No"}.
   */
  public String name() {
    return tokens.stream().map(OutcomeToken::outcome).collect(Collectors.joining(" vs "));
  }

  public String description() {
    String shortId = conditionId == null || conditionId.length() <= 6
        ? String.valueOf(conditionId)
        : conditionId.substring(conditionId.length() - 6);
    String outcomes = tokens.stream().map(OutcomeToken::outcome).collect(Collectors.joining(", "));
    return "Market " + shortId + " - Outcomes: " + outcomes;
  }

  public record OutcomeToken(String tokenId, String outcome, BigDecimal price) {
  }

  /**
   * Liquidity reward eligibility: minimum order size and maximum spread (in cents) from the midpoint.
   */
  public record RewardParams(BigDecimal minSize, BigDecimal maxSpread) {
  }
}
