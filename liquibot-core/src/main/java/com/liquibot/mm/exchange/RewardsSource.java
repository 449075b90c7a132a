package com.liquibot.mm.exchange;

import java.math.BigDecimal;

@FunctionalInterface
public interface RewardsSource {

  /**
   * Total liquidity rewards earned by the account so far.
   */
  BigDecimal getRewardsTotal();

  static RewardsSource fixed(BigDecimal total) {
    BigDecimal value = total == null ? BigDecimal.ZERO : total;
    return () -> value;
  }
}
