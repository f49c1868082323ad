package com.poolbot.portfolio.allocation;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * @param minRebalanceAmount smallest per-bot adjustment worth applying
 * @param rebalanceThreshold drift between actual and target allocation share that flags a rebalance
 * @param rebalanceInterval  minimum time between rebalances
 */
public record RebalanceConfig(
    BigDecimal minRebalanceAmount,
    double rebalanceThreshold,
    Duration rebalanceInterval
) {

  public RebalanceConfig {
    if (minRebalanceAmount == null) {
      minRebalanceAmount = BigDecimal.TEN;
    }
    if (rebalanceThreshold <= 0) {
      rebalanceThreshold = 0.1;
    }
    if (rebalanceInterval == null) {
      rebalanceInterval = Duration.ofHours(1);
    }
  }

  public static RebalanceConfig defaults() {
    return new RebalanceConfig(null, 0, null);
  }
}
