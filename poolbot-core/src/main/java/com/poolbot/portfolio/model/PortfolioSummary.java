package com.poolbot.portfolio.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Point-in-time aggregate of the ledger. Percentages are expressed in percent (0-100+).
 */
public record PortfolioSummary(
    BigDecimal totalBalance,
    BigDecimal totalAllocated,
    BigDecimal totalUsed,
    BigDecimal totalAvailable,
    BigDecimal unallocated,
    BigDecimal totalExposure,
    BigDecimal totalProfit,
    BigDecimal unrealizedPnl,
    double utilizationPercent,
    double allocationPercent,
    double pnlPercent,
    int activeBots,
    Instant lastRebalance,
    int historySize
) {

  /**
   * Total exposure as a multiple of the total balance.
   */
  public double exposureRatio() {
    return Money.ratio(totalExposure, totalBalance);
  }
}
