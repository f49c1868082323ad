package com.poolbot.portfolio.allocation;

import com.poolbot.portfolio.model.AllocationStrategy;
import com.poolbot.portfolio.model.BotAllocation;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;

/**
 * Splits a shared profit into per-bot allocation increases. The returned shares sum to the profit
 * exactly, or the map is empty when nothing is redistributed.
 */
public interface ProfitDistribution {

  Map<String, BigDecimal> shares(Collection<BotAllocation> allocations, String sourceBotId, BigDecimal profit);

  static ProfitDistribution forStrategy(AllocationStrategy strategy) {
    return switch (strategy) {
      case EQUAL_WEIGHT -> new EqualWeightDistribution();
      case PERFORMANCE_BASED -> new PerformanceBasedDistribution();
      case CUSTOM -> (allocations, sourceBotId, profit) -> Map.of();
    };
  }
}
