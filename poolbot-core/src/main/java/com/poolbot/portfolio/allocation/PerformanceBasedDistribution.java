package com.poolbot.portfolio.allocation;

import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.Money;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bots with positive realized PnL receive shares pro-rata to that PnL. Falls back to equal weight
 * when no bot is in profit.
 */
public class PerformanceBasedDistribution implements ProfitDistribution {

  private final ProfitDistribution fallback = new EqualWeightDistribution();

  @Override
  public Map<String, BigDecimal> shares(Collection<BotAllocation> allocations, String sourceBotId, BigDecimal profit) {
    Map<String, BigDecimal> performers = new LinkedHashMap<>();
    BigDecimal totalPnl = BigDecimal.ZERO;
    for (BotAllocation allocation : allocations) {
      if (allocation.realizedPnl().signum() > 0) {
        performers.put(allocation.botId(), allocation.realizedPnl());
        totalPnl = totalPnl.add(allocation.realizedPnl());
      }
    }
    if (performers.isEmpty() || totalPnl.signum() <= 0) {
      return fallback.shares(allocations, sourceBotId, profit);
    }

    Map<String, BigDecimal> shares = new LinkedHashMap<>();
    BigDecimal assigned = BigDecimal.ZERO;
    String largest = null;
    for (Map.Entry<String, BigDecimal> entry : performers.entrySet()) {
      BigDecimal share = Money.divide(profit.multiply(entry.getValue()), totalPnl);
      shares.put(entry.getKey(), share);
      assigned = assigned.add(share);
      if (largest == null || entry.getValue().compareTo(performers.get(largest)) > 0) {
        largest = entry.getKey();
      }
    }
    shares.merge(largest, profit.subtract(assigned), BigDecimal::add);
    return shares;
  }
}
