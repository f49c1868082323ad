package com.poolbot.portfolio.allocation;

import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.Money;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every allocated bot, the source included, receives the same share. A pool with a single bot has
 * nobody to share with and is left untouched.
 */
public class EqualWeightDistribution implements ProfitDistribution {

  @Override
  public Map<String, BigDecimal> shares(Collection<BotAllocation> allocations, String sourceBotId, BigDecimal profit) {
    if (allocations.size() <= 1) {
      return Map.of();
    }
    BigDecimal share = Money.divide(profit, BigDecimal.valueOf(allocations.size()));
    Map<String, BigDecimal> shares = new LinkedHashMap<>();
    BigDecimal assigned = BigDecimal.ZERO;
    for (BotAllocation allocation : allocations) {
      shares.put(allocation.botId(), share);
      assigned = assigned.add(share);
    }
    // rounding remainder goes to the bot that earned the profit
    BigDecimal remainder = profit.subtract(assigned);
    String target = shares.containsKey(sourceBotId) ? sourceBotId : shares.keySet().iterator().next();
    shares.merge(target, remainder, BigDecimal::add);
    return shares;
  }
}
