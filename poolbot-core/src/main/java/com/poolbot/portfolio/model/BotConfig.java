package com.poolbot.portfolio.model;

import java.math.BigDecimal;

/**
 * Registration request for one bot.
 *
 * @param allocationPercentage share of the pool's total balance, in (0, 1]
 * @param maxPositionSize      optional cap on position notional, informational only
 */
public record BotConfig(
    String botId,
    String symbol,
    String category,
    double leverage,
    double allocationPercentage,
    BigDecimal maxPositionSize
) {

  public BotConfig {
    if (category == null || category.isBlank()) {
      category = "default";
    }
    if (maxPositionSize == null) {
      maxPositionSize = BigDecimal.ZERO;
    }
  }

  public static BotConfig of(String botId, String symbol, double leverage, double allocationPercentage) {
    return new BotConfig(botId, symbol, null, leverage, allocationPercentage, null);
  }
}
