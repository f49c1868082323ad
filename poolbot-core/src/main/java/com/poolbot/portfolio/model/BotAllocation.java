package com.poolbot.portfolio.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One bot's slice of the pool. Immutable: every change produces a new instance, so values handed
 * out by the ledger are independent copies.
 *
 * <p>Invariants kept by the allocation manager: {@code availableBalance = allocatedBalance -
 * usedBalance}, {@code usedBalance = positionMarginUsed <= allocatedBalance}.
 */
public record BotAllocation(
    String botId,
    String symbol,
    BigDecimal allocatedBalance,
    BigDecimal usedBalance,
    BigDecimal availableBalance,
    BigDecimal currentPosition,
    BigDecimal averagePrice,
    double leverage,
    BigDecimal unrealizedPnl,
    BigDecimal realizedPnl,
    Instant lastUpdated,
    BigDecimal positionMarginUsed,
    double allocationPercentage
) {

  public BotAllocation {
    allocatedBalance = Money.orZero(allocatedBalance);
    usedBalance = Money.orZero(usedBalance);
    availableBalance = Money.orZero(availableBalance);
    currentPosition = Money.orZero(currentPosition);
    averagePrice = Money.orZero(averagePrice);
    unrealizedPnl = Money.orZero(unrealizedPnl);
    realizedPnl = Money.orZero(realizedPnl);
    positionMarginUsed = Money.orZero(positionMarginUsed);
  }

  public static BotAllocation open(BotConfig config, BigDecimal allocated, Instant now) {
    return new BotAllocation(
        config.botId(),
        config.symbol(),
        allocated,
        BigDecimal.ZERO,
        allocated,
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        config.leverage(),
        BigDecimal.ZERO,
        BigDecimal.ZERO,
        now,
        BigDecimal.ZERO,
        config.allocationPercentage()
    );
  }

  public boolean hasOpenPosition() {
    return currentPosition.signum() > 0;
  }

  public BotAllocation withPosition(BigDecimal positionValue, BigDecimal price, double newLeverage,
                                    BigDecimal margin, Instant now) {
    return new BotAllocation(botId, symbol, allocatedBalance, margin, allocatedBalance.subtract(margin),
        positionValue, price, newLeverage, unrealizedPnl, realizedPnl, now, margin, allocationPercentage);
  }

  public BotAllocation withAllocated(BigDecimal newAllocated, Instant now) {
    return new BotAllocation(botId, symbol, newAllocated, usedBalance, newAllocated.subtract(usedBalance),
        currentPosition, averagePrice, leverage, unrealizedPnl, realizedPnl, now, positionMarginUsed,
        allocationPercentage);
  }

  public BotAllocation withTarget(BigDecimal newAllocated, double newPercentage, Instant now) {
    return new BotAllocation(botId, symbol, newAllocated, usedBalance, newAllocated.subtract(usedBalance),
        currentPosition, averagePrice, leverage, unrealizedPnl, realizedPnl, now, positionMarginUsed,
        newPercentage);
  }

  public BotAllocation withRealizedProfit(BigDecimal profit, Instant now) {
    return new BotAllocation(botId, symbol, allocatedBalance, usedBalance, availableBalance,
        currentPosition, averagePrice, leverage, unrealizedPnl, realizedPnl.add(profit), now,
        positionMarginUsed, allocationPercentage);
  }

  public BotAllocation withUnrealizedPnl(BigDecimal pnl, Instant now) {
    return new BotAllocation(botId, symbol, allocatedBalance, usedBalance, availableBalance,
        currentPosition, averagePrice, leverage, pnl, realizedPnl, now, positionMarginUsed,
        allocationPercentage);
  }
}
