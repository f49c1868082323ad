package com.poolbot.portfolio.store;

import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.Money;
import com.poolbot.portfolio.model.PortfolioState;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Checks applied to every document read from disk before it may touch a ledger.
 */
public final class StateValidator {

  private StateValidator() {
  }

  /**
   * Shape checks: positive total balance, allocation map present, keys match bot ids, balances
   * non-negative and leverage positive.
   */
  public static void validateStructure(PortfolioState state) {
    if (state == null) {
      throw PortfolioException.corrupted("state document is empty", null);
    }
    if (!Money.isPositive(state.totalBalance())) {
      throw PortfolioException.corrupted("total balance must be positive, got " + state.totalBalance(), null);
    }
    if (state.allocations() == null) {
      throw PortfolioException.corrupted("allocations are missing", null);
    }
    for (Map.Entry<String, BotAllocation> entry : state.allocations().entrySet()) {
      BotAllocation allocation = entry.getValue();
      if (allocation == null || !entry.getKey().equals(allocation.botId())) {
        throw PortfolioException.corrupted("allocation key " + entry.getKey() + " does not match its bot id", null);
      }
      if (allocation.allocatedBalance().signum() < 0 || allocation.usedBalance().signum() < 0
          || allocation.currentPosition().signum() < 0) {
        throw PortfolioException.corrupted("negative balance for bot " + entry.getKey(), null);
      }
      if (allocation.leverage() <= 0) {
        throw PortfolioException.corrupted("invalid leverage for bot " + entry.getKey(), null);
      }
    }
  }

  /**
   * Structure plus the pool invariant: the sum of allocations may not exceed the total balance by
   * more than {@link Money#EPSILON}.
   */
  public static void validateIntegrity(PortfolioState state) {
    validateStructure(state);
    BigDecimal allocated = state.totalAllocated();
    if (allocated.compareTo(state.totalBalance().add(Money.EPSILON)) > 0) {
      throw PortfolioException.corrupted(String.format("allocations %s exceed total balance %s",
          allocated.toPlainString(), state.totalBalance().toPlainString()), null);
    }
  }
}
