package com.poolbot.portfolio.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The shared document every bot process reads and writes.
 *
 * @param lockHolder identity of the process that last wrote the document while holding the lock
 */
public record PortfolioState(
    BigDecimal totalBalance,
    BigDecimal totalProfit,
    Instant lastUpdated,
    Map<String, BotAllocation> allocations,
    PortfolioConfig globalSettings,
    String version,
    String lockHolder,
    Instant lockTime
) {

  public static final String CURRENT_VERSION = "2.0.0";

  public PortfolioState {
    totalProfit = Money.orZero(totalProfit);
    if (version == null || version.isBlank()) {
      version = CURRENT_VERSION;
    }
    if (allocations != null) {
      allocations = Collections.unmodifiableMap(new LinkedHashMap<>(allocations));
    }
  }

  public BigDecimal totalAllocated() {
    BigDecimal total = BigDecimal.ZERO;
    if (allocations != null) {
      for (BotAllocation allocation : allocations.values()) {
        total = total.add(allocation.allocatedBalance());
      }
    }
    return total;
  }

  public PortfolioState stamped(Instant now, String holder, Instant heldSince) {
    return new PortfolioState(totalBalance, totalProfit, now, allocations, globalSettings, version, holder, heldSince);
  }
}
