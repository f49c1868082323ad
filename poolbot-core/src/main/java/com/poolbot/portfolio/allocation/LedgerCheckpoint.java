package com.poolbot.portfolio.allocation;

import com.poolbot.portfolio.model.BotAllocation;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Captured ledger contents used to undo a mutation whose persistence failed.
 */
public record LedgerCheckpoint(
    BigDecimal totalBalance,
    BigDecimal totalProfit,
    Map<String, BotAllocation> allocations,
    Instant lastRebalance
) {
}
