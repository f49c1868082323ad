package com.poolbot.portfolio.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Audit entry appended by the allocation manager for every ledger mutation.
 *
 * @param beforeState allocations before the mutation, or null when not captured
 * @param afterState  allocations after the mutation, or null when not captured
 */
public record AllocationEvent(
    Instant timestamp,
    AllocationEventType type,
    String botId,
    BigDecimal amount,
    String reason,
    Map<String, BotAllocation> beforeState,
    Map<String, BotAllocation> afterState
) {

  public AllocationEvent {
    beforeState = beforeState == null ? null : Map.copyOf(beforeState);
    afterState = afterState == null ? null : Map.copyOf(afterState);
  }

  public AllocationEvent(Instant timestamp, AllocationEventType type, String botId, BigDecimal amount, String reason) {
    this(timestamp, type, botId, amount, reason, null, null);
  }
}
