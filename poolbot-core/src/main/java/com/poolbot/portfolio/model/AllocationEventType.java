package com.poolbot.portfolio.model;

public enum AllocationEventType {
  ALLOCATE,
  DEALLOCATE,
  POSITION_UPDATE,
  PROFIT_RECORD,
  PROFIT_SHARE,
  REBALANCE
}
