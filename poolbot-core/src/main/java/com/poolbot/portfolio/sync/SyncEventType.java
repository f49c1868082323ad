package com.poolbot.portfolio.sync;

public enum SyncEventType {
  HEARTBEAT,
  REGISTER,
  UNREGISTER,
  POSITION_UPDATE,
  PROFIT_RECORD,
  REBALANCE,
  EMERGENCY_STOP
}
