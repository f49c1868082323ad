package com.poolbot.portfolio.sync;

public enum HeartbeatStatus {
  ACTIVE,
  INACTIVE,
  DEAD
}
