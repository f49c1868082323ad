package com.poolbot.portfolio.sync;

import java.time.Instant;

public record HeartbeatInfo(
    String botId,
    Instant lastSeen,
    HeartbeatStatus status,
    String version,
    long processId,
    String hostname
) {

  public HeartbeatInfo withStatus(HeartbeatStatus newStatus) {
    return new HeartbeatInfo(botId, lastSeen, newStatus, version, processId, hostname);
  }
}
