package com.poolbot.portfolio.sync;

import com.poolbot.portfolio.model.PortfolioState;

import java.time.Duration;

/**
 * Timing for the synchronization loops.
 *
 * @param maxSyncAge how old the last successful sync may be before the manager reports unhealthy
 */
public record SyncSettings(
    Duration heartbeatInterval,
    Duration syncInterval,
    Duration lockTimeout,
    Duration maxSyncAge,
    String version
) {

  public SyncSettings {
    if (heartbeatInterval == null) {
      heartbeatInterval = Duration.ofSeconds(30);
    }
    if (syncInterval == null) {
      syncInterval = Duration.ofSeconds(5);
    }
    if (lockTimeout == null) {
      lockTimeout = Duration.ofSeconds(5);
    }
    if (maxSyncAge == null) {
      maxSyncAge = Duration.ofSeconds(60);
    }
    if (version == null || version.isBlank()) {
      version = PortfolioState.CURRENT_VERSION;
    }
  }

  public static SyncSettings defaults() {
    return new SyncSettings(null, null, null, null, null);
  }
}
