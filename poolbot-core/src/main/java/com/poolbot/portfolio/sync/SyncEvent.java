package com.poolbot.portfolio.sync;

import java.time.Instant;
import java.util.Map;

/**
 * Notification published to in-process handlers after a synchronization-relevant change.
 *
 * @param requiresAck whether the publisher expects handlers to treat the event as critical
 */
public record SyncEvent(
    SyncEventType type,
    String botId,
    Instant timestamp,
    Map<String, Object> data,
    boolean requiresAck
) {

  public SyncEvent {
    data = data == null ? Map.of() : Map.copyOf(data);
  }

  public static SyncEvent of(SyncEventType type, String botId, Instant timestamp, Map<String, Object> data) {
    return new SyncEvent(type, botId, timestamp, data, false);
  }

  public static SyncEvent critical(SyncEventType type, String botId, Instant timestamp, Map<String, Object> data) {
    return new SyncEvent(type, botId, timestamp, data, true);
  }
}
