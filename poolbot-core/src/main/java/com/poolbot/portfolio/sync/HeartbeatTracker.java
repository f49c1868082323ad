package com.poolbot.portfolio.sync;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Liveness view of the bots this process has heard from. A bot is ACTIVE within two heartbeat
 * intervals of its last beat, INACTIVE within five, and DEAD after that.
 */
public class HeartbeatTracker implements EventHandler {

  private final Map<String, HeartbeatInfo> heartbeats = new ConcurrentHashMap<>();
  private final Clock clock;
  private final Duration interval;

  public HeartbeatTracker(Clock clock, Duration interval) {
    this.clock = clock;
    this.interval = interval;
  }

  @Override
  public void handle(SyncEvent event) {
    switch (event.type()) {
      case HEARTBEAT, REGISTER -> record(new HeartbeatInfo(
          event.botId(),
          event.timestamp(),
          HeartbeatStatus.ACTIVE,
          String.valueOf(event.data().getOrDefault("version", "")),
          event.data().get("process_id") instanceof Number pid ? pid.longValue() : 0L,
          String.valueOf(event.data().getOrDefault("hostname", ""))
      ));
      case UNREGISTER -> heartbeats.remove(event.botId());
      default -> {
      }
    }
  }

  public void record(HeartbeatInfo info) {
    heartbeats.merge(info.botId(), info,
        (existing, incoming) -> incoming.lastSeen().isBefore(existing.lastSeen()) ? existing : incoming);
  }

  /**
   * Current heartbeats with their status re-evaluated against the clock.
   */
  public Map<String, HeartbeatInfo> snapshot() {
    Instant now = clock.instant();
    Map<String, HeartbeatInfo> result = new LinkedHashMap<>();
    heartbeats.forEach((botId, info) -> result.put(botId, info.withStatus(classify(info.lastSeen(), now))));
    return Collections.unmodifiableMap(result);
  }

  public int count(HeartbeatStatus status) {
    return (int) snapshot().values().stream().filter(info -> info.status() == status).count();
  }

  HeartbeatStatus classify(Instant lastSeen, Instant now) {
    Duration age = Duration.between(lastSeen, now);
    if (age.compareTo(interval.multipliedBy(2)) <= 0) {
      return HeartbeatStatus.ACTIVE;
    }
    if (age.compareTo(interval.multipliedBy(5)) <= 0) {
      return HeartbeatStatus.INACTIVE;
    }
    return HeartbeatStatus.DEAD;
  }
}
