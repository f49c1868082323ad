package com.poolbot.portfolio.sync;

import lombok.extern.slf4j.Slf4j;

/**
 * Writes every synchronization event to the log.
 */
@Slf4j
public class LoggingEventHandler implements EventHandler {

  @Override
  public void handle(SyncEvent event) {
    switch (event.type()) {
      case HEARTBEAT -> log.debug("Heartbeat from {}", event.botId());
      case REGISTER -> log.info("Bot {} joined synchronization", event.botId());
      case UNREGISTER -> log.info("Bot {} left synchronization", event.botId());
      case POSITION_UPDATE -> log.info("Bot {} position update: {}", event.botId(), event.data());
      case PROFIT_RECORD -> log.info("Bot {} recorded profit: {}", event.botId(), event.data());
      case REBALANCE -> log.info("Rebalance triggered by {}: {}", event.botId(), event.data());
      case EMERGENCY_STOP -> log.warn("Emergency stop raised by {}: {}", event.botId(), event.data());
    }
  }
}
