package com.poolbot.portfolio.sync;

/**
 * Receives {@link SyncEvent}s. Implementations may be called from a dispatcher thread and must not
 * assume they run on the publishing thread.
 */
@FunctionalInterface
public interface EventHandler {

  void handle(SyncEvent event);

  default String name() {
    return getClass().getSimpleName();
  }
}
