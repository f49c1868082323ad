package com.poolbot.portfolio.sync;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans events out to registered handlers on an executor, so a slow handler never holds up the
 * publisher. A failing handler is logged and does not affect the others.
 */
@Slf4j
public class SyncEventDispatcher implements AutoCloseable {

  private final List<EventHandler> handlers = new CopyOnWriteArrayList<>();
  private final Executor executor;
  private final ExecutorService ownedExecutor;

  /**
   * Dispatcher with its own daemon thread; events reach each handler in publish order.
   */
  public SyncEventDispatcher() {
    this.ownedExecutor = Executors.newSingleThreadExecutor(r -> {
      Thread t = new Thread(r, "portfolio-sync-events");
      t.setDaemon(true);
      return t;
    });
    this.executor = ownedExecutor;
  }

  public SyncEventDispatcher(Executor executor) {
    this.executor = executor;
    this.ownedExecutor = null;
  }

  public void addHandler(EventHandler handler) {
    handlers.add(handler);
  }

  public boolean removeHandler(EventHandler handler) {
    return handlers.remove(handler);
  }

  public List<EventHandler> handlers() {
    return List.copyOf(handlers);
  }

  public void publish(SyncEvent event) {
    for (EventHandler handler : handlers) {
      try {
        executor.execute(() -> deliver(handler, event));
      } catch (RejectedExecutionException e) {
        log.warn("Dropped {} event for handler {}: dispatcher is shut down", event.type(), handler.name());
      }
    }
  }

  @Override
  public void close() {
    if (ownedExecutor != null) {
      ownedExecutor.shutdown();
    }
  }

  private static void deliver(EventHandler handler, SyncEvent event) {
    try {
      handler.handle(event);
    } catch (Exception e) {
      log.warn("Event handler {} failed on {} from {}: {}", handler.name(), event.type(), event.botId(), e.toString());
    }
  }
}
