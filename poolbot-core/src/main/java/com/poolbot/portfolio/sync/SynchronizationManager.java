package com.poolbot.portfolio.sync;

import com.poolbot.portfolio.allocation.AllocationManager;
import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.manager.PortfolioManager;
import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.Money;
import com.poolbot.portfolio.model.PortfolioConfig;
import com.poolbot.portfolio.risk.RiskManager;
import com.poolbot.portfolio.store.StateStore;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Keeps one bot's ledger in step with the shared document while the bot runs.
 *
 * Two loops run while started:
 * - heartbeat: publishes a HEARTBEAT event every heartbeat interval
 * - sync: pulls and merges the shared document every sync interval
 *
 * Position, profit and rebalance changes made through this manager are applied under the shared
 * lock, persisted, then published to the registered {@link EventHandler}s.
 */
@Slf4j
public class SynchronizationManager implements AutoCloseable {

  private final String botId;
  private final AllocationManager ledger;
  private final Supplier<RiskManager> riskPolicy;
  private final SharedStateTemplate sharedState;
  private final SyncSettings settings;
  private final SyncEventDispatcher dispatcher;
  private final HeartbeatTracker heartbeats;
  private final Clock clock;
  private final long processId = ProcessHandle.current().pid();
  private final String hostname = resolveHostname();

  private final AtomicBoolean running = new AtomicBoolean(false);
  private final Object syncMonitor = new Object();
  private ScheduledExecutorService scheduler;

  private final AtomicLong syncCount = new AtomicLong();
  private final AtomicLong successfulSyncs = new AtomicLong();
  private final AtomicLong failedSyncs = new AtomicLong();
  private final AtomicLong conflictCount = new AtomicLong();
  private final AtomicLong lockContentions = new AtomicLong();
  private final AtomicLong stateCorruptions = new AtomicLong();
  private final AtomicLong totalSyncNanos = new AtomicLong();
  private volatile Instant lastSync;
  private volatile Instant lastConflict;

  public SynchronizationManager(
      String botId,
      StateStore store,
      AllocationManager ledger,
      Supplier<RiskManager> riskPolicy,
      Supplier<PortfolioConfig> portfolioSettings,
      SyncSettings settings,
      SyncEventDispatcher dispatcher,
      Clock clock
  ) {
    if (botId == null || botId.isBlank()) {
      throw PortfolioException.of(PortfolioErrorCode.CONFIGURATION_INVALID, "bot id is required for synchronization");
    }
    this.botId = botId;
    this.ledger = ledger;
    this.riskPolicy = riskPolicy;
    this.settings = settings == null ? SyncSettings.defaults() : settings;
    this.sharedState = new SharedStateTemplate(store, ledger, portfolioSettings, this.settings.lockTimeout());
    this.dispatcher = dispatcher;
    this.clock = clock;
    this.heartbeats = new HeartbeatTracker(clock, this.settings.heartbeatInterval());
    dispatcher.addHandler(heartbeats);
  }

  public static SynchronizationManager forPortfolio(String botId, PortfolioManager portfolio, SyncSettings settings,
                                                    SyncEventDispatcher dispatcher, Clock clock) {
    return new SynchronizationManager(botId, portfolio.store(), portfolio.ledger(), portfolio::riskManager,
        portfolio::config, settings, dispatcher, clock);
  }

  /**
   * Start the heartbeat and sync loops and announce this bot.
   *
   * @throws IllegalStateException when already running
   */
  public void start() {
    if (!running.compareAndSet(false, true)) {
      throw new IllegalStateException("Synchronization already running for bot " + botId);
    }
    scheduler = Executors.newScheduledThreadPool(2, r -> {
      Thread t = new Thread(r, "portfolio-sync-" + botId);
      t.setDaemon(true);
      return t;
    });
    long heartbeatMs = settings.heartbeatInterval().toMillis();
    long syncMs = settings.syncInterval().toMillis();
    scheduler.scheduleAtFixedRate(this::heartbeatTick, 0, heartbeatMs, TimeUnit.MILLISECONDS);
    scheduler.scheduleWithFixedDelay(this::syncTick, 0, syncMs, TimeUnit.MILLISECONDS);

    dispatcher.publish(SyncEvent.of(SyncEventType.REGISTER, botId, clock.instant(), identity()));
    log.info("Synchronization started for bot {} (heartbeat {}ms, sync {}ms)", botId, heartbeatMs, syncMs);
  }

  /**
   * Stop both loops, then announce departure. No-op when not running.
   */
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    scheduler.shutdown();
    try {
      long waitMs = settings.lockTimeout().toMillis() + 1000;
      if (!scheduler.awaitTermination(waitMs, TimeUnit.MILLISECONDS)) {
        scheduler.shutdownNow();
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      scheduler.shutdownNow();
    }
    dispatcher.publish(SyncEvent.of(SyncEventType.UNREGISTER, botId, clock.instant(), identity()));
    log.info("Synchronization stopped for bot {}", botId);
  }

  public boolean isRunning() {
    return running.get();
  }

  /**
   * Pull the shared document and merge it into the local ledger.
   *
   * @return number of local allocations the merge replaced or dropped
   */
  public int syncState() {
    long started = System.nanoTime();
    syncCount.incrementAndGet();
    try {
      int conflicts = sharedState.refresh(botId);
      if (conflicts > 0) {
        conflictCount.addAndGet(conflicts);
        lastConflict = clock.instant();
      }
      long elapsed = System.nanoTime() - started;
      totalSyncNanos.addAndGet(elapsed);
      markSynced();
      log.debug("Synced bot {} in {}ms ({} conflicts)", botId, TimeUnit.NANOSECONDS.toMillis(elapsed), conflicts);
      return conflicts;
    } catch (PortfolioException e) {
      failedSyncs.incrementAndGet();
      if (e.is(PortfolioErrorCode.PORTFOLIO_LOCKED)) {
        lockContentions.incrementAndGet();
      } else if (e.is(PortfolioErrorCode.STATE_CORRUPTED)) {
        stateCorruptions.incrementAndGet();
      }
      throw e;
    } catch (RuntimeException e) {
      failedSyncs.incrementAndGet();
      throw e;
    }
  }

  /**
   * Replace this bot's position once the risk policy accepts it against the freshly merged ledger.
   */
  public BotAllocation updatePosition(BigDecimal positionValue, BigDecimal averagePrice, double leverage) {
    BotAllocation updated = sharedState.execute(botId, () -> {
      riskPolicy.get().checkPositionChange(botId, positionValue, leverage,
          ledger.projectedExposure(botId, positionValue), ledger.getTotalBalance());
      return ledger.updateBotPosition(botId, positionValue, averagePrice, leverage);
    });
    dispatcher.publish(SyncEvent.critical(SyncEventType.POSITION_UPDATE, botId, clock.instant(), Map.of(
        "position_value", positionValue,
        "average_price", Money.orZero(averagePrice),
        "leverage", leverage,
        "margin_used", updated.positionMarginUsed()
    )));
    return updated;
  }

  public BotAllocation recordProfit(BigDecimal profit, boolean shareProfit) {
    BotAllocation updated = sharedState.execute(botId, () -> ledger.recordProfit(botId, profit, shareProfit));
    dispatcher.publish(SyncEvent.critical(SyncEventType.PROFIT_RECORD, botId, clock.instant(), Map.of(
        "profit", profit,
        "share_profit", shareProfit,
        "total_profit", ledger.getTotalProfit()
    )));
    return updated;
  }

  /**
   * Rebalance the shared ledger now, regardless of drift or interval.
   *
   * @return number of adjusted bots
   */
  public int triggerRebalance() {
    int adjustments = sharedState.execute(botId, ledger::executeRebalance);
    dispatcher.publish(SyncEvent.critical(SyncEventType.REBALANCE, botId, clock.instant(),
        Map.of("adjustments", adjustments)));
    return adjustments;
  }

  public void broadcastEmergencyStop(String reason) {
    log.warn("Bot {} broadcasting emergency stop: {}", botId, reason);
    dispatcher.publish(SyncEvent.critical(SyncEventType.EMERGENCY_STOP, botId, clock.instant(),
        Map.of("reason", reason)));
  }

  public void addEventHandler(EventHandler handler) {
    dispatcher.addHandler(handler);
  }

  public boolean removeEventHandler(EventHandler handler) {
    return dispatcher.removeHandler(handler);
  }

  public Map<String, HeartbeatInfo> getActiveHeartbeats() {
    return heartbeats.snapshot();
  }

  public SyncStats getSyncStats() {
    long successes = successfulSyncs.get();
    double averageMs = successes == 0 ? 0.0 : totalSyncNanos.get() / (double) successes / 1_000_000.0;
    Map<String, HeartbeatInfo> beats = heartbeats.snapshot();
    int active = (int) beats.values().stream().filter(h -> h.status() == HeartbeatStatus.ACTIVE).count();
    int dead = (int) beats.values().stream().filter(h -> h.status() == HeartbeatStatus.DEAD).count();
    return new SyncStats(
        lastSync,
        syncCount.get(),
        conflictCount.get(),
        successes,
        failedSyncs.get(),
        averageMs,
        active,
        dead,
        lastConflict,
        lockContentions.get(),
        stateCorruptions.get()
    );
  }

  /**
   * Running, and the last successful sync is no older than the maximum sync age.
   */
  public boolean isHealthy() {
    Instant synced = lastSync;
    if (!running.get() || synced == null) {
      return false;
    }
    return Duration.between(synced, clock.instant()).compareTo(settings.maxSyncAge()) <= 0;
  }

  /**
   * Block until the next successful sync completes.
   *
   * @return false when {@code timeout} elapsed first
   */
  public boolean waitForSync(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (syncMonitor) {
      long baseline = successfulSyncs.get();
      while (successfulSyncs.get() == baseline) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(syncMonitor, remaining);
      }
      return true;
    }
  }

  public String botId() {
    return botId;
  }

  @Override
  public void close() {
    stop();
  }

  private void markSynced() {
    synchronized (syncMonitor) {
      lastSync = clock.instant();
      successfulSyncs.incrementAndGet();
      syncMonitor.notifyAll();
    }
  }

  private void heartbeatTick() {
    try {
      dispatcher.publish(SyncEvent.of(SyncEventType.HEARTBEAT, botId, clock.instant(), identity()));
    } catch (Exception e) {
      log.warn("Heartbeat failed for bot {}: {}", botId, e.toString());
    }
  }

  private void syncTick() {
    try {
      syncState();
    } catch (Exception e) {
      log.warn("Sync cycle failed for bot {}: {}", botId, e.toString());
    }
  }

  private Map<String, Object> identity() {
    return Map.of(
        "version", settings.version(),
        "process_id", processId,
        "hostname", hostname
    );
  }

  private static String resolveHostname() {
    try {
      return InetAddress.getLocalHost().getHostName();
    } catch (UnknownHostException e) {
      log.debug("Falling back to 'localhost' as heartbeat hostname: {}", e.toString());
      return "localhost";
    }
  }
}
