package com.poolbot.portfolio.sync;

import com.poolbot.portfolio.MutableClock;
import com.poolbot.portfolio.allocation.AllocationManager;
import com.poolbot.portfolio.allocation.RebalanceConfig;
import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.leverage.DefaultLeverageCalculator;
import com.poolbot.portfolio.manager.PortfolioManager;
import com.poolbot.portfolio.model.AllocationStrategy;
import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.BotConfig;
import com.poolbot.portfolio.model.PortfolioConfig;
import com.poolbot.portfolio.store.FileStateStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for SynchronizationManager.
 *
 * Events are dispatched on the publishing thread so assertions can run right after each call.
 */
class SynchronizationManagerTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

  @TempDir
  Path tempDir;

  private MutableClock clock;
  private Path stateFile;
  private PortfolioManager portfolio;
  private SyncEventDispatcher dispatcher;
  private List<SyncEvent> events;
  private SynchronizationManager sync;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    stateFile = tempDir.resolve("portfolio_state.json");
    portfolio = newPortfolio();
    portfolio.initialize();
    portfolio.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));

    events = new CopyOnWriteArrayList<>();
    dispatcher = new SyncEventDispatcher(Runnable::run);
    dispatcher.addHandler(events::add);
    sync = newSync(Duration.ofSeconds(5));
  }

  @AfterEach
  void tearDown() {
    sync.close();
  }

  @Test
  void shouldMergeRemoteChangesOnSync() {
    // Given: another process registers a bot
    PortfolioManager other = newPortfolio();
    other.initialize();
    other.registerBot(BotConfig.of("eth-bot", "ETHUSDT", 5, 0.3));

    // When:
    int conflicts = sync.syncState();

    // Then:
    assertThat(conflicts).isEqualTo(1);
    assertThat(portfolio.getAllAllocations()).containsOnlyKeys("btc-bot", "eth-bot");
    SyncStats stats = sync.getSyncStats();
    assertThat(stats.syncCount()).isEqualTo(1);
    assertThat(stats.successfulSyncs()).isEqualTo(1);
    assertThat(stats.conflictCount()).isEqualTo(1);
    assertThat(stats.lastSync()).isEqualTo(NOW);
    assertThat(stats.lastConflict()).isEqualTo(NOW);
  }

  @Test
  void shouldReportNoConflictsWhenAlreadyInStep() {
    assertThat(sync.syncState()).isZero();
    assertThat(sync.getSyncStats().lastConflict()).isNull();
  }

  @Test
  void shouldPersistAndPublishPositionUpdate() {
    // When:
    BotAllocation updated = sync.updatePosition(new BigDecimal("1000"), new BigDecimal("50000"), 10);

    // Then:
    assertThat(updated.positionMarginUsed()).isEqualByComparingTo("100");
    assertThat(new FileStateStore(stateFile, clock).load().allocations().get("btc-bot").currentPosition())
        .isEqualByComparingTo("1000");
    assertThat(events).singleElement().satisfies(event -> {
      assertThat(event.type()).isEqualTo(SyncEventType.POSITION_UPDATE);
      assertThat(event.botId()).isEqualTo("btc-bot");
      assertThat(event.requiresAck()).isTrue();
      assertThat((BigDecimal) event.data().get("margin_used")).isEqualByComparingTo("100");
    });
  }

  @Test
  void shouldApplyRiskPolicyToPositionUpdates() {
    // When/Then: 50000 notional on a 1000 pool is far beyond the 3x exposure limit
    assertThatThrownBy(() -> sync.updatePosition(new BigDecimal("50000"), BigDecimal.ONE, 100))
        .isInstanceOfSatisfying(PortfolioException.class, e -> {
          assertThat(e.code()).isEqualTo(PortfolioErrorCode.EXCEEDS_RISK_LIMIT);
          assertThat(e.botId()).isEqualTo("btc-bot");
        });
    assertThatThrownBy(() -> sync.updatePosition(new BigDecimal("1000"), BigDecimal.ONE, 500))
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.INVALID_LEVERAGE));
    assertThatThrownBy(() -> sync.updatePosition(new BigDecimal("1000"), BigDecimal.ONE, 0))
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.INVALID_LEVERAGE));

    // Then:
    BotAllocation stored = new FileStateStore(stateFile, clock).load().allocations().get("btc-bot");
    assertThat(stored.currentPosition()).isEqualByComparingTo("0");
    assertThat(stored.leverage()).isEqualTo(10.0);
    assertThat(events).isEmpty();
  }

  @Test
  void shouldPublishProfitRecord() {
    sync.recordProfit(new BigDecimal("40"), false);

    assertThat(portfolio.getTotalProfit()).isEqualByComparingTo("40");
    assertThat(events).extracting(SyncEvent::type).containsExactly(SyncEventType.PROFIT_RECORD);
    assertThat(events.get(0).data()).containsEntry("share_profit", false);
  }

  @Test
  void shouldRebalanceOnDemand() {
    // Given: sharing 100 of profit leaves eth-bot 20 above its 30% target
    portfolio.registerBot(BotConfig.of("eth-bot", "ETHUSDT", 5, 0.3));
    portfolio.recordProfit("btc-bot", new BigDecimal("100"), true);
    assertThat(portfolio.getBotAllocation("eth-bot").allocatedBalance()).isEqualByComparingTo("350");

    // When:
    int adjustments = sync.triggerRebalance();

    // Then:
    assertThat(adjustments).isEqualTo(1);
    assertThat(portfolio.getBotAllocation("eth-bot").allocatedBalance()).isEqualByComparingTo("330");
    assertThat(events).extracting(SyncEvent::type).containsExactly(SyncEventType.REBALANCE);
    assertThat(events.get(0).data()).containsEntry("adjustments", 1);
  }

  @Test
  void shouldKeepDeliveringWhenOneHandlerFails() {
    // Given:
    List<SyncEvent> late = new CopyOnWriteArrayList<>();
    sync.addEventHandler(event -> {
      throw new IllegalStateException("handler down");
    });
    sync.addEventHandler(late::add);

    // When:
    sync.broadcastEmergencyStop("drawdown 30%");

    // Then:
    assertThat(events).extracting(SyncEvent::type).containsExactly(SyncEventType.EMERGENCY_STOP);
    assertThat(late).singleElement().satisfies(event -> {
      assertThat(event.requiresAck()).isTrue();
      assertThat(event.data()).containsEntry("reason", "drawdown 30%");
    });
  }

  @Test
  void shouldCountCorruptedState() throws IOException {
    Files.writeString(stateFile, "{broken");

    assertThatThrownBy(() -> sync.syncState())
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.STATE_CORRUPTED));

    SyncStats stats = sync.getSyncStats();
    assertThat(stats.stateCorruptions()).isEqualTo(1);
    assertThat(stats.failedSyncs()).isEqualTo(1);
    assertThat(stats.successfulSyncs()).isZero();
  }

  @Test
  void shouldCountLockContention() {
    new FileStateStore(stateFile, clock).lock();

    assertThatThrownBy(() -> sync.syncState())
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.PORTFOLIO_LOCKED));

    assertThat(sync.getSyncStats().lockContentions()).isEqualTo(1);
  }

  @Test
  void shouldBecomeUnhealthyWhenSyncGoesStale() throws InterruptedException {
    // Given:
    sync = newSync(Duration.ofSeconds(2));
    assertThat(sync.isHealthy()).isFalse();

    // When:
    sync.start();

    // Then:
    assertThat(sync.waitForSync(Duration.ofSeconds(10))).isTrue();
    assertThat(sync.isHealthy()).isTrue();
    clock.advance(Duration.ofSeconds(61));
    assertThat(sync.isHealthy()).isFalse();
  }

  @Test
  void shouldRefuseSecondStart() {
    sync.start();

    assertThatThrownBy(() -> sync.start()).isInstanceOf(IllegalStateException.class);
    assertThat(sync.isRunning()).isTrue();
  }

  @Test
  void shouldAnnounceRegisterAndUnregister() {
    // When:
    sync.start();

    // Then:
    assertThat(events).extracting(SyncEvent::type).contains(SyncEventType.REGISTER);
    assertThat(sync.getActiveHeartbeats()).containsKey("btc-bot");

    // When:
    sync.stop();

    // Then:
    assertThat(sync.isRunning()).isFalse();
    assertThat(events.get(events.size() - 1).type()).isEqualTo(SyncEventType.UNREGISTER);
    assertThat(sync.getActiveHeartbeats()).doesNotContainKey("btc-bot");
  }

  @Test
  void shouldAgeHeartbeatsOfSilentBots() {
    // Given:
    dispatcher.publish(SyncEvent.of(SyncEventType.HEARTBEAT, "eth-bot", NOW,
        Map.of("version", "2.0.0", "process_id", 4242L, "hostname", "node-2")));

    // Then:
    HeartbeatInfo info = sync.getActiveHeartbeats().get("eth-bot");
    assertThat(info.status()).isEqualTo(HeartbeatStatus.ACTIVE);
    assertThat(info.processId()).isEqualTo(4242L);
    assertThat(info.hostname()).isEqualTo("node-2");

    clock.advance(Duration.ofSeconds(90));
    assertThat(sync.getActiveHeartbeats().get("eth-bot").status()).isEqualTo(HeartbeatStatus.INACTIVE);

    clock.advance(Duration.ofMinutes(5));
    assertThat(sync.getActiveHeartbeats().get("eth-bot").status()).isEqualTo(HeartbeatStatus.DEAD);
    assertThat(sync.getSyncStats().deadBots()).isEqualTo(1);
  }

  @Test
  void shouldRequireBotId() {
    assertThatThrownBy(() -> SynchronizationManager.forPortfolio(" ", portfolio, SyncSettings.defaults(), dispatcher,
        clock))
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.CONFIGURATION_INVALID));
  }

  private SynchronizationManager newSync(Duration syncInterval) {
    SyncSettings settings = new SyncSettings(Duration.ofSeconds(30), syncInterval, Duration.ofMillis(100),
        Duration.ofSeconds(60), null);
    return SynchronizationManager.forPortfolio("btc-bot", portfolio, settings, dispatcher, clock);
  }

  private PortfolioManager newPortfolio() {
    PortfolioConfig config = new PortfolioConfig(new BigDecimal("1000"), AllocationStrategy.EQUAL_WEIGHT,
        stateFile.toString(), 3.0, 25.0, Duration.ofHours(1), 0.2, true, true);
    DefaultLeverageCalculator calculator = new DefaultLeverageCalculator();
    AllocationManager ledger = new AllocationManager(config.totalBalance(), config.allocationStrategy(),
        RebalanceConfig.defaults(), calculator, clock, 100);
    return new PortfolioManager(config, ledger, null, new FileStateStore(stateFile, clock), calculator,
        Duration.ofMillis(500), clock);
  }
}
