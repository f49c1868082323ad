package com.poolbot.portfolio.manager;

import com.poolbot.portfolio.MutableClock;
import com.poolbot.portfolio.allocation.AllocationManager;
import com.poolbot.portfolio.allocation.RebalanceConfig;
import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.leverage.DefaultLeverageCalculator;
import com.poolbot.portfolio.model.AllocationStrategy;
import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.BotConfig;
import com.poolbot.portfolio.model.HealthStatus;
import com.poolbot.portfolio.model.PortfolioConfig;
import com.poolbot.portfolio.model.PortfolioHealth;
import com.poolbot.portfolio.model.PortfolioState;
import com.poolbot.portfolio.model.RiskMetrics;
import com.poolbot.portfolio.store.FileStateStore;
import com.poolbot.portfolio.store.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for PortfolioManager.
 *
 * Covers the shared-document round trip, risk gating on positions and the health report.
 */
class PortfolioManagerTest {

  private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

  @TempDir
  Path tempDir;

  private MutableClock clock;
  private Path stateFile;
  private PortfolioManager manager;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(NOW);
    stateFile = tempDir.resolve("portfolio_state.json");
    manager = newManager(config(3.0));
  }

  @Test
  void shouldRejectOperationsBeforeInitialize() {
    assertThatThrownBy(() -> manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5)))
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.CONFIGURATION_INVALID));
    assertThat(manager.isHealthy()).isFalse();
  }

  @Test
  void shouldRegisterBotAndPersistIt() {
    // Given:
    manager.initialize();

    // When:
    BotAllocation allocation = manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));

    // Then:
    assertThat(allocation.allocatedBalance()).isEqualByComparingTo("500");
    assertThat(manager.getAvailableBalance("btc-bot")).isEqualByComparingTo("500");
    assertThat(manager.getRequiredMargin("btc-bot", new BigDecimal("1000"))).isEqualByComparingTo("100");

    PortfolioState persisted = new FileStateStore(stateFile, clock).load();
    assertThat(persisted.allocations()).containsOnlyKeys("btc-bot");
    assertThat(persisted.lockHolder()).isNotNull();
    assertThat(tempDir.resolve("portfolio_state.json.lock")).doesNotExist();
  }

  @Test
  void shouldRollBackWhenSaveFails() {
    // Given: a store that cannot write
    StateStore store = mock(StateStore.class);
    when(store.exists()).thenReturn(false);
    doThrow(new UncheckedIOException(new IOException("disk full"))).when(store).save(any());
    DefaultLeverageCalculator calculator = new DefaultLeverageCalculator();
    AllocationManager ledger = new AllocationManager(new BigDecimal("1000"), AllocationStrategy.EQUAL_WEIGHT,
        RebalanceConfig.defaults(), calculator, clock, 100);
    PortfolioManager failing = new PortfolioManager(config(3.0), ledger, null, store, calculator,
        Duration.ofMillis(100), clock);
    failing.initialize();

    // When/Then:
    assertThatThrownBy(() -> failing.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5)))
        .isInstanceOf(UncheckedIOException.class)
        .hasMessageContaining("disk full");
    assertThat(failing.getAllAllocations()).isEmpty();
  }

  @Test
  void shouldRejectPositionBeyondExposureLimit() {
    // Given:
    manager.initialize();
    manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));

    // When/Then: 3500 against a 1000 pool breaches the 3x limit even though margin would fit
    assertThatThrownBy(() -> manager.updatePosition("btc-bot", new BigDecimal("3500"), new BigDecimal("50000"), 10))
        .isInstanceOfSatisfying(PortfolioException.class, e -> {
          assertThat(e.code()).isEqualTo(PortfolioErrorCode.EXCEEDS_RISK_LIMIT);
          assertThat(e.botId()).isEqualTo("btc-bot");
        });
    assertThat(manager.getBotAllocation("btc-bot").currentPosition()).isEqualByComparingTo("0");
  }

  @Test
  void shouldRejectLeverageAboveCalculatorMaximum() {
    manager.initialize();
    manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));

    assertThatThrownBy(() -> manager.updatePosition("btc-bot", new BigDecimal("100"), new BigDecimal("50000"), 150))
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.INVALID_LEVERAGE));
  }

  @Test
  void shouldRejectZeroLeverageWithoutTouchingSharedState() {
    // Given:
    manager.initialize();
    manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));

    // When/Then:
    assertThatThrownBy(() -> manager.updatePosition("btc-bot", new BigDecimal("100"), new BigDecimal("50000"), 0))
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.INVALID_LEVERAGE));

    // Then: the shared document still loads and accepts further writes
    PortfolioState persisted = new FileStateStore(stateFile, clock).load();
    assertThat(persisted.allocations().get("btc-bot").leverage()).isEqualTo(10.0);
    manager.registerBot(BotConfig.of("eth-bot", "ETHUSDT", 5, 0.3));
    assertThat(manager.getAllAllocations()).containsOnlyKeys("btc-bot", "eth-bot");
  }

  @Test
  void shouldReportWarningThenCritical() {
    // Given:
    manager.initialize();
    manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));
    manager.updatePosition("btc-bot", new BigDecimal("2500"), new BigDecimal("50000"), 10);

    // When: exposure at 250% is over 80% of the 300% limit
    PortfolioHealth warning = manager.getPortfolioHealth();

    // Then:
    assertThat(warning.status()).isEqualTo(HealthStatus.WARNING);
    assertThat(warning.exposurePercent()).isEqualTo(250.0);
    assertThat(warning.warnings()).anyMatch(w -> w.contains("high exposure"));
    assertThat(warning.issues()).isEmpty();
    assertThat(manager.isHealthy()).isFalse();

    // When: a 30% loss passes the 25% drawdown limit
    manager.recordProfit("btc-bot", new BigDecimal("-300"));
    PortfolioHealth critical = manager.getPortfolioHealth();

    // Then:
    assertThat(critical.status()).isEqualTo(HealthStatus.CRITICAL);
    assertThat(critical.issues()).anyMatch(i -> i.contains("drawdown"));
    assertThatThrownBy(manager::checkPortfolioLimits)
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.EXCEEDS_RISK_LIMIT));
  }

  @Test
  void shouldBeHealthyWhenIdle() {
    manager.initialize();
    manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));

    assertThat(manager.isHealthy()).isTrue();
    assertThat(manager.getPortfolioHealth().warnings()).isEmpty();
  }

  @Test
  void shouldShareStateBetweenManagersOnSameFile() {
    // Given:
    manager.initialize();
    manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));
    PortfolioManager other = newManager(config(3.0));

    // When:
    other.initialize();
    other.registerBot(BotConfig.of("eth-bot", "ETHUSDT", 5, 0.5));
    manager.recordProfit("btc-bot", new BigDecimal("100"));

    // Then: the profit is shared across both bots and the pool grows
    assertThat(manager.getAllAllocations()).containsOnlyKeys("btc-bot", "eth-bot");
    assertThat(manager.getSummary().totalBalance()).isEqualByComparingTo("1100");
    assertThat(manager.getBotAllocation("eth-bot").allocatedBalance()).isEqualByComparingTo("550");

    other.loadState();
    assertThat(other.getBotAllocation("btc-bot").allocatedBalance()).isEqualByComparingTo("550");
    assertThat(other.getTotalProfit()).isEqualByComparingTo("100");
  }

  @Test
  void shouldTrackPortfolioValueAndPeak() {
    manager.initialize();
    manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));
    manager.recordProfit("btc-bot", new BigDecimal("50"), false);
    manager.updateUnrealizedPnl("btc-bot", new BigDecimal("25"));

    assertThat(manager.getTotalPortfolioValue()).isEqualByComparingTo("1075");
    RiskMetrics first = manager.getRiskMetrics();
    assertThat(first.peakValue()).isEqualByComparingTo("1075");

    manager.updateUnrealizedPnl("btc-bot", new BigDecimal("-75"));
    RiskMetrics second = manager.getRiskMetrics();
    assertThat(second.peakValue()).isEqualByComparingTo("1075");
    assertThat(second.currentValue()).isEqualByComparingTo("975");
  }

  @Test
  void shouldNormalizeOutOfRangeExposureLimit() {
    PortfolioManager loose = newManager(config(50.0));

    loose.initialize();

    assertThat(loose.config().maxTotalExposure()).isEqualTo(PortfolioConfig.DEFAULT_MAX_TOTAL_EXPOSURE);
  }

  @Test
  void shouldRejectNonPositiveBalance() {
    PortfolioConfig broke = new PortfolioConfig(BigDecimal.ZERO, AllocationStrategy.EQUAL_WEIGHT,
        stateFile.toString(), 3.0, 25.0, Duration.ofHours(1), 0.2, true, true);
    DefaultLeverageCalculator calculator = new DefaultLeverageCalculator();
    AllocationManager ledger = new AllocationManager(BigDecimal.ONE, AllocationStrategy.EQUAL_WEIGHT,
        RebalanceConfig.defaults(), calculator, clock, 100);
    PortfolioManager invalid = new PortfolioManager(broke, ledger, null, new FileStateStore(stateFile, clock),
        calculator, Duration.ofMillis(100), clock);

    assertThatThrownBy(invalid::initialize)
        .isInstanceOfSatisfying(PortfolioException.class,
            e -> assertThat(e.code()).isEqualTo(PortfolioErrorCode.CONFIGURATION_INVALID));
  }

  @Test
  void shouldSaveOnClose() {
    manager.initialize();
    assertThat(Files.exists(stateFile)).isFalse();

    manager.close();

    assertThat(Files.exists(stateFile)).isTrue();
    assertThat(manager.isInitialized()).isFalse();
  }

  @Test
  void shouldRestoreExistingStateOnInitialize() {
    manager.initialize();
    manager.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));
    manager.close();

    PortfolioManager restarted = newManager(config(3.0));
    restarted.initialize();

    assertThat(restarted.getBotAllocation("btc-bot").symbol()).isEqualTo("BTCUSDT");
    assertThat(restarted.unregisterBot("btc-bot").botId()).isEqualTo("btc-bot");
    assertThat(new FileStateStore(stateFile, clock).load().allocations()).isEmpty();
  }

  private PortfolioManager newManager(PortfolioConfig config) {
    DefaultLeverageCalculator calculator = new DefaultLeverageCalculator();
    AllocationManager ledger = new AllocationManager(config.totalBalance(), config.allocationStrategy(),
        RebalanceConfig.defaults(), calculator, clock, 100);
    return new PortfolioManager(config, ledger, null, new FileStateStore(stateFile, clock), calculator,
        Duration.ofMillis(500), clock);
  }

  private PortfolioConfig config(double maxTotalExposure) {
    return new PortfolioConfig(new BigDecimal("1000"), AllocationStrategy.EQUAL_WEIGHT, stateFile.toString(),
        maxTotalExposure, 25.0, Duration.ofHours(1), 0.2, true, true);
  }
}
