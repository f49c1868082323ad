package com.poolbot.portfolio.manager;

import com.poolbot.portfolio.allocation.AllocationManager;
import com.poolbot.portfolio.allocation.RebalanceCheck;
import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.leverage.LeverageCalculator;
import com.poolbot.portfolio.model.AllocationEvent;
import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.BotConfig;
import com.poolbot.portfolio.model.HealthStatus;
import com.poolbot.portfolio.model.Money;
import com.poolbot.portfolio.model.PortfolioConfig;
import com.poolbot.portfolio.model.PortfolioHealth;
import com.poolbot.portfolio.model.PortfolioState;
import com.poolbot.portfolio.model.PortfolioSummary;
import com.poolbot.portfolio.model.RiskMetrics;
import com.poolbot.portfolio.risk.BasicRiskManager;
import com.poolbot.portfolio.risk.RiskManager;
import com.poolbot.portfolio.store.StateStore;
import com.poolbot.portfolio.store.StateValidator;
import com.poolbot.portfolio.sync.SharedStateTemplate;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Entry point for a bot process: owns the ledger, applies risk policy and keeps the shared
 * document in step with every change.
 *
 * Lifecycle: construct, {@link #initialize()}, use, {@link #close()}. Every operation other than
 * {@code initialize} fails with {@code CONFIGURATION_INVALID} before initialization.
 */
@Slf4j
public class PortfolioManager implements AutoCloseable {

  private static final double BOT_MARGIN_WARNING = 0.9;

  private final AllocationManager ledger;
  private final StateStore store;
  private final LeverageCalculator calculator;
  private final SharedStateTemplate sharedState;
  private final Clock clock;

  private volatile PortfolioConfig config;
  private volatile RiskManager riskManager;
  private volatile boolean initialized;
  private BigDecimal peakValue = BigDecimal.ZERO;

  public PortfolioManager(
      PortfolioConfig config,
      AllocationManager ledger,
      RiskManager riskManager,
      StateStore store,
      LeverageCalculator calculator,
      Duration lockTimeout,
      Clock clock
  ) {
    this.config = config;
    this.ledger = ledger;
    this.riskManager = riskManager;
    this.store = store;
    this.calculator = calculator;
    this.clock = clock;
    this.sharedState = new SharedStateTemplate(store, ledger, this::config, lockTimeout);
  }

  /**
   * Validate configuration, install the default risk manager when none was supplied, and load the
   * shared document when one exists. Idempotent.
   */
  public synchronized void initialize() {
    if (initialized) {
      return;
    }
    if (!Money.isPositive(config.totalBalance())) {
      throw PortfolioException.of(PortfolioErrorCode.CONFIGURATION_INVALID, "total balance must be positive");
    }
    PortfolioConfig normalized = config.normalized();
    if (normalized != config) {
      log.warn("Max total exposure {} out of range, using {}", config.maxTotalExposure(), normalized.maxTotalExposure());
      config = normalized;
    }
    if (riskManager == null) {
      riskManager = new BasicRiskManager(config, calculator);
    }

    if (store.exists()) {
      PortfolioState state = store.load();
      StateValidator.validateIntegrity(state);
      ledger.restore(state);
    } else {
      log.info("No shared state yet, starting with ${} pool", ledger.getTotalBalance().toPlainString());
    }
    peakValue = totalValue();
    initialized = true;
    log.info("Portfolio manager initialized: balance=${}, strategy={}, bots={}",
        ledger.getTotalBalance().toPlainString(), ledger.getStrategy().getId(), ledger.getAllAllocations().size());
  }

  public BotAllocation registerBot(BotConfig botConfig) {
    ensureInitialized();
    BotAllocation allocation = sharedState.execute(null, () -> ledger.allocateToBot(botConfig));
    log.info("Bot registered: {} ({}) allocated ${} ({}%)", botConfig.botId(), botConfig.symbol(),
        allocation.allocatedBalance().toPlainString(), botConfig.allocationPercentage() * 100);
    return allocation;
  }

  public BotAllocation unregisterBot(String botId) {
    ensureInitialized();
    BotAllocation removed = sharedState.execute(null, () -> ledger.deallocateFromBot(botId));
    log.info("Bot unregistered: {}", botId);
    return removed;
  }

  public BigDecimal getAvailableBalance(String botId) {
    ensureInitialized();
    return ledger.getAllocation(botId).availableBalance();
  }

  /**
   * Margin {@code botId} needs for {@code positionValue} at its configured leverage.
   */
  public BigDecimal getRequiredMargin(String botId, BigDecimal positionValue) {
    ensureInitialized();
    return calculator.requiredMargin(positionValue, ledger.getAllocation(botId).leverage());
  }

  public BotAllocation updateBotBalance(String botId, BigDecimal newAllocated) {
    ensureInitialized();
    return sharedState.execute(null, () -> ledger.resizeAllocation(botId, newAllocated));
  }

  /**
   * Apply a position after the risk manager approves it and the pool stays within its exposure limit.
   */
  public BotAllocation updatePosition(String botId, BigDecimal positionValue, BigDecimal averagePrice, double leverage) {
    ensureInitialized();
    riskManager.validateNewPosition(botId, positionValue, leverage);
    return sharedState.execute(null, () -> {
      riskManager.checkPositionChange(botId, positionValue, leverage,
          ledger.projectedExposure(botId, positionValue), ledger.getTotalBalance());
      return ledger.updateBotPosition(botId, positionValue, averagePrice, leverage);
    });
  }

  public BotAllocation closePosition(String botId) {
    ensureInitialized();
    return sharedState.execute(null, () -> ledger.closePosition(botId));
  }

  public BotAllocation updateUnrealizedPnl(String botId, BigDecimal unrealizedPnl) {
    ensureInitialized();
    return sharedState.execute(null, () -> ledger.updateUnrealizedPnl(botId, unrealizedPnl));
  }

  /**
   * Book profit, sharing it when profit sharing is enabled in the pool policy.
   */
  public BotAllocation recordProfit(String botId, BigDecimal profit) {
    return recordProfit(botId, profit, config.profitSharingEnabled());
  }

  public BotAllocation recordProfit(String botId, BigDecimal profit, boolean shareProfit) {
    ensureInitialized();
    BotAllocation updated = sharedState.execute(null, () -> ledger.recordProfit(botId, profit, shareProfit));
    log.info("Profit recorded for {}: ${} (pool profit ${})", botId, profit.toPlainString(),
        ledger.getTotalProfit().toPlainString());
    return updated;
  }

  /**
   * Total balance plus cumulative profit plus unrealized PnL across bots.
   */
  public BigDecimal getTotalPortfolioValue() {
    ensureInitialized();
    return totalValue();
  }

  public BotAllocation getBotAllocation(String botId) {
    ensureInitialized();
    return ledger.getAllocation(botId);
  }

  public Map<String, BotAllocation> getAllAllocations() {
    ensureInitialized();
    return ledger.getAllAllocations();
  }

  public BigDecimal getTotalProfit() {
    ensureInitialized();
    return ledger.getTotalProfit();
  }

  public PortfolioSummary getSummary() {
    ensureInitialized();
    return ledger.getPortfolioSummary();
  }

  public List<AllocationEvent> getHistory(int limit) {
    ensureInitialized();
    return ledger.getAllocationHistory(limit);
  }

  public synchronized RiskMetrics getRiskMetrics() {
    ensureInitialized();
    BigDecimal value = totalValue();
    if (value.compareTo(peakValue) > 0) {
      peakValue = value;
    }
    return riskManager.riskMetrics(ledger.getAllAllocations().values(), value, peakValue);
  }

  /**
   * @throws PortfolioException with {@code EXCEEDS_RISK_LIMIT} when trading should stop
   */
  public void checkPortfolioLimits() {
    ensureInitialized();
    riskManager.checkPortfolioLimits(ledger.getPortfolioSummary());
  }

  /**
   * Rebalance when drift exceeds the threshold and the rebalance interval has passed.
   *
   * @return number of adjusted bots
   */
  public int rebalanceIfNeeded() {
    ensureInitialized();
    RebalanceCheck check = ledger.checkRebalanceNeeded();
    if (!check.needed()) {
      return 0;
    }
    check.reasons().forEach(reason -> log.info("Rebalance needed: {}", reason));
    return sharedState.execute(null, ledger::executeRebalance);
  }

  public PortfolioState saveState() {
    ensureInitialized();
    return sharedState.persist(null);
  }

  public void loadState() {
    ensureInitialized();
    PortfolioState state = store.load();
    StateValidator.validateIntegrity(state);
    ledger.restore(state);
  }

  public PortfolioHealth getPortfolioHealth() {
    ensureInitialized();
    PortfolioSummary summary = ledger.getPortfolioSummary();
    double exposurePercent = summary.exposureRatio() * 100;
    double pnlPercent = summary.pnlPercent();
    HealthStatus status = HealthStatus.HEALTHY;
    List<String> issues = new ArrayList<>();
    List<String> warnings = new ArrayList<>();

    double exposureLimit = config.maxTotalExposure() * 100;
    if (exposurePercent > exposureLimit) {
      status = HealthStatus.CRITICAL;
      issues.add(String.format("total exposure %.1f%% exceeds limit %.1f%%", exposurePercent, exposureLimit));
    } else if (exposurePercent > config.maxTotalExposure() * 80) {
      status = HealthStatus.WARNING;
      warnings.add(String.format("high exposure: %.1f%%", exposurePercent));
    }

    if (config.maxDrawdownPercent() > 0 && pnlPercent < -config.maxDrawdownPercent()) {
      status = HealthStatus.CRITICAL;
      issues.add(String.format("drawdown %.1f%% exceeds limit %.1f%%", -pnlPercent, config.maxDrawdownPercent()));
    }

    for (BotAllocation allocation : ledger.getAllAllocations().values()) {
      BigDecimal allocated = allocation.allocatedBalance();
      if (allocation.positionMarginUsed().compareTo(Money.times(allocated, BOT_MARGIN_WARNING)) > 0) {
        warnings.add(String.format("bot %s using high margin: %.1f%%",
            allocation.botId(), Money.ratio(allocation.positionMarginUsed(), allocated) * 100));
      }
      BigDecimal lossLimit = Money.times(allocated, config.riskLimitPerBot());
      if (config.riskLimitPerBot() > 0 && allocation.unrealizedPnl().negate().compareTo(lossLimit) > 0) {
        warnings.add(String.format("bot %s unrealized loss %s beyond %.0f%% of allocation",
            allocation.botId(), allocation.unrealizedPnl().toPlainString(), config.riskLimitPerBot() * 100));
      }
    }
    if (!warnings.isEmpty()) {
      status = status.escalate(HealthStatus.WARNING);
    }

    return new PortfolioHealth(status, summary.totalBalance(), summary.totalExposure(), exposurePercent,
        pnlPercent, summary.activeBots(), issues, warnings, clock.instant());
  }

  public boolean isHealthy() {
    try {
      return getPortfolioHealth().isHealthy();
    } catch (PortfolioException e) {
      return false;
    }
  }

  public PortfolioConfig config() {
    return config;
  }

  public AllocationManager ledger() {
    return ledger;
  }

  public StateStore store() {
    return store;
  }

  /**
   * The active risk policy; available once initialized.
   */
  public RiskManager riskManager() {
    ensureInitialized();
    return riskManager;
  }

  public boolean isInitialized() {
    return initialized;
  }

  /**
   * Best-effort final save. A failing save is logged, never thrown.
   */
  @Override
  public synchronized void close() {
    if (!initialized) {
      return;
    }
    try {
      sharedState.persist(null);
    } catch (RuntimeException e) {
      log.warn("Failed to save final portfolio state: {}", e.toString());
    }
    initialized = false;
    log.info("Portfolio manager closed");
  }

  private BigDecimal totalValue() {
    return ledger.getTotalBalance()
        .add(ledger.getTotalProfit())
        .add(ledger.getPortfolioSummary().unrealizedPnl());
  }

  private void ensureInitialized() {
    if (!initialized) {
      throw PortfolioException.of(PortfolioErrorCode.CONFIGURATION_INVALID, "portfolio manager not initialized");
    }
  }
}
