package com.poolbot.portfolio.config;

import com.poolbot.portfolio.model.BotConfig;
import com.poolbot.portfolio.sync.SyncSettings;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;

@Validated
@ConfigurationProperties(prefix="portfolio")
public record PortfolioProperties(
    @Positive BigDecimal totalBalance,
    String allocationStrategy,
    String stateFile,
    @PositiveOrZero Double maxTotalExposure,
    @PositiveOrZero Double maxDrawdownPercent,
    Duration rebalanceFrequency,
    @PositiveOrZero Double riskLimitPerBot,
    Boolean emergencyStopEnabled,
    @Valid ProfitSharing profitSharing,
    @Valid Rebalance rebalance,
    @Valid Sync sync,
    @Valid History history,
    @Valid Bot bot
) {

  public PortfolioProperties {
    if (totalBalance == null) {
      totalBalance = new BigDecimal("1000");
    }
    if (allocationStrategy == null || allocationStrategy.isBlank()) {
      allocationStrategy = "equal_weight";
    }
    if (stateFile == null || stateFile.isBlank()) {
      stateFile = "portfolio_state.json";
    }
    if (maxTotalExposure == null) {
      maxTotalExposure = 3.0;
    }
    if (maxDrawdownPercent == null) {
      maxDrawdownPercent = 25.0;
    }
    if (rebalanceFrequency == null) {
      rebalanceFrequency = Duration.ofHours(1);
    }
    if (riskLimitPerBot == null) {
      riskLimitPerBot = 0.2;
    }
    if (emergencyStopEnabled == null) {
      emergencyStopEnabled = true;
    }
    if (profitSharing == null) {
      profitSharing = new ProfitSharing(null);
    }
    if (rebalance == null) {
      rebalance = new Rebalance(null, null);
    }
    if (sync == null) {
      sync = new Sync(null, null, null, null, null, null, null);
    }
    if (history == null) {
      history = new History(null);
    }
    if (bot == null) {
      bot = new Bot(null, null, null, null, null, null);
    }
  }

  public record ProfitSharing(
      Boolean enabled
  ) {
    public ProfitSharing {
      if (enabled == null) {
        enabled = true;
      }
    }
  }

  public record Rebalance(
      @PositiveOrZero BigDecimal minAmount,
      @PositiveOrZero Double threshold
  ) {
    public Rebalance {
      if (minAmount == null) {
        minAmount = BigDecimal.TEN;
      }
      if (threshold == null) {
        threshold = 0.1;
      }
    }
  }

  public record Sync(
      Boolean enabled,
      @Min(100) Long heartbeatIntervalMillis,
      @Min(100) Long syncIntervalMillis,
      @Min(1) Long lockTimeoutMillis,
      @Min(1000) Long staleLockMillis,
      @Min(1000) Long maxSyncAgeMillis,
      @Min(1000) Long healthCheckIntervalMillis
  ) {
    public Sync {
      if (enabled == null) {
        enabled = true;
      }
      if (heartbeatIntervalMillis == null) {
        heartbeatIntervalMillis = 30_000L;
      }
      if (syncIntervalMillis == null) {
        syncIntervalMillis = 5_000L;
      }
      if (lockTimeoutMillis == null) {
        lockTimeoutMillis = 5_000L;
      }
      if (staleLockMillis == null) {
        staleLockMillis = 300_000L;
      }
      if (maxSyncAgeMillis == null) {
        maxSyncAgeMillis = 60_000L;
      }
      if (healthCheckIntervalMillis == null) {
        healthCheckIntervalMillis = 60_000L;
      }
    }

    public SyncSettings toSettings() {
      return new SyncSettings(
          Duration.ofMillis(heartbeatIntervalMillis),
          Duration.ofMillis(syncIntervalMillis),
          Duration.ofMillis(lockTimeoutMillis),
          Duration.ofMillis(maxSyncAgeMillis),
          null
      );
    }
  }

  public record History(
      @Min(1) Integer capacity
  ) {
    public History {
      if (capacity == null) {
        capacity = 1000;
      }
    }
  }

  /**
   * The bot hosted by this process.
   */
  public record Bot(
      String id,
      String symbol,
      String category,
      @Positive Double leverage,
      @Positive @DecimalMax("1.0") Double allocationPercentage,
      @PositiveOrZero BigDecimal maxPositionSize
  ) {
    public Bot {
      if (leverage == null) {
        leverage = 1.0;
      }
      if (allocationPercentage == null) {
        allocationPercentage = 0.5;
      }
      if (maxPositionSize == null) {
        maxPositionSize = BigDecimal.ZERO;
      }
    }

    public boolean isConfigured() {
      return id != null && !id.isBlank() && symbol != null && !symbol.isBlank();
    }

    public BotConfig toBotConfig() {
      return new BotConfig(id, symbol, category, leverage, allocationPercentage, maxPositionSize);
    }
  }
}
