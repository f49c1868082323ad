package com.poolbot.portfolio.model;

import com.poolbot.portfolio.config.PortfolioProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Pool-wide policy. A snapshot is persisted with every state document as its global settings.
 *
 * @param maxTotalExposure   maximum total position notional as a multiple of the total balance
 * @param maxDrawdownPercent drawdown, in percent, beyond which the emergency stop trips
 * @param riskLimitPerBot    tolerated unrealized loss per bot as a fraction of its allocation
 */
public record PortfolioConfig(
    BigDecimal totalBalance,
    AllocationStrategy allocationStrategy,
    String sharedStateFile,
    double maxTotalExposure,
    double maxDrawdownPercent,
    Duration rebalanceFrequency,
    double riskLimitPerBot,
    boolean emergencyStopEnabled,
    boolean profitSharingEnabled
) {

  public static final double DEFAULT_MAX_TOTAL_EXPOSURE = 3.0;
  public static final double EXPOSURE_CEILING = 10.0;

  public PortfolioConfig {
    if (allocationStrategy == null) {
      allocationStrategy = AllocationStrategy.EQUAL_WEIGHT;
    }
    if (sharedStateFile == null || sharedStateFile.isBlank()) {
      sharedStateFile = "portfolio_state.json";
    }
    if (rebalanceFrequency == null) {
      rebalanceFrequency = Duration.ofHours(1);
    }
  }

  public static PortfolioConfig defaults() {
    return new PortfolioConfig(
        new BigDecimal("1000"),
        AllocationStrategy.EQUAL_WEIGHT,
        "portfolio_state.json",
        DEFAULT_MAX_TOTAL_EXPOSURE,
        25.0,
        Duration.ofHours(1),
        0.2,
        true,
        true
    );
  }

  public static PortfolioConfig from(PortfolioProperties properties) {
    return new PortfolioConfig(
        properties.totalBalance(),
        AllocationStrategy.fromId(properties.allocationStrategy()),
        properties.stateFile(),
        properties.maxTotalExposure(),
        properties.maxDrawdownPercent(),
        properties.rebalanceFrequency(),
        properties.riskLimitPerBot(),
        properties.emergencyStopEnabled(),
        properties.profitSharing().enabled()
    );
  }

  /**
   * Copy with an out-of-range exposure limit (not in (0, 10]) reset to the default.
   */
  public PortfolioConfig normalized() {
    if (maxTotalExposure > 0 && maxTotalExposure <= EXPOSURE_CEILING) {
      return this;
    }
    return new PortfolioConfig(totalBalance, allocationStrategy, sharedStateFile, DEFAULT_MAX_TOTAL_EXPOSURE,
        maxDrawdownPercent, rebalanceFrequency, riskLimitPerBot, emergencyStopEnabled, profitSharingEnabled);
  }
}
