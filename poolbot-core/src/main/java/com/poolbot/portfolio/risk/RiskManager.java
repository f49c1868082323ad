package com.poolbot.portfolio.risk;

import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.PortfolioSummary;
import com.poolbot.portfolio.model.RiskMetrics;

import java.math.BigDecimal;
import java.util.Collection;

/**
 * Stateless policy checks applied before and after ledger mutations.
 */
public interface RiskManager {

  void validateNewPosition(String botId, BigDecimal positionValue, double leverage);

  boolean isWithinRiskLimits(BigDecimal totalExposure, BigDecimal availableBalance);

  /**
   * Validate a replacement position and the pool exposure it would leave behind.
   *
   * @throws com.poolbot.portfolio.error.PortfolioException with {@code INVALID_LEVERAGE} for bad
   *     leverage, or {@code EXCEEDS_RISK_LIMIT} when {@code projectedExposure} breaches the limit
   */
  void checkPositionChange(String botId, BigDecimal positionValue, double leverage,
                           BigDecimal projectedExposure, BigDecimal totalBalance);

  /**
   * @throws com.poolbot.portfolio.error.PortfolioException with {@code EXCEEDS_RISK_LIMIT} when the
   *     exposure limit is breached or the emergency stop trips on drawdown
   */
  void checkPortfolioLimits(PortfolioSummary summary);

  /**
   * Aggregates exposure, leverage and concentration over {@code allocations}. Drawdown is measured
   * from {@code peakValue}, or from {@code portfolioValue} itself when no higher peak is known.
   */
  RiskMetrics riskMetrics(Collection<BotAllocation> allocations, BigDecimal portfolioValue, BigDecimal peakValue);
}
