package com.poolbot.portfolio.risk;

import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.leverage.LeverageCalculator;
import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.Money;
import com.poolbot.portfolio.model.PortfolioConfig;
import com.poolbot.portfolio.model.PortfolioSummary;
import com.poolbot.portfolio.model.RiskMetrics;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.TreeMap;

@Slf4j
public class BasicRiskManager implements RiskManager {

  private final PortfolioConfig config;
  private final LeverageCalculator calculator;

  public BasicRiskManager(PortfolioConfig config, LeverageCalculator calculator) {
    this.config = config;
    this.calculator = calculator;
  }

  @Override
  public void validateNewPosition(String botId, BigDecimal positionValue, double leverage) {
    if (positionValue == null || positionValue.signum() <= 0) {
      throw PortfolioException.forBot(PortfolioErrorCode.CONFIGURATION_INVALID, botId,
          "position value must be positive");
    }
    if (!(leverage > 0)) {
      throw PortfolioException.forBot(PortfolioErrorCode.INVALID_LEVERAGE, botId,
          "leverage must be positive, got " + leverage);
    }
    if (leverage > calculator.maxLeverage()) {
      throw PortfolioException.forBot(PortfolioErrorCode.INVALID_LEVERAGE, botId,
          "leverage " + leverage + " exceeds maximum " + calculator.maxLeverage());
    }
  }

  @Override
  public void checkPositionChange(String botId, BigDecimal positionValue, double leverage,
                                  BigDecimal projectedExposure, BigDecimal totalBalance) {
    validateNewPosition(botId, positionValue, leverage);
    if (!isWithinRiskLimits(projectedExposure, totalBalance)) {
      throw PortfolioException.forBot(PortfolioErrorCode.EXCEEDS_RISK_LIMIT, botId,
          String.format("total exposure %s would exceed %.1fx of %s", projectedExposure.toPlainString(),
              config.maxTotalExposure(), totalBalance.toPlainString()));
    }
  }

  @Override
  public boolean isWithinRiskLimits(BigDecimal totalExposure, BigDecimal availableBalance) {
    if (availableBalance == null || availableBalance.signum() <= 0) {
      return false;
    }
    return Money.ratio(totalExposure, availableBalance) <= config.maxTotalExposure();
  }

  @Override
  public void checkPortfolioLimits(PortfolioSummary summary) {
    double exposure = summary.exposureRatio();
    if (exposure > config.maxTotalExposure()) {
      throw PortfolioException.of(PortfolioErrorCode.EXCEEDS_RISK_LIMIT,
          String.format("total exposure %.2fx exceeds limit %.2fx", exposure, config.maxTotalExposure()));
    }
    if (config.emergencyStopEnabled() && -summary.pnlPercent() > config.maxDrawdownPercent()) {
      log.warn("Emergency stop: drawdown {}% exceeds {}%",
          String.format("%.2f", -summary.pnlPercent()), config.maxDrawdownPercent());
      throw PortfolioException.of(PortfolioErrorCode.EXCEEDS_RISK_LIMIT,
          String.format("drawdown %.2f%% exceeds emergency stop at %.2f%%",
              -summary.pnlPercent(), config.maxDrawdownPercent()));
    }
  }

  @Override
  public RiskMetrics riskMetrics(Collection<BotAllocation> allocations, BigDecimal portfolioValue, BigDecimal peakValue) {
    BigDecimal totalExposure = BigDecimal.ZERO;
    BigDecimal totalMargin = BigDecimal.ZERO;
    BigDecimal totalAllocated = BigDecimal.ZERO;
    BigDecimal largest = BigDecimal.ZERO;
    BigDecimal leverageWeighted = BigDecimal.ZERO;
    Map<String, BigDecimal> bySymbol = new TreeMap<>();

    for (BotAllocation allocation : allocations) {
      BigDecimal position = allocation.currentPosition();
      totalExposure = totalExposure.add(position);
      totalMargin = totalMargin.add(allocation.positionMarginUsed());
      totalAllocated = totalAllocated.add(allocation.allocatedBalance());
      leverageWeighted = leverageWeighted.add(Money.times(position, allocation.leverage()));
      if (position.compareTo(largest) > 0) {
        largest = position;
      }
      if (allocation.symbol() != null) {
        bySymbol.merge(allocation.symbol(), position, BigDecimal::add);
      }
    }

    BigDecimal current = Money.orZero(portfolioValue);
    BigDecimal peak = peakValue == null || peakValue.compareTo(current) < 0 ? current : peakValue;
    double drawdown = peak.signum() > 0 ? Money.ratio(peak.subtract(current), peak) : 0.0;

    return new RiskMetrics(
        totalExposure,
        bySymbol,
        totalExposure.signum() > 0 ? Money.ratio(leverageWeighted, totalExposure) : 0.0,
        Money.ratio(largest, totalExposure),
        Money.ratio(totalMargin, totalAllocated),
        peak,
        current,
        drawdown
    );
  }
}
