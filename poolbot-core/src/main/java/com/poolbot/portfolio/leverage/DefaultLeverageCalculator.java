package com.poolbot.portfolio.leverage;

import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.model.Money;

import java.math.BigDecimal;

public class DefaultLeverageCalculator implements LeverageCalculator {

  public static final double DEFAULT_MIN_LEVERAGE = 1.0;
  public static final double DEFAULT_MAX_LEVERAGE = 125.0;

  private final double minLeverage;
  private final double maxLeverage;

  public DefaultLeverageCalculator() {
    this(DEFAULT_MIN_LEVERAGE, DEFAULT_MAX_LEVERAGE);
  }

  public DefaultLeverageCalculator(double minLeverage, double maxLeverage) {
    if (minLeverage <= 0 || maxLeverage < minLeverage) {
      throw new IllegalArgumentException("Invalid leverage bounds: [" + minLeverage + ", " + maxLeverage + "]");
    }
    this.minLeverage = minLeverage;
    this.maxLeverage = maxLeverage;
  }

  @Override
  public BigDecimal requiredMargin(BigDecimal positionValue, double leverage) {
    if (positionValue == null || positionValue.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    if (leverage <= 0) {
      return positionValue;
    }
    return Money.divide(positionValue, BigDecimal.valueOf(clamp(leverage)));
  }

  @Override
  public BigDecimal maxPositionSize(BigDecimal availableMargin, double leverage) {
    if (availableMargin == null || availableMargin.signum() <= 0 || leverage <= 0) {
      return BigDecimal.ZERO;
    }
    return Money.times(availableMargin, clamp(leverage));
  }

  @Override
  public void validateLeverage(double leverage) {
    if (leverage <= 0) {
      throw PortfolioException.of(PortfolioErrorCode.INVALID_LEVERAGE, "leverage must be positive, got " + leverage);
    }
    if (leverage < minLeverage || leverage > maxLeverage) {
      throw PortfolioException.of(PortfolioErrorCode.INVALID_LEVERAGE,
          "leverage " + leverage + " outside [" + minLeverage + ", " + maxLeverage + "]");
    }
  }

  @Override
  public double effectiveLeverage(BigDecimal positionValue, BigDecimal marginUsed) {
    if (marginUsed == null || marginUsed.signum() <= 0) {
      return 1.0;
    }
    return Money.ratio(positionValue, marginUsed);
  }

  @Override
  public double minLeverage() {
    return minLeverage;
  }

  @Override
  public double maxLeverage() {
    return maxLeverage;
  }

  private double clamp(double leverage) {
    return Math.max(minLeverage, Math.min(maxLeverage, leverage));
  }
}
