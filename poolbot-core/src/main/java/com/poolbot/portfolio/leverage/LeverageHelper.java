package com.poolbot.portfolio.leverage;

import com.poolbot.portfolio.model.Money;
import com.poolbot.portfolio.model.PositionSafety;
import com.poolbot.portfolio.model.RiskLevel;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Pre-trade helpers on top of a {@link LeverageCalculator}: liquidation estimates, safe sizing and
 * a tiered safety assessment.
 */
public class LeverageHelper {

  public static final double DEFAULT_SAFETY_FACTOR = 0.8;

  // Liquidation is assumed when 90% of the initial margin is gone.
  private static final double MAINTENANCE_BUFFER = 0.9;

  private final LeverageCalculator calculator;

  public LeverageHelper(LeverageCalculator calculator) {
    this.calculator = calculator;
  }

  public static double marginPercent(double leverage) {
    if (leverage <= 0) {
      return 1.0;
    }
    return 1.0 / leverage;
  }

  public static double leverageFromMargin(double marginPercent) {
    if (marginPercent <= 0 || marginPercent > 1) {
      return 1.0;
    }
    return 1.0 / marginPercent;
  }

  /**
   * Estimated liquidation price; 0 when the position is not leveraged (L &lt;= 1).
   */
  public BigDecimal liquidationPrice(BigDecimal entryPrice, double leverage, boolean isLong) {
    if (leverage <= 1 || entryPrice == null || entryPrice.signum() <= 0) {
      return BigDecimal.ZERO;
    }
    double move = marginPercent(leverage) * MAINTENANCE_BUFFER;
    return Money.times(entryPrice, isLong ? 1 - move : 1 + move);
  }

  public BigDecimal maxSafePositionSize(BigDecimal availableMargin, double leverage, double safetyFactor) {
    if (safetyFactor <= 0 || safetyFactor > 1) {
      safetyFactor = DEFAULT_SAFETY_FACTOR;
    }
    return Money.times(calculator.maxPositionSize(availableMargin, leverage), safetyFactor);
  }

  public PositionSafety validatePositionSafety(BigDecimal positionValue, BigDecimal entryPrice, double leverage,
                                               BigDecimal availableMargin, boolean isLong) {
    List<String> warnings = new ArrayList<>();
    List<String> errors = new ArrayList<>();

    BigDecimal required = calculator.requiredMargin(positionValue, leverage);
    BigDecimal available = Money.orZero(availableMargin);
    double utilization = Money.ratio(required, available);
    double effective = calculator.effectiveLeverage(positionValue, required);
    BigDecimal liquidation = liquidationPrice(entryPrice, leverage, isLong);
    boolean hasLiquidation = liquidation.signum() > 0;
    double distance = hasLiquidation ? Money.ratio(entryPrice.subtract(liquidation).abs(), entryPrice) : 0.0;

    boolean valid = required.compareTo(available) <= 0;
    if (!valid) {
      errors.add("insufficient margin: required " + required + ", available " + available);
    }

    if (utilization > 0.8) {
      warnings.add(String.format("high margin utilization: %.1f%%", utilization * 100));
    }
    if (effective > 25) {
      warnings.add(String.format("high leverage: %.1fx", effective));
    }
    if (hasLiquidation && distance < 0.15) {
      warnings.add(String.format("liquidation close to entry: %.1f%%", distance * 100));
    }

    RiskLevel level;
    if (!valid) {
      level = RiskLevel.CRITICAL;
    } else if (utilization > 0.9 || effective > 50 || (hasLiquidation && distance < 0.1)) {
      level = RiskLevel.HIGH;
    } else if (utilization > 0.7 || effective > 20 || (hasLiquidation && distance < 0.2)) {
      level = RiskLevel.MEDIUM;
    } else {
      level = RiskLevel.LOW;
    }

    return new PositionSafety(valid, required, available, utilization, effective, liquidation, distance,
        level, warnings, errors);
  }
}
