package com.poolbot.portfolio.leverage;

import java.math.BigDecimal;

/**
 * Margin and position-size arithmetic for leveraged positions.
 */
public interface LeverageCalculator {

  /**
   * Margin needed to hold {@code positionValue} at {@code leverage}. Leverage is clamped to the
   * calculator's bounds; a non-positive leverage means the full notional.
   */
  BigDecimal requiredMargin(BigDecimal positionValue, double leverage);

  /**
   * Largest notional {@code availableMargin} can carry at {@code leverage}; 0 for non-positive inputs.
   */
  BigDecimal maxPositionSize(BigDecimal availableMargin, double leverage);

  /**
   * @throws com.poolbot.portfolio.error.PortfolioException with {@code INVALID_LEVERAGE} when the
   *     leverage is not positive or falls outside the supported bounds
   */
  void validateLeverage(double leverage);

  /**
   * Notional over margin; 1.0 when no margin is in use.
   */
  double effectiveLeverage(BigDecimal positionValue, BigDecimal marginUsed);

  double minLeverage();

  double maxLeverage();
}
