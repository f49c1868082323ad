package com.poolbot.portfolio.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * USD arithmetic helpers shared by the ledger components.
 */
public final class Money {

  public static final int SCALE = 8;

  /** Tolerance used by the pool invariant (sum of allocations vs. total balance). */
  public static final BigDecimal EPSILON = new BigDecimal("0.01");

  private Money() {
  }

  public static BigDecimal orZero(BigDecimal value) {
    return value == null ? BigDecimal.ZERO : value;
  }

  public static BigDecimal divide(BigDecimal numerator, BigDecimal denominator) {
    return numerator.divide(denominator, SCALE, RoundingMode.HALF_UP);
  }

  public static BigDecimal times(BigDecimal amount, double factor) {
    return amount.multiply(BigDecimal.valueOf(factor)).setScale(SCALE, RoundingMode.HALF_UP);
  }

  /**
   * Ratio of two amounts as a double; 0 when the denominator is not positive.
   */
  public static double ratio(BigDecimal numerator, BigDecimal denominator) {
    if (denominator == null || denominator.signum() <= 0) {
      return 0.0;
    }
    return divide(orZero(numerator), denominator).doubleValue();
  }

  public static boolean isPositive(BigDecimal value) {
    return value != null && value.signum() > 0;
  }
}
