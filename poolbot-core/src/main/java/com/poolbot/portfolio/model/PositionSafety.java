package com.poolbot.portfolio.model;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of a pre-trade safety assessment.
 *
 * @param distanceToLiquidation relative distance between entry and liquidation price; 0 when the
 *                              position has no liquidation price (leverage of 1 or less)
 */
public record PositionSafety(
    boolean valid,
    BigDecimal requiredMargin,
    BigDecimal availableMargin,
    double marginUtilization,
    double effectiveLeverage,
    BigDecimal liquidationPrice,
    double distanceToLiquidation,
    RiskLevel riskLevel,
    List<String> warnings,
    List<String> errors
) {

  public PositionSafety {
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
    errors = errors == null ? List.of() : List.copyOf(errors);
  }
}
