package com.poolbot.portfolio.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * @param weightedLeverage    position-weighted average leverage
 * @param concentrationRisk   largest single-bot exposure divided by total exposure
 * @param marginUtilization   margin in use divided by allocated capital
 * @param drawdownFromPeak    fraction lost from the portfolio's high-water mark
 */
public record RiskMetrics(
    BigDecimal totalExposure,
    Map<String, BigDecimal> exposureBySymbol,
    double weightedLeverage,
    double concentrationRisk,
    double marginUtilization,
    BigDecimal peakValue,
    BigDecimal currentValue,
    double drawdownFromPeak
) {

  public RiskMetrics {
    exposureBySymbol = exposureBySymbol == null ? Map.of() : Map.copyOf(exposureBySymbol);
  }
}
