package com.poolbot.portfolio.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public record PortfolioHealth(
    HealthStatus status,
    BigDecimal totalBalance,
    BigDecimal totalExposure,
    double exposurePercent,
    double pnlPercent,
    int activeBots,
    List<String> issues,
    List<String> warnings,
    Instant checkedAt
) {

  public PortfolioHealth {
    issues = issues == null ? List.of() : List.copyOf(issues);
    warnings = warnings == null ? List.of() : List.copyOf(warnings);
  }

  public boolean isHealthy() {
    return status == HealthStatus.HEALTHY;
  }
}
