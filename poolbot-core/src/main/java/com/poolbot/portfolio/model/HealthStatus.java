package com.poolbot.portfolio.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum HealthStatus {
  HEALTHY,
  WARNING,
  CRITICAL;

  @JsonValue
  public String id() {
    return name().toLowerCase();
  }

  public HealthStatus escalate(HealthStatus other) {
    return other.ordinal() > ordinal() ? other : this;
  }
}
