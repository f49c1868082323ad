package com.poolbot.portfolio.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How realized profit is redistributed across the pool when profit sharing is requested.
 */
public enum AllocationStrategy {

  EQUAL_WEIGHT("equal_weight", "Split shared profit evenly across all allocated bots"),
  PERFORMANCE_BASED("performance_based", "Split shared profit pro-rata to positive realized PnL"),
  CUSTOM("custom", "No automatic redistribution");

  private final String id;
  private final String description;

  AllocationStrategy(String id, String description) {
    this.id = id;
    this.description = description;
  }

  @JsonValue
  public String getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  @JsonCreator
  public static AllocationStrategy fromId(String id) {
    if (id == null) {
      throw new IllegalArgumentException("Allocation strategy is required");
    }
    String normalized = id.trim().toLowerCase().replace('-', '_');
    for (AllocationStrategy strategy : values()) {
      if (strategy.id.equals(normalized) || strategy.name().equalsIgnoreCase(normalized)) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("Unknown allocation strategy: " + id);
  }
}
