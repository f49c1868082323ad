package com.poolbot.portfolio.model;

public enum RiskLevel {
  LOW,
  MEDIUM,
  HIGH,
  CRITICAL
}
