package com.poolbot.portfolio.error;

/**
 * Closed set of failure kinds raised by the portfolio layer.
 */
public enum PortfolioErrorCode {
  INSUFFICIENT_BALANCE,
  INSUFFICIENT_MARGIN,
  EXCEEDS_ALLOCATION,
  EXCEEDS_RISK_LIMIT,
  BOT_NOT_REGISTERED,
  BOT_ALREADY_REGISTERED,
  INVALID_LEVERAGE,
  PORTFOLIO_LOCKED,
  STATE_CORRUPTED,
  CONFIGURATION_INVALID
}
