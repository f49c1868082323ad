package com.poolbot.portfolio.error;

import java.time.Instant;

/**
 * Failure raised by any portfolio operation. Carries a {@link PortfolioErrorCode} and, when the
 * failure concerns a single bot, that bot's id.
 *
 * <p>Message format: {@code CODE [botId]: message}, or {@code CODE: message} without a bot.
 */
public class PortfolioException extends RuntimeException {

  private final PortfolioErrorCode code;
  private final String botId;
  private final Instant timestamp;

  public PortfolioException(PortfolioErrorCode code, String botId, String message) {
    this(code, botId, message, null);
  }

  public PortfolioException(PortfolioErrorCode code, String botId, String message, Throwable cause) {
    super(format(code, botId, message), cause);
    this.code = code;
    this.botId = botId;
    this.timestamp = Instant.now();
  }

  public static PortfolioException of(PortfolioErrorCode code, String message) {
    return new PortfolioException(code, null, message);
  }

  public static PortfolioException forBot(PortfolioErrorCode code, String botId, String message) {
    return new PortfolioException(code, botId, message);
  }

  public static PortfolioException notRegistered(String botId) {
    return new PortfolioException(PortfolioErrorCode.BOT_NOT_REGISTERED, botId, "bot is not registered");
  }

  public static PortfolioException corrupted(String message, Throwable cause) {
    return new PortfolioException(PortfolioErrorCode.STATE_CORRUPTED, null, message, cause);
  }

  public static PortfolioException locked(String message) {
    return new PortfolioException(PortfolioErrorCode.PORTFOLIO_LOCKED, null, message);
  }

  public PortfolioErrorCode code() {
    return code;
  }

  public String botId() {
    return botId;
  }

  public Instant timestamp() {
    return timestamp;
  }

  public boolean is(PortfolioErrorCode other) {
    return code == other;
  }

  private static String format(PortfolioErrorCode code, String botId, String message) {
    if (botId == null || botId.isBlank()) {
      return code + ": " + message;
    }
    return code + " [" + botId + "]: " + message;
  }
}
