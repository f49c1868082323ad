package com.poolbot.portfolio.store;

import com.poolbot.portfolio.model.PortfolioState;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Durable home of the shared {@link PortfolioState} plus the advisory lock that serializes writers
 * across processes.
 */
public interface StateStore {

  /**
   * Persist {@code state} atomically: readers see either the previous document or this one.
   *
   * @return the document as written, stamped with write time and lock holder
   */
  PortfolioState save(PortfolioState state);

  /**
   * @throws com.poolbot.portfolio.error.PortfolioException with {@code STATE_CORRUPTED} when the
   *     document is missing, unreadable or fails validation
   */
  PortfolioState load();

  boolean exists();

  /**
   * Take the advisory lock or fail fast with {@code PORTFOLIO_LOCKED}.
   */
  void lock();

  /**
   * Take the advisory lock, waiting at most {@code timeout}.
   */
  void lock(Duration timeout);

  void unlock();

  boolean isLocked();

  Path backupState();

  void restoreFromBackup(Path backup);

  StateFileInfo describe();
}
