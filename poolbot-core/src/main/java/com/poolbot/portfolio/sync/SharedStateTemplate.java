package com.poolbot.portfolio.sync;

import com.poolbot.portfolio.allocation.AllocationManager;
import com.poolbot.portfolio.allocation.LedgerCheckpoint;
import com.poolbot.portfolio.model.PortfolioConfig;
import com.poolbot.portfolio.model.PortfolioState;
import com.poolbot.portfolio.store.StateStore;
import com.poolbot.portfolio.store.StateValidator;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs ledger mutations against the shared document:
 * lock, load, validate, merge, mutate, save, unlock.
 *
 * A mutation whose result cannot be saved is rolled back from a checkpoint taken after the merge.
 */
@Slf4j
public class SharedStateTemplate {

  private final StateStore store;
  private final AllocationManager ledger;
  private final Supplier<PortfolioConfig> settings;
  private final Duration lockTimeout;

  public SharedStateTemplate(StateStore store, AllocationManager ledger, Supplier<PortfolioConfig> settings,
                             Duration lockTimeout) {
    this.store = store;
    this.ledger = ledger;
    this.settings = settings;
    this.lockTimeout = lockTimeout;
  }

  /**
   * Pull the shared document into the ledger without writing it back.
   *
   * @return number of local allocations replaced or dropped by the merge
   */
  public int refresh(String selfBotId) {
    store.lock(lockTimeout);
    try {
      return mergeFromStore(selfBotId);
    } finally {
      store.unlock();
    }
  }

  public <T> T execute(String selfBotId, Supplier<T> mutation) {
    store.lock(lockTimeout);
    try {
      mergeFromStore(selfBotId);
      LedgerCheckpoint checkpoint = ledger.checkpoint();
      T result = mutation.get();
      try {
        store.save(ledger.snapshot(settings.get()));
      } catch (RuntimeException e) {
        ledger.rollback(checkpoint);
        throw e;
      }
      return result;
    } finally {
      store.unlock();
    }
  }

  /**
   * Merge the shared document and write the result back.
   *
   * @return the document as written
   */
  public PortfolioState persist(String selfBotId) {
    store.lock(lockTimeout);
    try {
      mergeFromStore(selfBotId);
      return store.save(ledger.snapshot(settings.get()));
    } finally {
      store.unlock();
    }
  }

  public Duration lockTimeout() {
    return lockTimeout;
  }

  private int mergeFromStore(String selfBotId) {
    if (!store.exists()) {
      return 0;
    }
    PortfolioState remote = store.load();
    StateValidator.validateIntegrity(remote);
    int changed = ledger.merge(remote, selfBotId);
    if (changed > 0) {
      log.debug("Merged shared state: {} local allocations changed", changed);
    }
    return changed;
  }
}
