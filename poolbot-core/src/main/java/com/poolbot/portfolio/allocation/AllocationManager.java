package com.poolbot.portfolio.allocation;

import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.leverage.LeverageCalculator;
import com.poolbot.portfolio.model.AllocationEvent;
import com.poolbot.portfolio.model.AllocationEventType;
import com.poolbot.portfolio.model.AllocationStrategy;
import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.model.BotConfig;
import com.poolbot.portfolio.model.Money;
import com.poolbot.portfolio.model.PortfolioConfig;
import com.poolbot.portfolio.model.PortfolioState;
import com.poolbot.portfolio.model.PortfolioSummary;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory ledger of the shared capital pool.
 *
 * Owns:
 * - the total balance and cumulative profit
 * - one {@link BotAllocation} per registered bot
 * - a bounded audit history of every mutation
 *
 * Every mutation validates first and applies only when all checks pass. Readers get immutable
 * copies. The pool invariant {@code sum(allocated) <= totalBalance} holds after every operation.
 */
@Slf4j
public class AllocationManager {

  public static final int DEFAULT_HISTORY_CAPACITY = 1000;
  public static final String SYSTEM_BOT_ID = "SYSTEM";

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, BotAllocation> allocations = new LinkedHashMap<>();
  private final Deque<AllocationEvent> history = new ArrayDeque<>();

  private final AllocationStrategy strategy;
  private final ProfitDistribution distribution;
  private final RebalanceConfig rebalanceConfig;
  private final LeverageCalculator calculator;
  private final Clock clock;
  private final int historyCapacity;

  private BigDecimal totalBalance;
  private BigDecimal totalProfit = BigDecimal.ZERO;
  private Instant lastRebalance;

  public AllocationManager(
      BigDecimal totalBalance,
      AllocationStrategy strategy,
      RebalanceConfig rebalanceConfig,
      LeverageCalculator calculator,
      Clock clock,
      int historyCapacity
  ) {
    if (!Money.isPositive(totalBalance)) {
      throw PortfolioException.of(PortfolioErrorCode.CONFIGURATION_INVALID, "total balance must be positive");
    }
    this.totalBalance = totalBalance;
    this.strategy = strategy == null ? AllocationStrategy.EQUAL_WEIGHT : strategy;
    this.distribution = ProfitDistribution.forStrategy(this.strategy);
    this.rebalanceConfig = rebalanceConfig == null ? RebalanceConfig.defaults() : rebalanceConfig;
    this.calculator = calculator;
    this.clock = clock;
    this.historyCapacity = historyCapacity > 0 ? historyCapacity : DEFAULT_HISTORY_CAPACITY;
    this.lastRebalance = clock.instant();
  }

  /**
   * Carve {@code allocationPercentage} of the total balance out for a new bot.
   */
  public BotAllocation allocateToBot(BotConfig config) {
    String botId = config.botId();
    if (botId == null || botId.isBlank()) {
      throw PortfolioException.of(PortfolioErrorCode.CONFIGURATION_INVALID, "bot id is required");
    }
    if (config.symbol() == null || config.symbol().isBlank()) {
      throw PortfolioException.forBot(PortfolioErrorCode.CONFIGURATION_INVALID, botId, "symbol is required");
    }
    if (config.leverage() <= 0 || config.leverage() > calculator.maxLeverage()) {
      throw PortfolioException.forBot(PortfolioErrorCode.INVALID_LEVERAGE, botId,
          "leverage must be in (0, " + calculator.maxLeverage() + "], got " + config.leverage());
    }
    double percentage = config.allocationPercentage();
    if (!(percentage > 0 && percentage <= 1)) {
      throw PortfolioException.forBot(PortfolioErrorCode.CONFIGURATION_INVALID, botId,
          "allocation percentage must be in (0, 1], got " + percentage);
    }

    lock.writeLock().lock();
    try {
      if (allocations.containsKey(botId)) {
        throw PortfolioException.forBot(PortfolioErrorCode.BOT_ALREADY_REGISTERED, botId, "bot already has an allocation");
      }
      BigDecimal amount = Money.times(totalBalance, percentage);
      BigDecimal allocated = totalAllocated();
      if (allocated.add(amount).compareTo(totalBalance) > 0) {
        throw PortfolioException.forBot(PortfolioErrorCode.EXCEEDS_ALLOCATION, botId,
            String.format("requested %s but only %s of %s is unallocated",
                amount.toPlainString(), totalBalance.subtract(allocated).toPlainString(), totalBalance.toPlainString()));
      }

      Instant now = clock.instant();
      BotAllocation allocation = BotAllocation.open(config, amount, now);
      allocations.put(botId, allocation);
      record(now, AllocationEventType.ALLOCATE, botId, amount,
          String.format("allocated %.1f%% of pool to %s", percentage * 100, config.symbol()), null, allocations);
      log.info("Allocated ${} ({}%) to bot {} trading {} at {}x",
          amount.toPlainString(), percentage * 100, botId, config.symbol(), config.leverage());
      return allocation;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Return a bot's capital to the pool. Refused while the bot holds a position.
   */
  public BotAllocation deallocateFromBot(String botId) {
    lock.writeLock().lock();
    try {
      BotAllocation existing = require(botId);
      if (existing.hasOpenPosition()) {
        throw PortfolioException.forBot(PortfolioErrorCode.CONFIGURATION_INVALID, botId,
            "cannot deallocate with open position " + existing.currentPosition().toPlainString());
      }
      allocations.remove(botId);
      record(clock.instant(), AllocationEventType.DEALLOCATE, botId, existing.allocatedBalance(),
          "allocation returned to pool", null, allocations);
      log.info("Deallocated ${} from bot {}", existing.allocatedBalance().toPlainString(), botId);
      return existing;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Replace a bot's position. Margin in use becomes {@code requiredMargin(positionValue, leverage)}
   * and must fit inside the bot's allocation.
   */
  public BotAllocation updateBotPosition(String botId, BigDecimal positionValue, BigDecimal averagePrice, double leverage) {
    if (positionValue == null || positionValue.signum() < 0) {
      throw PortfolioException.forBot(PortfolioErrorCode.CONFIGURATION_INVALID, botId, "position value must not be negative");
    }
    if (!(leverage >= calculator.minLeverage() && leverage <= calculator.maxLeverage())) {
      throw PortfolioException.forBot(PortfolioErrorCode.INVALID_LEVERAGE, botId,
          "leverage must be in [" + calculator.minLeverage() + ", " + calculator.maxLeverage() + "], got " + leverage);
    }
    lock.writeLock().lock();
    try {
      BotAllocation existing = require(botId);
      BigDecimal margin = calculator.requiredMargin(positionValue, leverage);
      if (margin.compareTo(existing.allocatedBalance()) > 0) {
        throw PortfolioException.forBot(PortfolioErrorCode.EXCEEDS_ALLOCATION, botId,
            String.format("position %s at %.1fx needs margin %s but allocation is %s",
                positionValue.toPlainString(), leverage, margin.toPlainString(),
                existing.allocatedBalance().toPlainString()));
      }
      Instant now = clock.instant();
      BotAllocation updated = existing.withPosition(positionValue, Money.orZero(averagePrice), leverage, margin, now);
      allocations.put(botId, updated);
      record(now, AllocationEventType.POSITION_UPDATE, botId, positionValue,
          String.format("position %s @ %s, %.1fx, margin %s",
              positionValue.toPlainString(), Money.orZero(averagePrice).toPlainString(), leverage, margin.toPlainString()));
      log.debug("Bot {} position {} margin {}", botId, positionValue, margin);
      return updated;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Total exposure of the pool if {@code botId}'s position were replaced by {@code positionValue}.
   */
  public BigDecimal projectedExposure(String botId, BigDecimal positionValue) {
    lock.readLock().lock();
    try {
      require(botId);
      BigDecimal exposure = Money.orZero(positionValue);
      for (BotAllocation allocation : allocations.values()) {
        if (!allocation.botId().equals(botId)) {
          exposure = exposure.add(allocation.currentPosition());
        }
      }
      return exposure;
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Flatten a bot's position and release its margin.
   */
  public BotAllocation closePosition(String botId) {
    lock.writeLock().lock();
    try {
      BotAllocation existing = require(botId);
      Instant now = clock.instant();
      BotAllocation closed = existing.withPosition(BigDecimal.ZERO, BigDecimal.ZERO, existing.leverage(), BigDecimal.ZERO, now);
      allocations.put(botId, closed);
      record(now, AllocationEventType.POSITION_UPDATE, botId, BigDecimal.ZERO,
          "position closed, released margin " + existing.positionMarginUsed().toPlainString());
      return closed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public BotAllocation updateUnrealizedPnl(String botId, BigDecimal unrealizedPnl) {
    lock.writeLock().lock();
    try {
      BotAllocation updated = require(botId).withUnrealizedPnl(Money.orZero(unrealizedPnl), clock.instant());
      allocations.put(botId, updated);
      return updated;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Set a bot's allocation to an absolute amount. Its target share of the pool follows the new amount.
   */
  public BotAllocation resizeAllocation(String botId, BigDecimal newAllocated) {
    if (!Money.isPositive(newAllocated)) {
      throw PortfolioException.forBot(PortfolioErrorCode.CONFIGURATION_INVALID, botId, "allocation must be positive");
    }
    lock.writeLock().lock();
    try {
      BotAllocation existing = require(botId);
      if (newAllocated.compareTo(existing.usedBalance()) < 0) {
        throw PortfolioException.forBot(PortfolioErrorCode.INSUFFICIENT_MARGIN, botId,
            "allocation " + newAllocated.toPlainString() + " is below margin in use " + existing.usedBalance().toPlainString());
      }
      BigDecimal others = totalAllocated().subtract(existing.allocatedBalance());
      if (others.add(newAllocated).compareTo(totalBalance) > 0) {
        throw PortfolioException.forBot(PortfolioErrorCode.EXCEEDS_ALLOCATION, botId,
            "only " + totalBalance.subtract(others).toPlainString() + " is available for this bot");
      }
      Instant now = clock.instant();
      BotAllocation resized = existing.withTarget(newAllocated, Money.ratio(newAllocated, totalBalance), now);
      allocations.put(botId, resized);
      record(now, AllocationEventType.ALLOCATE, botId, newAllocated.subtract(existing.allocatedBalance()),
          "allocation resized from " + existing.allocatedBalance().toPlainString() + " to " + newAllocated.toPlainString());
      return resized;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Book realized profit (or loss) against a bot. When {@code shareProfit} is set and the profit is
   * positive, the configured {@link ProfitDistribution} grows the pool and spreads the profit across
   * allocations.
   */
  public BotAllocation recordProfit(String botId, BigDecimal profit, boolean shareProfit) {
    lock.writeLock().lock();
    try {
      Instant now = clock.instant();
      BotAllocation updated = require(botId).withRealizedProfit(profit, now);
      allocations.put(botId, updated);
      totalProfit = totalProfit.add(profit);
      record(now, AllocationEventType.PROFIT_RECORD, botId, profit,
          "realized " + profit.toPlainString() + ", bot total " + updated.realizedPnl().toPlainString());

      if (shareProfit && profit.signum() > 0) {
        redistribute(botId, profit, now);
      }
      return allocations.get(botId);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public RebalanceCheck checkRebalanceNeeded() {
    lock.readLock().lock();
    try {
      if (Duration.between(lastRebalance, clock.instant()).compareTo(rebalanceConfig.rebalanceInterval()) < 0) {
        return RebalanceCheck.notNeeded();
      }
      List<String> reasons = new ArrayList<>();
      for (BotAllocation allocation : allocations.values()) {
        double current = Money.ratio(allocation.allocatedBalance(), totalBalance);
        double deviation = Math.abs(current - allocation.allocationPercentage());
        if (deviation > rebalanceConfig.rebalanceThreshold()) {
          reasons.add(String.format("bot %s drift: %.1f%% vs target %.1f%%",
              allocation.botId(), current * 100, allocation.allocationPercentage() * 100));
        }
      }
      return new RebalanceCheck(!reasons.isEmpty(), reasons);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Move every bot whose drift exceeds the minimum amount back to its target share. A bot is never
   * shrunk below its margin in use.
   *
   * @return number of adjusted bots; 0 leaves the ledger and the last-rebalance time untouched
   */
  public int executeRebalance() {
    lock.writeLock().lock();
    try {
      Instant now = clock.instant();
      Map<String, BotAllocation> adjusted = new LinkedHashMap<>(allocations);
      int actions = 0;
      for (BotAllocation allocation : allocations.values()) {
        BigDecimal target = Money.times(totalBalance, allocation.allocationPercentage());
        BigDecimal difference = target.subtract(allocation.allocatedBalance());
        if (difference.abs().compareTo(rebalanceConfig.minRebalanceAmount()) > 0) {
          BigDecimal next = target.max(allocation.usedBalance());
          adjusted.put(allocation.botId(), allocation.withAllocated(next, now));
          actions++;
        }
      }
      if (actions == 0) {
        return 0;
      }

      BigDecimal sum = adjusted.values().stream()
          .map(BotAllocation::allocatedBalance)
          .reduce(BigDecimal.ZERO, BigDecimal::add);
      if (sum.compareTo(totalBalance.add(Money.EPSILON)) > 0) {
        throw PortfolioException.forBot(PortfolioErrorCode.EXCEEDS_ALLOCATION, SYSTEM_BOT_ID,
            "rebalanced allocations " + sum.toPlainString() + " would exceed pool " + totalBalance.toPlainString());
      }

      Map<String, BotAllocation> before = new LinkedHashMap<>(allocations);
      allocations.clear();
      allocations.putAll(adjusted);
      lastRebalance = now;
      record(now, AllocationEventType.REBALANCE, SYSTEM_BOT_ID, BigDecimal.ZERO,
          "portfolio rebalanced: " + actions + " adjustments", before, allocations);
      log.info("Rebalanced portfolio: {} adjustments", actions);
      return actions;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public BotAllocation getAllocation(String botId) {
    lock.readLock().lock();
    try {
      return require(botId);
    } finally {
      lock.readLock().unlock();
    }
  }

  public Optional<BotAllocation> findAllocation(String botId) {
    lock.readLock().lock();
    try {
      return Optional.ofNullable(allocations.get(botId));
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean isAllocated(String botId) {
    return findAllocation(botId).isPresent();
  }

  public Map<String, BotAllocation> getAllAllocations() {
    lock.readLock().lock();
    try {
      return Collections.unmodifiableMap(new LinkedHashMap<>(allocations));
    } finally {
      lock.readLock().unlock();
    }
  }

  public BigDecimal getTotalBalance() {
    lock.readLock().lock();
    try {
      return totalBalance;
    } finally {
      lock.readLock().unlock();
    }
  }

  public BigDecimal getTotalProfit() {
    lock.readLock().lock();
    try {
      return totalProfit;
    } finally {
      lock.readLock().unlock();
    }
  }

  public Instant getLastRebalance() {
    lock.readLock().lock();
    try {
      return lastRebalance;
    } finally {
      lock.readLock().unlock();
    }
  }

  public AllocationStrategy getStrategy() {
    return strategy;
  }

  public PortfolioSummary getPortfolioSummary() {
    lock.readLock().lock();
    try {
      BigDecimal allocated = BigDecimal.ZERO;
      BigDecimal used = BigDecimal.ZERO;
      BigDecimal available = BigDecimal.ZERO;
      BigDecimal exposure = BigDecimal.ZERO;
      BigDecimal unrealized = BigDecimal.ZERO;
      for (BotAllocation allocation : allocations.values()) {
        allocated = allocated.add(allocation.allocatedBalance());
        used = used.add(allocation.usedBalance());
        available = available.add(allocation.availableBalance());
        exposure = exposure.add(allocation.currentPosition());
        unrealized = unrealized.add(allocation.unrealizedPnl());
      }
      return new PortfolioSummary(
          totalBalance,
          allocated,
          used,
          available,
          totalBalance.subtract(allocated),
          exposure,
          totalProfit,
          unrealized,
          Money.ratio(used, allocated) * 100,
          Money.ratio(allocated, totalBalance) * 100,
          Money.ratio(totalProfit, totalBalance) * 100,
          allocations.size(),
          lastRebalance,
          history.size()
      );
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Most recent {@code limit} events in chronological order; all events when {@code limit <= 0}.
   */
  public List<AllocationEvent> getAllocationHistory(int limit) {
    lock.readLock().lock();
    try {
      List<AllocationEvent> events = new ArrayList<>(history);
      if (limit > 0 && events.size() > limit) {
        return List.copyOf(events.subList(events.size() - limit, events.size()));
      }
      return List.copyOf(events);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Snapshot of the ledger as a shared-state document. Lock and persistence fields are left to the store.
   */
  public PortfolioState snapshot(PortfolioConfig settings) {
    lock.readLock().lock();
    try {
      return new PortfolioState(totalBalance, totalProfit, clock.instant(), new LinkedHashMap<>(allocations),
          settings, PortfolioState.CURRENT_VERSION, null, null);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Replace the whole ledger with a loaded document.
   */
  public void restore(PortfolioState state) {
    lock.writeLock().lock();
    try {
      totalBalance = state.totalBalance();
      totalProfit = state.totalProfit();
      allocations.clear();
      if (state.allocations() != null) {
        allocations.putAll(state.allocations());
      }
      log.info("Restored ledger: balance ${}, {} allocations", totalBalance.toPlainString(), allocations.size());
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Fold a remote document into the local ledger.
   *
   * Remote totals win. Remote allocations replace local ones, except {@code selfBotId}'s entry, which
   * keeps whichever copy was updated last (remote on ties) and survives when missing remotely.
   * Other local entries missing remotely are dropped.
   *
   * @return number of local entries that changed
   */
  public int merge(PortfolioState remote, String selfBotId) {
    lock.writeLock().lock();
    try {
      Map<String, BotAllocation> remoteAllocations = remote.allocations() == null ? Map.of() : remote.allocations();
      Map<String, BotAllocation> merged = new LinkedHashMap<>();
      int changed = 0;

      for (Map.Entry<String, BotAllocation> entry : remoteAllocations.entrySet()) {
        String botId = entry.getKey();
        BotAllocation remoteAllocation = entry.getValue();
        BotAllocation local = allocations.get(botId);
        BotAllocation chosen = remoteAllocation;
        if (botId.equals(selfBotId) && local != null && isNewer(local, remoteAllocation)) {
          chosen = local;
        }
        if (!Objects.equals(local, chosen)) {
          changed++;
        }
        merged.put(botId, chosen);
      }

      for (Iterator<Map.Entry<String, BotAllocation>> it = allocations.entrySet().iterator(); it.hasNext(); ) {
        Map.Entry<String, BotAllocation> entry = it.next();
        if (merged.containsKey(entry.getKey())) {
          continue;
        }
        if (entry.getKey().equals(selfBotId)) {
          merged.put(entry.getKey(), entry.getValue());
        } else {
          changed++;
        }
      }

      totalBalance = remote.totalBalance();
      totalProfit = remote.totalProfit();
      allocations.clear();
      allocations.putAll(merged);

      BigDecimal sum = totalAllocated();
      if (sum.compareTo(totalBalance.add(Money.EPSILON)) > 0) {
        log.warn("Merged ledger over-allocated: {} of {}", sum.toPlainString(), totalBalance.toPlainString());
      }
      return changed;
    } finally {
      lock.writeLock().unlock();
    }
  }

  public LedgerCheckpoint checkpoint() {
    lock.readLock().lock();
    try {
      return new LedgerCheckpoint(totalBalance, totalProfit, Map.copyOf(allocations), lastRebalance);
    } finally {
      lock.readLock().unlock();
    }
  }

  /**
   * Undo everything since {@code checkpoint}. History is append-only and keeps the undone events.
   */
  public void rollback(LedgerCheckpoint checkpoint) {
    lock.writeLock().lock();
    try {
      totalBalance = checkpoint.totalBalance();
      totalProfit = checkpoint.totalProfit();
      lastRebalance = checkpoint.lastRebalance();
      Map<String, BotAllocation> restored = new LinkedHashMap<>();
      for (String botId : allocations.keySet()) {
        if (checkpoint.allocations().containsKey(botId)) {
          restored.put(botId, checkpoint.allocations().get(botId));
        }
      }
      checkpoint.allocations().forEach(restored::putIfAbsent);
      allocations.clear();
      allocations.putAll(restored);
      log.warn("Ledger rolled back to checkpoint: {} allocations", allocations.size());
    } finally {
      lock.writeLock().unlock();
    }
  }

  private void redistribute(String sourceBotId, BigDecimal profit, Instant now) {
    Map<String, BigDecimal> shares = distribution.shares(allocations.values(), sourceBotId, profit);
    if (shares.isEmpty()) {
      return;
    }
    totalBalance = totalBalance.add(profit);
    shares.forEach((botId, share) -> {
      BotAllocation allocation = allocations.get(botId);
      allocations.put(botId, allocation.withAllocated(allocation.allocatedBalance().add(share), now));
    });
    record(now, AllocationEventType.PROFIT_SHARE, sourceBotId, profit,
        String.format("profit %s shared across %d bots (%s)", profit.toPlainString(), shares.size(), strategy.getId()),
        null, allocations);
  }

  private static boolean isNewer(BotAllocation local, BotAllocation remote) {
    if (local.lastUpdated() == null) {
      return false;
    }
    return remote.lastUpdated() == null || local.lastUpdated().isAfter(remote.lastUpdated());
  }

  private BotAllocation require(String botId) {
    BotAllocation allocation = allocations.get(botId);
    if (allocation == null) {
      throw PortfolioException.notRegistered(botId);
    }
    return allocation;
  }

  private BigDecimal totalAllocated() {
    BigDecimal total = BigDecimal.ZERO;
    for (BotAllocation allocation : allocations.values()) {
      total = total.add(allocation.allocatedBalance());
    }
    return total;
  }

  private void record(Instant now, AllocationEventType type, String botId, BigDecimal amount, String reason) {
    record(now, type, botId, amount, reason, null, null);
  }

  private void record(Instant now, AllocationEventType type, String botId, BigDecimal amount, String reason,
                      Map<String, BotAllocation> before, Map<String, BotAllocation> after) {
    history.addLast(new AllocationEvent(now, type, botId, amount, reason, before, after));
    while (history.size() > historyCapacity) {
      history.removeFirst();
    }
  }
}
