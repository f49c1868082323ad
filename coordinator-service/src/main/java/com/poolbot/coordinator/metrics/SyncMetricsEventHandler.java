package com.poolbot.coordinator.metrics;

import com.poolbot.portfolio.model.PortfolioSummary;
import com.poolbot.portfolio.sync.EventHandler;
import com.poolbot.portfolio.sync.SyncEvent;
import com.poolbot.portfolio.sync.SyncEventType;
import com.poolbot.portfolio.sync.SyncStats;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Publishes synchronization events and pool state to Micrometer.
 *
 * Prometheus metrics:
 * - portfolio.sync.events{type}: events seen, by type
 * - portfolio.balance.total / portfolio.balance.allocated: pool balances
 * - portfolio.bots.active: bots with an open position
 * - portfolio.sync.age.seconds: time since the last successful sync
 */
public class SyncMetricsEventHandler implements EventHandler {

    private final Map<SyncEventType, Counter> eventCounters = new EnumMap<>(SyncEventType.class);
    private final Supplier<PortfolioSummary> summary;
    private final Supplier<SyncStats> stats;
    private final Clock clock;

    public SyncMetricsEventHandler(
            MeterRegistry meterRegistry,
            Supplier<PortfolioSummary> summary,
            Supplier<SyncStats> stats,
            Clock clock
    ) {
        this.summary = summary;
        this.stats = stats;
        this.clock = clock;

        for (SyncEventType type : SyncEventType.values()) {
            eventCounters.put(type, Counter.builder("portfolio.sync.events")
                    .description("Synchronization events seen by this process")
                    .tag("type", type.name().toLowerCase())
                    .register(meterRegistry));
        }

        Gauge.builder("portfolio.balance.total", this, h -> h.summary.get().totalBalance().doubleValue())
                .description("Total pool balance")
                .register(meterRegistry);

        Gauge.builder("portfolio.balance.allocated", this, h -> h.summary.get().totalAllocated().doubleValue())
                .description("Balance allocated to bots")
                .register(meterRegistry);

        Gauge.builder("portfolio.bots.active", this, h -> h.summary.get().activeBots())
                .description("Bots with an open position")
                .register(meterRegistry);

        Gauge.builder("portfolio.sync.age.seconds", this, SyncMetricsEventHandler::secondsSinceLastSync)
                .description("Seconds since the last successful sync")
                .register(meterRegistry);
    }

    @Override
    public void handle(SyncEvent event) {
        eventCounters.get(event.type()).increment();
    }

    double secondsSinceLastSync() {
        Instant lastSync = stats.get().lastSync();
        if (lastSync == null) {
            return Double.NaN;
        }
        return Duration.between(lastSync, clock.instant()).toMillis() / 1000.0;
    }
}
