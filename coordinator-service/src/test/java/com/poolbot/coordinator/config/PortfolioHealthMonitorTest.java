package com.poolbot.coordinator.config;

import com.poolbot.coordinator.support.TestPortfolios;
import com.poolbot.portfolio.manager.PortfolioManager;
import com.poolbot.portfolio.model.BotConfig;
import com.poolbot.portfolio.model.HealthStatus;
import com.poolbot.portfolio.sync.SyncEvent;
import com.poolbot.portfolio.sync.SyncEventDispatcher;
import com.poolbot.portfolio.sync.SyncEventType;
import com.poolbot.portfolio.sync.SynchronizationManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PortfolioHealthMonitor.
 */
class PortfolioHealthMonitorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private PortfolioManager portfolio;
    private List<SyncEvent> events;
    private PortfolioCoordinatorConfiguration.PortfolioHealthMonitor monitor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        portfolio = TestPortfolios.portfolio(tempDir.resolve("portfolio_state.json"), clock);
        events = new CopyOnWriteArrayList<>();
        SyncEventDispatcher dispatcher = new SyncEventDispatcher(Runnable::run);
        dispatcher.addHandler(events::add);
        SynchronizationManager sync = TestPortfolios.sync("btc-bot", portfolio, dispatcher, clock);
        monitor = new PortfolioCoordinatorConfiguration.PortfolioHealthMonitor(portfolio, sync);
    }

    @Test
    void shouldSkipUntilPortfolioIsInitialized() {
        monitor.checkHealth();

        assertThat(events).isEmpty();
    }

    @Test
    void shouldBroadcastEmergencyStopOnceWhenCritical() {
        // Given: a 30% realized loss against a 25% drawdown limit
        portfolio.initialize();
        portfolio.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));
        portfolio.recordProfit("btc-bot", new BigDecimal("-300"));

        // When:
        assertThat(monitor.check().status()).isEqualTo(HealthStatus.CRITICAL);
        monitor.checkHealth();

        // Then:
        assertThat(events).singleElement().satisfies(event -> {
            assertThat(event.type()).isEqualTo(SyncEventType.EMERGENCY_STOP);
            assertThat((String) event.data().get("reason")).contains("drawdown");
        });
    }

    @Test
    void shouldStayQuietWhileHealthy() {
        portfolio.initialize();
        portfolio.registerBot(BotConfig.of("btc-bot", "BTCUSDT", 10, 0.5));

        monitor.checkHealth();

        assertThat(events).isEmpty();
        assertThat(portfolio.getSummary().lastRebalance()).isEqualTo(NOW);
    }
}
