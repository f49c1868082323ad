package com.poolbot.coordinator.config;

import com.poolbot.coordinator.support.TestPortfolios;
import com.poolbot.portfolio.config.PortfolioProperties;
import com.poolbot.portfolio.manager.PortfolioManager;
import com.poolbot.portfolio.model.PortfolioState;
import com.poolbot.portfolio.store.FileStateStore;
import com.poolbot.portfolio.sync.SyncEventDispatcher;
import com.poolbot.portfolio.sync.SynchronizationManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PortfolioLifecycle.
 */
class PortfolioLifecycleTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    @TempDir
    Path tempDir;

    private Clock clock;
    private Path stateFile;
    private PortfolioManager portfolio;
    private SynchronizationManager sync;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));
        stateFile = tempDir.resolve("portfolio_state.json");
        portfolio = TestPortfolios.portfolio(stateFile, clock);
        sync = TestPortfolios.sync("btc-bot", portfolio, new SyncEventDispatcher(Runnable::run), clock);
    }

    @AfterEach
    void tearDown() {
        sync.stop();
    }

    @Test
    void shouldRegisterConfiguredBotAndSaveOnStop() {
        // Given:
        PortfolioLifecycle lifecycle = new PortfolioLifecycle(properties(false, "BTCUSDT"), portfolio, sync);

        // When:
        lifecycle.start();

        // Then:
        assertThat(portfolio.getBotAllocation("btc-bot").allocatedBalance()).isEqualByComparingTo("400");
        assertThat(sync.isRunning()).isFalse();

        // When:
        lifecycle.stop();

        // Then:
        PortfolioState persisted = new FileStateStore(stateFile, clock).load();
        assertThat(persisted.allocations()).containsOnlyKeys("btc-bot");
        assertThat(portfolio.isInitialized()).isFalse();
    }

    @Test
    void shouldReuseExistingRegistration() {
        // Given: an earlier run left the bot in the shared document
        new PortfolioLifecycle(properties(false, "BTCUSDT"), portfolio, sync).start();
        portfolio.close();

        PortfolioManager restarted = TestPortfolios.portfolio(stateFile, clock);
        SynchronizationManager restartedSync = TestPortfolios.sync("btc-bot", restarted,
                new SyncEventDispatcher(Runnable::run), clock);

        // When:
        new PortfolioLifecycle(properties(false, "BTCUSDT"), restarted, restartedSync).start();

        // Then:
        assertThat(restarted.getAllAllocations()).containsOnlyKeys("btc-bot");
        assertThat(restarted.getHistory(0)).isEmpty();
    }

    @Test
    void shouldStartSyncWhenEnabled() {
        PortfolioLifecycle lifecycle = new PortfolioLifecycle(properties(true, null), portfolio, sync);

        lifecycle.start();

        assertThat(sync.isRunning()).isTrue();
        assertThat(portfolio.getAllAllocations()).isEmpty();
    }

    private static PortfolioProperties properties(boolean syncEnabled, String symbol) {
        return new PortfolioProperties(
                new BigDecimal("1000"), null, null, null, null, null, null, null, null, null,
                new PortfolioProperties.Sync(syncEnabled, null, null, null, null, null, null),
                null,
                new PortfolioProperties.Bot("btc-bot", symbol, null, 10.0, 0.4, null)
        );
    }
}
