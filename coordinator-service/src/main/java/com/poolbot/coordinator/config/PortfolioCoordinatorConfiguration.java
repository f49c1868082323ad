package com.poolbot.coordinator.config;

import com.poolbot.coordinator.metrics.SyncMetricsEventHandler;
import com.poolbot.portfolio.allocation.AllocationManager;
import com.poolbot.portfolio.allocation.RebalanceConfig;
import com.poolbot.portfolio.config.PortfolioProperties;
import com.poolbot.portfolio.leverage.DefaultLeverageCalculator;
import com.poolbot.portfolio.leverage.LeverageCalculator;
import com.poolbot.portfolio.manager.PortfolioManager;
import com.poolbot.portfolio.model.HealthStatus;
import com.poolbot.portfolio.model.PortfolioConfig;
import com.poolbot.portfolio.model.PortfolioHealth;
import com.poolbot.portfolio.store.FileStateStore;
import com.poolbot.portfolio.store.PortfolioJson;
import com.poolbot.portfolio.sync.LoggingEventHandler;
import com.poolbot.portfolio.sync.SyncEventDispatcher;
import com.poolbot.portfolio.sync.SynchronizationManager;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Spring configuration for the portfolio coordinator.
 *
 * Wires up:
 * - PortfolioConfig from PortfolioProperties
 * - the file-backed state store shared with the other bot processes
 * - AllocationManager and the PortfolioManager facade over it
 * - SynchronizationManager for this process's bot, with logging and metrics handlers
 * - a scheduled health monitor
 *
 * PortfolioManager and SynchronizationManager are started and stopped by {@code PortfolioLifecycle}.
 */
@Slf4j
@Configuration
@EnableScheduling
public class PortfolioCoordinatorConfiguration {

    @Bean
    public Clock portfolioClock() {
        return Clock.systemUTC();
    }

    @Bean
    public PortfolioConfig portfolioConfig(PortfolioProperties properties) {
        PortfolioConfig config = PortfolioConfig.from(properties);
        log.info("Portfolio configuration loaded: balance=${}, strategy={}, stateFile={}, maxExposure={}x",
                config.totalBalance(), config.allocationStrategy().getId(), config.sharedStateFile(),
                config.maxTotalExposure());
        return config;
    }

    @Bean
    public LeverageCalculator leverageCalculator() {
        return new DefaultLeverageCalculator();
    }

    @Bean
    public FileStateStore stateStore(PortfolioConfig config, PortfolioProperties properties, Clock portfolioClock) {
        return new FileStateStore(
                Path.of(config.sharedStateFile()),
                PortfolioJson.objectMapper(),
                portfolioClock,
                Duration.ofMillis(properties.sync().staleLockMillis())
        );
    }

    @Bean
    public AllocationManager allocationManager(
            PortfolioConfig config,
            PortfolioProperties properties,
            LeverageCalculator leverageCalculator,
            Clock portfolioClock
    ) {
        RebalanceConfig rebalance = new RebalanceConfig(
                properties.rebalance().minAmount(),
                properties.rebalance().threshold(),
                config.rebalanceFrequency()
        );
        return new AllocationManager(
                config.totalBalance(),
                config.allocationStrategy(),
                rebalance,
                leverageCalculator,
                portfolioClock,
                properties.history().capacity()
        );
    }

    /**
     * The risk manager is left to the portfolio manager, which builds it from the normalized policy.
     */
    @Bean(destroyMethod = "")
    public PortfolioManager portfolioManager(
            PortfolioConfig config,
            AllocationManager allocationManager,
            FileStateStore stateStore,
            LeverageCalculator leverageCalculator,
            PortfolioProperties properties,
            Clock portfolioClock
    ) {
        return new PortfolioManager(
                config,
                allocationManager,
                null,
                stateStore,
                leverageCalculator,
                Duration.ofMillis(properties.sync().lockTimeoutMillis()),
                portfolioClock
        );
    }

    @Bean
    public SyncEventDispatcher syncEventDispatcher() {
        return new SyncEventDispatcher();
    }

    @Bean(destroyMethod = "")
    public SynchronizationManager synchronizationManager(
            PortfolioProperties properties,
            PortfolioManager portfolioManager,
            SyncEventDispatcher syncEventDispatcher,
            MeterRegistry meterRegistry,
            Clock portfolioClock
    ) {
        SynchronizationManager sync = SynchronizationManager.forPortfolio(
                properties.bot().id(),
                portfolioManager,
                properties.sync().toSettings(),
                syncEventDispatcher,
                portfolioClock
        );
        sync.addEventHandler(new LoggingEventHandler());
        sync.addEventHandler(new SyncMetricsEventHandler(
                meterRegistry,
                portfolioManager.ledger()::getPortfolioSummary,
                sync::getSyncStats,
                portfolioClock
        ));
        return sync;
    }

    /**
     * Periodic health check. Needs to be its own bean so that {@code @Scheduled} is picked up.
     */
    @Bean
    public PortfolioHealthMonitor portfolioHealthMonitor(
            PortfolioManager portfolioManager,
            SynchronizationManager synchronizationManager
    ) {
        return new PortfolioHealthMonitor(portfolioManager, synchronizationManager);
    }

    @Slf4j
    public static class PortfolioHealthMonitor {
        private final PortfolioManager portfolio;
        private final SynchronizationManager sync;
        private HealthStatus lastStatus = HealthStatus.HEALTHY;

        public PortfolioHealthMonitor(PortfolioManager portfolio, SynchronizationManager sync) {
            this.portfolio = portfolio;
            this.sync = sync;
        }

        @Scheduled(fixedDelayString = "${portfolio.sync.health-check-interval-millis:60000}",
                initialDelayString = "${portfolio.sync.health-check-interval-millis:60000}")
        public void checkHealth() {
            if (!portfolio.isInitialized()) {
                return;
            }
            try {
                check();
                int adjustments = portfolio.rebalanceIfNeeded();
                if (adjustments > 0) {
                    log.info("Scheduled rebalance adjusted {} bots", adjustments);
                }
            } catch (Exception e) {
                log.warn("Error checking portfolio health: {}", e.getMessage());
            }
        }

        /**
         * Log the current health and raise an emergency stop when the portfolio turns critical.
         */
        PortfolioHealth check() {
            PortfolioHealth health = portfolio.getPortfolioHealth();
            switch (health.status()) {
                case HEALTHY -> log.debug("Portfolio healthy: exposure {}%, pnl {}%",
                        String.format("%.1f", health.exposurePercent()), String.format("%.2f", health.pnlPercent()));
                case WARNING -> log.warn("Portfolio warnings: {}", health.warnings());
                case CRITICAL -> log.error("Portfolio critical: {}", health.issues());
            }
            if (health.status() == HealthStatus.CRITICAL && lastStatus != HealthStatus.CRITICAL
                    && portfolio.config().emergencyStopEnabled()) {
                sync.broadcastEmergencyStop(String.join("; ", health.issues()));
            }
            lastStatus = health.status();
            return health;
        }
    }
}
