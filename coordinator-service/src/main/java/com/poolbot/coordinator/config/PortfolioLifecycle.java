package com.poolbot.coordinator.config;

import com.poolbot.portfolio.config.PortfolioProperties;
import com.poolbot.portfolio.error.PortfolioErrorCode;
import com.poolbot.portfolio.error.PortfolioException;
import com.poolbot.portfolio.manager.PortfolioManager;
import com.poolbot.portfolio.model.BotAllocation;
import com.poolbot.portfolio.sync.SynchronizationManager;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Brings this process's bot into the shared pool on startup and takes it out cleanly on shutdown.
 *
 * Startup: initialize the portfolio manager, register the configured bot unless the shared
 * document already holds it, then start synchronization when enabled.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PortfolioLifecycle {

    private final @NonNull PortfolioProperties properties;
    private final @NonNull PortfolioManager portfolioManager;
    private final @NonNull SynchronizationManager synchronizationManager;

    @PostConstruct
    public void start() {
        portfolioManager.initialize();
        registerOwnBot();
        if (properties.sync().enabled()) {
            synchronizationManager.start();
        } else {
            log.info("Synchronization disabled, bot {} will only see shared state on writes",
                    synchronizationManager.botId());
        }
    }

    @PreDestroy
    public void stop() {
        synchronizationManager.stop();
        portfolioManager.close();
    }

    private void registerOwnBot() {
        PortfolioProperties.Bot bot = properties.bot();
        if (!bot.isConfigured()) {
            log.info("No bot symbol configured for {}, skipping registration", bot.id());
            return;
        }
        if (portfolioManager.ledger().isAllocated(bot.id())) {
            BotAllocation existing = portfolioManager.getBotAllocation(bot.id());
            log.info("Bot {} already registered with ${} allocated", bot.id(),
                    existing.allocatedBalance().toPlainString());
            return;
        }
        try {
            portfolioManager.registerBot(bot.toBotConfig());
        } catch (PortfolioException e) {
            if (!e.is(PortfolioErrorCode.BOT_ALREADY_REGISTERED)) {
                throw e;
            }
            log.info("Bot {} was registered concurrently by another process", bot.id());
        }
    }
}
