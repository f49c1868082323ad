package com.poolbot.portfolio.config;

import com.poolbot.portfolio.model.AllocationStrategy;
import com.poolbot.portfolio.model.BotConfig;
import com.poolbot.portfolio.model.PortfolioConfig;
import com.poolbot.portfolio.sync.SyncSettings;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class PortfolioPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "portfolio.total-balance=2500",
        "portfolio.allocation-strategy=performance_based",
        "portfolio.state-file=/var/lib/poolbot/state.json",
        "portfolio.max-total-exposure=2.5",
        "portfolio.rebalance-frequency=30m",
        "portfolio.profit-sharing.enabled=false",
        "portfolio.sync.sync-interval-millis=2000",
        "portfolio.sync.lock-timeout-millis=750",
        "portfolio.bot.id=btc-bot",
        "portfolio.bot.symbol=BTCUSDT",
        "portfolio.bot.leverage=10",
        "portfolio.bot.allocation-percentage=0.4"
    ).run(context -> {
      PortfolioProperties properties = context.getBean(PortfolioProperties.class);

      assertThat(properties.totalBalance().intValue()).isEqualTo(2500);
      assertThat(properties.rebalanceFrequency()).isEqualTo(Duration.ofMinutes(30));
      assertThat(properties.profitSharing().enabled()).isFalse();

      PortfolioConfig config = PortfolioConfig.from(properties);
      assertThat(config.allocationStrategy()).isEqualTo(AllocationStrategy.PERFORMANCE_BASED);
      assertThat(config.sharedStateFile()).isEqualTo("/var/lib/poolbot/state.json");
      assertThat(config.maxTotalExposure()).isEqualTo(2.5);
      assertThat(config.profitSharingEnabled()).isFalse();

      SyncSettings settings = properties.sync().toSettings();
      assertThat(settings.syncInterval()).isEqualTo(Duration.ofSeconds(2));
      assertThat(settings.lockTimeout()).isEqualTo(Duration.ofMillis(750));
      assertThat(settings.heartbeatInterval()).isEqualTo(Duration.ofSeconds(30));

      assertThat(properties.bot().isConfigured()).isTrue();
      BotConfig bot = properties.bot().toBotConfig();
      assertThat(bot.botId()).isEqualTo("btc-bot");
      assertThat(bot.leverage()).isEqualTo(10.0);
      assertThat(bot.allocationPercentage()).isEqualTo(0.4);
      assertThat(bot.category()).isEqualTo("default");
    });
  }

  @Test
  void appliesDefaultsWhenNothingIsSet() {
    runner.run(context -> {
      PortfolioProperties properties = context.getBean(PortfolioProperties.class);

      assertThat(PortfolioConfig.from(properties)).isEqualTo(PortfolioConfig.defaults());
      assertThat(properties.sync().enabled()).isTrue();
      assertThat(properties.history().capacity()).isEqualTo(1000);
      assertThat(properties.bot().isConfigured()).isFalse();
    });
  }

  @Test
  void rejectsNonPositiveBalance() {
    runner.withPropertyValues("portfolio.total-balance=-5")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(PortfolioProperties.class)
  static class TestConfig {
  }
}
