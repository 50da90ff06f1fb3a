package com.ospicorp.indicatormetrics.config;

import com.ospicorp.indicatormetrics.indicator.catalog.IndicatorCatalog;
import com.ospicorp.indicatormetrics.indicator.catalog.IndicatorCatalogProperties;
import java.time.Clock;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableConfigurationProperties(IndicatorCatalogProperties.class)
public class EngineConfig {

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  IndicatorCatalog indicatorCatalog(IndicatorCatalogProperties properties) {
    return new IndicatorCatalog(properties.getCatalog());
  }

  // Bounded pool: a batch never holds more upstream connections than this.
  @Bean(name = "indicatorExecutor")
  ThreadPoolTaskExecutor indicatorExecutor(
      @Value("${indicators.executor.pool-size:4}") int poolSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(poolSize);
    executor.setMaxPoolSize(poolSize);
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("indicator-");
    return executor;
  }
}
