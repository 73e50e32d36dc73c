package com.quantbacktest.portfolio.config;

import com.quantbacktest.portfolio.domain.BacktestEngine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans for the backtest engine and its metrics.
 */
@Configuration
@EnableConfigurationProperties(BacktestProperties.class)
public class BacktestConfiguration {

    @Bean
    public BacktestEngine backtestEngine() {
        return new BacktestEngine();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
