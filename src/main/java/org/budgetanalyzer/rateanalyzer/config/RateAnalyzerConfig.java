package org.budgetanalyzer.rateanalyzer.config;

import java.time.Clock;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import org.budgetanalyzer.rateanalyzer.support.Sleeper;

/**
 * Main configuration class for the rate analyzer.
 *
 * <p>Note: ObjectMapper is auto-configured by Spring Boot using spring.jackson.* properties in
 * application.yml. JavaTimeModule is automatically registered when jackson-datatype-jsr310 is on
 * the classpath.
 */
@Configuration
@EnableConfigurationProperties(RateAnalyzerProperties.class)
public class RateAnalyzerConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemDefaultZone();
  }

  @Bean
  @ConditionalOnMissingBean
  public Sleeper sleeper() {
    return Sleeper.threadSleeper();
  }

  // No actuator here, so nobody else registers one
  @Bean
  @ConditionalOnMissingBean
  public MeterRegistry meterRegistry() {
    return new SimpleMeterRegistry();
  }
}
