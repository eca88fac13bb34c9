package com.flamingo.ai.summarizer.config;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Per-call timeout for the generation backend.
 *
 * <p>Only a time limiter is configured: backend failures surface to the caller, so there is no
 * retry or circuit breaker around the calls.
 */
@Configuration
public class ResilienceConfig {

  @Bean
  public TimeLimiter generationTimeLimiter(SummarizerConfig summarizerConfig) {
    return TimeLimiter.of(
        "generation",
        TimeLimiterConfig.custom()
            .timeoutDuration(summarizerConfig.getReduce().getCallTimeout())
            .cancelRunningFuture(true)
            .build());
  }
}
