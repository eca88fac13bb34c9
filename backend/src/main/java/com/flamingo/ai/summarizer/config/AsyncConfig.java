package com.flamingo.ai.summarizer.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/** Executors used by the summarization pipeline. */
@Configuration
public class AsyncConfig {

  /** Runs map-step tasks; each pipeline admits at most {@code summarizer.reduce.concurrency}. */
  @Bean(name = "chunkSummaryExecutor", destroyMethod = "shutdownNow")
  public ExecutorService chunkSummaryExecutor(SummarizerConfig summarizerConfig) {
    int threads = Math.max(1, summarizerConfig.getReduce().getExecutorThreads());
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("chunk-map-");
    threadFactory.setDaemon(true);
    return Executors.newFixedThreadPool(threads, threadFactory);
  }

  /** Runs the blocking backend calls so they can be timed out and interrupted. */
  @Bean(name = "backendCallExecutor", destroyMethod = "shutdownNow")
  public ExecutorService backendCallExecutor() {
    CustomizableThreadFactory threadFactory = new CustomizableThreadFactory("llm-call-");
    threadFactory.setDaemon(true);
    return Executors.newCachedThreadPool(threadFactory);
  }
}
