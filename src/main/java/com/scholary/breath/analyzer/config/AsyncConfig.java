package com.scholary.breath.analyzer.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for async task execution.
 *
 * <p>Analysis jobs run on a bounded pool so request threads return immediately. Pool size and
 * queue capacity are configurable.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "taskExecutor")
  public Executor taskExecutor(
      @Value("${analysis.asyncExecutorThreads}") int threads,
      @Value("${analysis.asyncExecutorQueueSize}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("analysis-");
    executor.initialize();
    return executor;
  }
}
