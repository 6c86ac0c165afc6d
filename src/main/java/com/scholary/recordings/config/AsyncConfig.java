package com.scholary.recordings.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Configuration for the finalization worker pool.
 *
 * <p>The pool is bounded by {@code ingestion.worker-threads}. The dispatcher never claims more jobs
 * than there are free workers, so the queue only absorbs the gap between claim and start.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "finalizationExecutor")
  public Executor finalizationExecutor(IngestionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.workerThreads());
    executor.setMaxPoolSize(properties.workerThreads());
    executor.setQueueCapacity(properties.workerThreads());
    executor.setThreadNamePrefix("finalization-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(30);
    executor.initialize();
    return executor;
  }
}
