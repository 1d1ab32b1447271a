package com.scholary.recipe.media.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Configuration for the upload client's threads.
 *
 * <p>Sets up a bounded pool for HTTP callbacks and resumable transfers, and a small scheduler for
 * processing polls. Pool size and queue capacity are configurable to control resource usage when
 * many upload sessions run at once.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "mediaClientExecutor")
  public ThreadPoolTaskExecutor mediaClientExecutor(
      @Value("${media.async.executor-threads}") int threads,
      @Value("${media.async.executor-queue-size}") int queueSize) {

    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("media-client-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "mediaPollScheduler")
  public ThreadPoolTaskScheduler mediaPollScheduler(
      @Value("${media.async.scheduler-threads}") int threads) {

    ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
    scheduler.setPoolSize(threads);
    scheduler.setThreadNamePrefix("media-poll-");
    scheduler.initialize();
    return scheduler;
  }
}
