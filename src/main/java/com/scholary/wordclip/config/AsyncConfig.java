package com.scholary.wordclip.config;

import java.util.concurrent.Executor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools.
 *
 * <p>{@code transcriptionExecutor} runs per-track extraction and transcription and concurrent
 * embedding batches within one run. {@code jobExecutor} runs whole pipeline runs submitted
 * through the REST API. Both are bounded.
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "transcriptionExecutor")
  public Executor transcriptionExecutor(
      @Value("${wordclip.executor.transcription-threads:2}") int threads) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("transcription-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "jobExecutor")
  public Executor jobExecutor(
      @Value("${wordclip.executor.job-threads:2}") int threads,
      @Value("${wordclip.executor.job-queue-size:50}") int queueSize) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setQueueCapacity(queueSize);
    executor.setThreadNamePrefix("clip-job-");
    executor.initialize();
    return executor;
  }
}
