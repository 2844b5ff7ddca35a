package com.flamingo.ai.sessions.config;

import java.util.concurrent.Executor;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Thread pools for transcript search. */
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

  private final SearchConfig searchConfig;

  /**
   * Scans transcript files, one task per file.
   *
   * <p>Sized to {@code search.execution.parallelism}, the number of available processors by
   * default. The queue is unbounded so a large corpus never rejects file tasks.
   */
  @Bean(name = "searchExecutor")
  public Executor searchExecutor() {
    int threads = searchConfig.getExecution().effectiveParallelism();
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(threads);
    executor.setMaxPoolSize(threads);
    executor.setThreadNamePrefix("search-scan-");
    executor.initialize();
    return executor;
  }

  /** Runs incremental searches; each one fans out to {@code searchExecutor}. */
  @Bean(name = "interactiveSearchExecutor")
  public Executor interactiveSearchExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(4);
    executor.setQueueCapacity(50);
    executor.setThreadNamePrefix("search-interactive-");
    executor.initialize();
    return executor;
  }
}
