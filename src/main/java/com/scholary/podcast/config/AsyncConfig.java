package com.scholary.podcast.config;

import com.scholary.podcast.ingestion.IngestionProperties;
import com.scholary.podcast.workflow.WorkflowProperties;
import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors for background work.
 *
 * <ul>
 *   <li>ingestionExecutor: one thread per concurrently polled podcast
 *   <li>workflowExecutor: bounded pool and queue for in-process episode pipelines
 *   <li>bulkJobExecutor: one thread per bulk job, no cap across jobs
 * </ul>
 */
@Configuration
public class AsyncConfig {

  @Bean(name = "ingestionExecutor")
  public Executor ingestionExecutor(IngestionProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.maxConcurrency());
    executor.setMaxPoolSize(properties.maxConcurrency());
    // the ingestor's semaphore keeps submissions within the pool size
    executor.setQueueCapacity(properties.maxConcurrency());
    executor.setThreadNamePrefix("ingest-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "workflowExecutor")
  public Executor workflowExecutor(WorkflowProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.executorThreads());
    executor.setMaxPoolSize(properties.executorThreads());
    executor.setQueueCapacity(properties.executorQueueSize());
    executor.setThreadNamePrefix("workflow-");
    executor.initialize();
    return executor;
  }

  @Bean(name = "bulkJobExecutor")
  public Executor bulkJobExecutor() {
    return new SimpleAsyncTaskExecutor("bulk-job-");
  }
}
