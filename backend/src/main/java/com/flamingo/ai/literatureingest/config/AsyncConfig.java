package com.flamingo.ai.literatureingest.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Configuration for background runs and scheduled monitoring. */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

  public static final String INGESTION_RUN_EXECUTOR = "ingestionRunExecutor";

  /** Runs started over REST; one at a time, workers get their own threads. */
  @Bean(name = INGESTION_RUN_EXECUTOR)
  public ThreadPoolTaskExecutor ingestionRunExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(1);
    executor.setMaxPoolSize(1);
    executor.setQueueCapacity(0);
    executor.setThreadNamePrefix("ingest-run-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.setAwaitTerminationSeconds(60);
    executor.initialize();
    return executor;
  }
}
