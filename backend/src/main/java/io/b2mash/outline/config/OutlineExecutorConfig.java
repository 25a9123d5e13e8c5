package io.b2mash.outline.config;

import io.b2mash.outline.outline.OutlineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class OutlineExecutorConfig {

  @Bean(name = "outlineBackendExecutor")
  public ThreadPoolTaskExecutor outlineBackendExecutor(OutlineProperties properties) {
    var executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.backendThreads());
    executor.setMaxPoolSize(properties.backendThreads());
    executor.setQueueCapacity(1_000);
    executor.setThreadNamePrefix("outline-store-");
    executor.setWaitForTasksToCompleteOnShutdown(true);
    executor.initialize();
    return executor;
  }
}
