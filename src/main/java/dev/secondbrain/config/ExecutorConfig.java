package dev.secondbrain.config;

import dev.secondbrain.vector.EmbeddingProperties;
import java.util.concurrent.ExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pools of the retrieval pipeline.
 *
 * <ul>
 *   <li>{@code modelCallExecutor} - embedding and cross-encoder calls made on behalf of queries and
 *       jobs; sized by {@code secondbrain.embedding.model-threads}
 *   <li>{@code indexingExecutor} - BM25 rebuilds and embedding jobs, off the writer's thread
 * </ul>
 */
@Configuration
public class ExecutorConfig {

  @Bean(name = "modelCallExecutor", destroyMethod = "shutdownNow")
  public ExecutorService modelCallExecutor(EmbeddingProperties properties) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(properties.getModelThreads());
    executor.setMaxPoolSize(properties.getModelThreads());
    executor.setQueueCapacity(100);
    executor.setThreadNamePrefix("model-call-");
    executor.initialize();
    return executor.getThreadPoolExecutor();
  }

  @Bean(name = "indexingExecutor")
  public ThreadPoolTaskExecutor indexingExecutor() {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(2);
    executor.setMaxPoolSize(2);
    executor.setQueueCapacity(10_000);
    executor.setThreadNamePrefix("indexing-");
    executor.setWaitForTasksToCompleteOnShutdown(false);
    return executor;
  }
}
