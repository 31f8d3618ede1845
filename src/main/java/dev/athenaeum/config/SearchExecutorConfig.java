package dev.athenaeum.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

/**
 * Bounded pool for the two retrieval branches of each search, and scheduling for the cache
 * sweep. Submissions beyond the queue capacity are rejected and the branch counts as unavailable.
 *
 * @see dev.athenaeum.search.SearchService
 */
@Configuration
@EnableScheduling
public class SearchExecutorConfig {

  private static final Logger log = LoggerFactory.getLogger(SearchExecutorConfig.class);

  @Bean(name = "searchExecutor", destroyMethod = "shutdownNow")
  public ExecutorService searchExecutor(
      @Value("${athenaeum.search.executor-threads:8}") int threads,
      @Value("${athenaeum.search.executor-queue-capacity:256}") int queueCapacity) {
    if (threads < 2) {
      throw new IllegalStateException(
          "athenaeum.search.executor-threads must be >= 2, got: " + threads);
    }
    if (queueCapacity < 1) {
      throw new IllegalStateException(
          "athenaeum.search.executor-queue-capacity must be >= 1, got: " + queueCapacity);
    }
    log.info("Search executor started with {} threads, queue capacity {}", threads, queueCapacity);
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(queueCapacity),
        new CustomizableThreadFactory("search-upstream-"),
        new ThreadPoolExecutor.AbortPolicy());
  }
}
