package com.cinegraph.collab.config;

import com.cinegraph.collab.store.StoreRetry;
import io.github.resilience4j.retry.Retry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class CollabGraphConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Retry storeRetry(CollabGraphProperties properties) {
        return StoreRetry.create("collabStore", properties.getStore());
    }

    /**
     * Workers for batch applies and rebuilds. Sized to the write concurrency
     * the store can take, not to the CPU count.
     */
    @Bean(name = "populationExecutor")
    public ThreadPoolTaskExecutor populationExecutor(CollabGraphProperties properties) {
        int parallelism = Math.max(1, properties.getPopulation().getParallelism());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(parallelism);
        executor.setMaxPoolSize(parallelism);
        executor.setThreadNamePrefix("collab-populate-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    /** Fire-and-forget path cache writes. A full queue drops the write. */
    @Bean(name = "pathCacheExecutor")
    public ThreadPoolTaskExecutor pathCacheExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("path-cache-");
        executor.initialize();
        return executor;
    }
}
