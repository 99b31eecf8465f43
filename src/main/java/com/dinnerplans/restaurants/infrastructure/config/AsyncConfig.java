package com.dinnerplans.restaurants.infrastructure.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Executor for background cache revalidation.
 * Bounded: when saturated, a refresh is skipped and the stale value keeps being served.
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "cacheRevalidationExecutor")
    public Executor cacheRevalidationExecutor(
            @Value("${app.cache.revalidation.pool-size:2}") int poolSize,
            @Value("${app.cache.revalidation.queue-capacity:16}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("cache-revalidate-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
