package com.hookmetrics.analytics.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Bounded pool for the concurrent check_run/status reads of a PR story request.
 */
@Configuration
public class EventStoreExecutorConfig {

    @Value("${prstory.store-executor.pool-size:8}")
    private int poolSize;

    @Value("${prstory.store-executor.queue-capacity:100}")
    private int queueCapacity;

    @Bean
    public ThreadPoolTaskExecutor eventStoreExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("event-store-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
