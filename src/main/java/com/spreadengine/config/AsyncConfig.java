package com.spreadengine.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executor for batch screening. Saturation falls back to running on the caller's thread, so
 * a large batch slows down rather than rejecting tickers.
 */
@Configuration
public class AsyncConfig {

    @Value("${spread-engine.screening.core-pool-size:4}")
    private int corePoolSize;

    @Value("${spread-engine.screening.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${spread-engine.screening.queue-capacity:100}")
    private int queueCapacity;

    @Bean("screeningExecutor")
    public ThreadPoolTaskExecutor screeningExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("screening-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
