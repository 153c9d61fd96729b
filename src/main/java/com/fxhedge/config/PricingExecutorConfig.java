package com.fxhedge.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for Monte Carlo batches. When the queue is full the submitting request thread
 * runs the batch itself, so a burst of requests slows down instead of failing.
 */
@Configuration
public class PricingExecutorConfig {

    @Value("${fxhedge.pricing.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${fxhedge.pricing.executor.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${fxhedge.pricing.executor.queue-capacity:256}")
    private int queueCapacity;

    @Bean("pricingExecutor")
    public ThreadPoolTaskExecutor pricingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("pricing-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
