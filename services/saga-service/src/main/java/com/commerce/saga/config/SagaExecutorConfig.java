package com.commerce.saga.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class SagaExecutorConfig {

    @Bean(name = "sagaExecutor")
    public ThreadPoolTaskExecutor sagaExecutor(@Value("${saga.executor.core-pool-size:4}") int corePoolSize,
                                               @Value("${saga.executor.max-pool-size:16}") int maxPoolSize,
                                               @Value("${saga.executor.queue-capacity:500}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("saga-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
