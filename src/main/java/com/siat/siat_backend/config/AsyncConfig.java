package com.siat.siat_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Bounded pool for background code generation. Submissions beyond the queue are rejected.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "generationExecutor")
    public Executor generationExecutor(@Value("${siat.generation.pool.core-size:2}") int coreSize,
                                       @Value("${siat.generation.pool.max-size:4}") int maxSize,
                                       @Value("${siat.generation.pool.queue-capacity:100}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("siat-gen-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Generation executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(), executor.getMaxPoolSize(), queueCapacity);
        return executor;
    }
}
