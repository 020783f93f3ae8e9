package com.pokerpulse.enrichment.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncBatchConfig {

    @Bean(name = "backgroundTaskExecutor")
    public ThreadPoolTaskExecutor backgroundTaskExecutor(@Value("${pokerpulse.tasks.pool-size:4}") int poolSize,
                                                         @Value("${pokerpulse.tasks.queue-capacity:50}") int queueCapacity) {
        ThreadPoolTaskExecutor exec = new ThreadPoolTaskExecutor();
        exec.setCorePoolSize(poolSize);
        exec.setMaxPoolSize(poolSize);
        exec.setQueueCapacity(queueCapacity);
        exec.setThreadNamePrefix("PokerPulseTask-");
        exec.setWaitForTasksToCompleteOnShutdown(false);
        exec.initialize();
        return exec;
    }
}
