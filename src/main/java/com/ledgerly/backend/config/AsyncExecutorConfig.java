package com.ledgerly.backend.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class AsyncExecutorConfig {

    /**
     * Intent matching and entity extraction for a single chat message run side by side here.
     * Pure CPU work, so the pool stays close to the core count.
     */
    @Bean(name = "chatAnalysisExecutor")
    public Executor chatAnalysisExecutor() {
        int cores = Math.max(2, Runtime.getRuntime().availableProcessors());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(cores);
        executor.setMaxPoolSize(cores * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("chat-analysis-");
        executor.initialize();
        return executor;
    }

    // Retrains are rare and heavy; one at a time.
    @Bean(name = "categorizerTrainingExecutor")
    public Executor categorizerTrainingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("categorizer-training-");
        executor.initialize();
        return executor;
    }
}
