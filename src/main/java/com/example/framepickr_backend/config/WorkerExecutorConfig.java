package com.example.framepickr_backend.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Provides the two bounded pools used by {@link com.example.framepickr_backend.service.SelectionOrchestrator}:
 * one for per-image scoring and one for writing selected images.
 *
 * <p>Scoring never runs on the request thread: once its queue is full, submissions are rejected and
 * the orchestrator fails those candidates. Persistence falls back to the submitting thread.</p>
 */
@Configuration
@EnableConfigurationProperties(WorkerExecutorProperties.class)
public class WorkerExecutorConfig {

    @Bean(name = "scoringTaskExecutor")
    public ThreadPoolTaskExecutor scoringTaskExecutor(WorkerExecutorProperties properties) {
        return pool(Math.max(1, properties.getScoringThreads()), properties.getQueueCapacity(), "score-",
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean(name = "persistTaskExecutor")
    public ThreadPoolTaskExecutor persistTaskExecutor(WorkerExecutorProperties properties) {
        return pool(Math.max(1, properties.getPersistThreads()), properties.getQueueCapacity(), "persist-",
                new ThreadPoolExecutor.CallerRunsPolicy());
    }

    private static ThreadPoolTaskExecutor pool(int threads, int queueCapacity, String prefix,
                                               RejectedExecutionHandler whenFull) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Math.max(0, queueCapacity));
        executor.setThreadNamePrefix(prefix);
        executor.setRejectedExecutionHandler(whenFull);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
