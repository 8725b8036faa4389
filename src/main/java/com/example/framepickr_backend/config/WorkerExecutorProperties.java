package com.example.framepickr_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Sizes the scoring and persistence pools and bounds how long one batch may take.
 */
@ConfigurationProperties(prefix = "worker")
public class WorkerExecutorProperties {

    private int scoringThreads = Runtime.getRuntime().availableProcessors();
    private int persistThreads = 4;
    private int queueCapacity = 100;
    private Duration batchTimeout = Duration.ofSeconds(60);

    public int getScoringThreads() {
        return scoringThreads;
    }

    public void setScoringThreads(int scoringThreads) {
        this.scoringThreads = scoringThreads;
    }

    public int getPersistThreads() {
        return persistThreads;
    }

    public void setPersistThreads(int persistThreads) {
        this.persistThreads = persistThreads;
    }

    public int getQueueCapacity() {
        return queueCapacity;
    }

    public void setQueueCapacity(int queueCapacity) {
        this.queueCapacity = queueCapacity;
    }

    public Duration getBatchTimeout() {
        return batchTimeout;
    }

    public void setBatchTimeout(Duration batchTimeout) {
        this.batchTimeout = batchTimeout;
    }
}
