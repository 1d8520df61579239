package com.apiresilience.service;

import com.apiresilience.model.ResilienceConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "resilience")
public class ResilienceProperties {
    private Duration timeout = Duration.ofMillis(ResilienceConfig.DEFAULT_TIMEOUT_MS);
    private int maxRetries = ResilienceConfig.DEFAULT_MAX_RETRIES;
    private Duration baseDelay = Duration.ofMillis(ResilienceConfig.DEFAULT_BASE_DELAY_MS);
    private Duration maxDelay = Duration.ofMillis(ResilienceConfig.DEFAULT_MAX_DELAY_MS);
    private int poolSize = ResilienceConfig.DEFAULT_POOL_SIZE;
    private boolean keepAlive = ResilienceConfig.DEFAULT_KEEP_ALIVE;
    private Duration keepAliveDuration = Duration.ofMillis(ResilienceConfig.DEFAULT_KEEP_ALIVE_MS);
    private String healthCheckHost = "api.tumblr.com";
    private int errorHistorySize = 50;
    private int schedulerThreads = 2;
    private final RateLimit rateLimit = new RateLimit();

    public ResilienceConfig toResilienceConfig() {
        return new ResilienceConfig(timeout.toMillis(), maxRetries, baseDelay.toMillis(), maxDelay.toMillis(),
            poolSize, keepAlive, keepAliveDuration.toMillis());
    }

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public void setBaseDelay(Duration baseDelay) {
        this.baseDelay = baseDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public int getPoolSize() {
        return poolSize;
    }

    public void setPoolSize(int poolSize) {
        this.poolSize = poolSize;
    }

    public boolean isKeepAlive() {
        return keepAlive;
    }

    public void setKeepAlive(boolean keepAlive) {
        this.keepAlive = keepAlive;
    }

    public Duration getKeepAliveDuration() {
        return keepAliveDuration;
    }

    public void setKeepAliveDuration(Duration keepAliveDuration) {
        this.keepAliveDuration = keepAliveDuration;
    }

    public String getHealthCheckHost() {
        return healthCheckHost;
    }

    public void setHealthCheckHost(String healthCheckHost) {
        this.healthCheckHost = healthCheckHost;
    }

    public int getErrorHistorySize() {
        return errorHistorySize;
    }

    public void setErrorHistorySize(int errorHistorySize) {
        this.errorHistorySize = errorHistorySize;
    }

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public void setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public static class RateLimit {
        private int limit = 1000;
        private Duration window = Duration.ofHours(1);
        private Duration defaultDelay = Duration.ofSeconds(60);

        public int getLimit() {
            return limit;
        }

        public void setLimit(int limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public Duration getDefaultDelay() {
            return defaultDelay;
        }

        public void setDefaultDelay(Duration defaultDelay) {
            this.defaultDelay = defaultDelay;
        }
    }
}
