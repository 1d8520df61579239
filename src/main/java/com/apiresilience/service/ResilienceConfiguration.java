package com.apiresilience.service;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ResilienceConfiguration {

    @Bean
    public Clock resilienceClock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "close")
    public ScheduledDelayScheduler delayScheduler(ResilienceProperties properties) {
        return new ScheduledDelayScheduler(properties.getSchedulerThreads());
    }

    @Bean(destroyMethod = "shutdown")
    public NetworkResilienceEngine networkResilienceEngine(ResilienceProperties properties, ErrorClassifier classifier,
                                                           DelayScheduler delayScheduler) {
        return new NetworkResilienceEngine(properties.toResilienceConfig(), classifier, delayScheduler,
            HostResolver.system(), properties.getHealthCheckHost());
    }

    @Bean
    public ErrorHistory errorHistory(ResilienceProperties properties) {
        return new ErrorHistory(properties.getErrorHistorySize());
    }
}
