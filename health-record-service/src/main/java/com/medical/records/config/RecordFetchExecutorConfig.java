package com.medical.records.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Slf4j
@Configuration
public class RecordFetchExecutorConfig {

    @Bean(name = "recordFetchExecutor")
    public Executor recordFetchExecutor(AggregatorConfig aggregatorConfig) {
        if (!aggregatorConfig.isParallelFetch()) {
            log.info("[Aggregator] parallel fetch disabled, record kinds are fetched on the request thread");
            return Runnable::run;
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(aggregatorConfig.getFetchThreads());
        executor.setMaxPoolSize(aggregatorConfig.getFetchThreads());
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("record-fetch-");
        executor.initialize();
        log.info("[Aggregator] record fetch pool started with {} threads", aggregatorConfig.getFetchThreads());
        return executor;
    }
}
