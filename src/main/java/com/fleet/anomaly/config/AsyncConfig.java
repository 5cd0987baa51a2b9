package com.fleet.anomaly.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors that keep slow work off the ingestion path: model training runs on a single
 * dedicated thread, sink writes on a small bounded pool that drops work when saturated.
 */
@Configuration
public class AsyncConfig {

    private static final Logger log = LoggerFactory.getLogger(AsyncConfig.class);

    @Bean(name = "modelTrainingExecutor")
    public ThreadPoolTaskExecutor modelTrainingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(4);
        executor.setThreadNamePrefix("model-train-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "anomalySinkExecutor")
    public ThreadPoolTaskExecutor anomalySinkExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("anomaly-sink-");
        executor.setRejectedExecutionHandler((task, pool) ->
                log.warn("Anomaly sink queue is full ({} pending). Dropping anomaly write.",
                        pool.getQueue().size()));
        executor.initialize();
        return executor;
    }
}
