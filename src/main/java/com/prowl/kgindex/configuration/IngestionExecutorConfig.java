package com.prowl.kgindex.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for the per-chunk embedding and extraction calls of an ingest request.
 *
 * The request thread waits for all chunk tasks before it writes to the store, so nothing
 * submitted here outlives the request.
 */
@Slf4j
@Configuration
public class IngestionExecutorConfig {

    @Bean(name = "ingestionExecutor")
    public ThreadPoolTaskExecutor ingestionExecutor(AppProperties props) {
        IngestionProperties ingestion = props.getIngestion();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(ingestion.getPoolSize());
        executor.setMaxPoolSize(ingestion.getPoolSize());
        executor.setQueueCapacity(ingestion.getQueueCapacity());
        executor.setThreadNamePrefix("kg-ingest-");

        // Caller runs when saturated rather than rejecting the chunk
        executor.setRejectedExecutionHandler(new java.util.concurrent.ThreadPoolExecutor.CallerRunsPolicy());

        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Ingestion executor configured: pool={}, queue={}",
                executor.getCorePoolSize(),
                ingestion.getQueueCapacity());

        return executor;
    }
}
