package com.tradeledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pool for allocation recompute requests published by backfill.
 * Runs for one namespace serialize on the allocation lease, so a small pool is enough.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String RECOMPUTE_EXECUTOR = "recompute-executor";

    @Bean(name = RECOMPUTE_EXECUTOR)
    public Executor recomputeExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(2);
        e.setMaxPoolSize(2);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("recompute-");
        e.initialize();
        return e;
    }
}
