package com.tradeledger.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.cache.CacheManager;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        CaffeineConfig.class,
        AsyncConfig.class
})
class CacheAndExecutorConfigTest {

    @Autowired
    CacheManager cacheManager;

    @Autowired
    @Qualifier(AsyncConfig.RECOMPUTE_EXECUTOR)
    Executor recomputeExecutor;

    @Test
    @DisplayName("exchange order fills cache is created and usable")
    void cacheCreatedAndUsed() {
        assertThat(cacheManager.getCache(CaffeineConfig.EXCHANGE_ORDER_FILLS_CACHE)).isNotNull();

        cacheManager.getCache(CaffeineConfig.EXCHANGE_ORDER_FILLS_CACHE).put("X123", "fill");
        assertThat(cacheManager.getCache(CaffeineConfig.EXCHANGE_ORDER_FILLS_CACHE).get("X123").get()).isEqualTo("fill");
    }

    @Test
    @DisplayName("recompute executor is a bounded two-thread pool")
    void recomputeExecutorCreated() {
        assertThat(recomputeExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) recomputeExecutor;
        assertThat(executor.getCorePoolSize()).isEqualTo(2);
        assertThat(executor.getMaxPoolSize()).isEqualTo(2);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("recompute-");
    }
}
