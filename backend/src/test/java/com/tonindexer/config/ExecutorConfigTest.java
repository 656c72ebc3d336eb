package com.tonindexer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        AsyncConfig.class,
        SchedulerConfig.class
})
class ExecutorConfigTest {

    @Autowired
    @Qualifier(AsyncConfig.NORMALIZATION_EXECUTOR)
    Executor normalizationExecutor;

    @Autowired
    @Qualifier(SchedulerConfig.SCHEDULER_POOL)
    ThreadPoolTaskScheduler schedulerPool;

    @Test
    @DisplayName("normalization executor is a bounded pool")
    void normalizationExecutor() {
        assertThat(normalizationExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor pool = (ThreadPoolTaskExecutor) normalizationExecutor;
        assertThat(pool.getCorePoolSize()).isEqualTo(4);
        assertThat(pool.getMaxPoolSize()).isEqualTo(4);
        assertThat(pool.getThreadNamePrefix()).isEqualTo("normalize-");
    }

    @Test
    @DisplayName("ingestion trigger runs on a single named thread")
    void schedulerPool() {
        assertThat(schedulerPool.getScheduledThreadPoolExecutor().getCorePoolSize()).isEqualTo(1);
        assertThat(schedulerPool.getThreadNamePrefix()).isEqualTo("ingestion-trigger-");
    }
}
