package com.tonindexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Single trigger thread for ActionIngestionJob. Runs never overlap (fixed delay), so one thread is enough; the
 * batch itself runs on the normalization executor.
 */
@Configuration
@EnableScheduling
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    static final int SHUTDOWN_AWAIT_SECONDS = 30;

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler ingestionTriggerScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("ingestion-trigger-");
        // let a running batch finish so its drained traces are stored or re-queued
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(SHUTDOWN_AWAIT_SECONDS);
        scheduler.initialize();
        return scheduler;
    }
}
