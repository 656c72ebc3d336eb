package com.tonindexer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. normalization-executor runs trace normalization + store for one ingestion batch.
 */
@Configuration
public class AsyncConfig {

    public static final String NORMALIZATION_EXECUTOR = "normalization-executor";

    /** Normalization is CPU-bound and stateless; the pool only bounds how many traces are in flight. */
    @Bean(name = NORMALIZATION_EXECUTOR)
    public Executor normalizationExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(4);
        e.setMaxPoolSize(4);
        e.setThreadNamePrefix("normalize-");
        e.initialize();
        return e;
    }
}
