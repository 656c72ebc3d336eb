package com.tonindexer.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Action ingestion job config. Traces arrive from the classifier and are drained on a fixed delay.
 */
@ConfigurationProperties(prefix = "tonindexer.ingestion")
@NoArgsConstructor
@Getter
@Setter
public class IngestionProperties {

    static final long DEFAULT_SCHEDULE_INTERVAL_MS = 60_000;

    /** Trigger expression for the ingestion job; falls back to the same default as the bound field. */
    public static final String SCHEDULE_INTERVAL_PLACEHOLDER =
            "${tonindexer.ingestion.schedule-interval-ms:" + DEFAULT_SCHEDULE_INTERVAL_MS + "}";

    /** Max traces normalized and stored per run. Default 500. */
    private int batchSize = 500;

    /**
     * Schedule interval in ms (fixedDelay). Default 60s. Bound for reference only: the trigger reads the same key
     * through {@link #SCHEDULE_INTERVAL_PLACEHOLDER}, whose fallback is this default.
     */
    private long scheduleIntervalMs = DEFAULT_SCHEDULE_INTERVAL_MS;

    /** Attempts to store one trace before it is dropped with an error log. */
    private int maxAttempts = 5;
}
