package com.tonindexer.domain;

/**
 * Application event: the classifier finished a trace. Consumed by {@link com.tonindexer.ingestion.job.ActionIngestionJob}.
 */
public record TraceClassifiedEvent(ClassifiedTrace trace) {
}
