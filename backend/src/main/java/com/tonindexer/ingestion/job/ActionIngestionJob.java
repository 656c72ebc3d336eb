package com.tonindexer.ingestion.job;

import com.tonindexer.config.AsyncConfig;
import com.tonindexer.domain.Action;
import com.tonindexer.domain.ClassifiedTrace;
import com.tonindexer.domain.TraceClassifiedEvent;
import com.tonindexer.ingestion.config.IngestionProperties;
import com.tonindexer.ingestion.normalizer.BlockToActionNormalizer;
import com.tonindexer.ingestion.store.IdempotentActionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Queues classified traces and, on a fixed delay, normalizes them into actions and stores them.
 * Delivery is at-least-once: a trace whose store fails is re-queued up to maxAttempts. Re-processing is safe
 * because action ids are content-derived.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ActionIngestionJob {

    private record PendingTrace(ClassifiedTrace trace, int attempts) {}

    private final BlockingQueue<PendingTrace> pending = new LinkedBlockingQueue<>();

    private final BlockToActionNormalizer normalizer;
    private final IdempotentActionStore actionStore;
    private final IngestionProperties properties;
    @Qualifier(AsyncConfig.NORMALIZATION_EXECUTOR)
    private final Executor normalizationExecutor;

    @EventListener
    public void onTraceClassified(TraceClassifiedEvent event) {
        enqueue(event.trace());
    }

    public void enqueue(ClassifiedTrace trace) {
        if (trace == null || trace.traceId() == null) {
            log.warn("Skipping classified trace without trace id");
            return;
        }
        pending.offer(new PendingTrace(trace, 0));
    }

    public int pendingCount() {
        return pending.size();
    }

    @Scheduled(fixedDelayString = IngestionProperties.SCHEDULE_INTERVAL_PLACEHOLDER)
    public void runScheduled() {
        log.debug("Action ingestion scheduled run triggered");
        runIngestion();
    }

    /**
     * Drain up to batchSize traces and process them on the normalization executor.
     *
     * @return number of traces whose actions were stored
     */
    public int runIngestion() {
        List<PendingTrace> batch = new ArrayList<>();
        pending.drainTo(batch, Math.max(1, properties.getBatchSize()));
        if (batch.isEmpty()) {
            return 0;
        }
        AtomicInteger stored = new AtomicInteger();
        AtomicInteger actions = new AtomicInteger();
        List<CompletableFuture<Void>> futures = new ArrayList<>();
        int rejected = 0;
        for (PendingTrace item : batch) {
            try {
                futures.add(CompletableFuture.runAsync(() -> {
                    int count = ingest(item);
                    if (count >= 0) {
                        stored.incrementAndGet();
                        actions.addAndGet(count);
                    }
                }, normalizationExecutor));
            } catch (RejectedExecutionException e) {
                // not attempted, so the attempt count stays as it was
                pending.offer(item);
                rejected++;
            }
        }
        if (rejected > 0) {
            log.warn("Normalization executor rejected {} trace(s), re-queued for the next run", rejected);
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        log.info("Action ingestion run complete: {} action(s) from {}/{} trace(s), {} pending",
                actions.get(), stored.get(), batch.size(), pending.size());
        return stored.get();
    }

    /** Returns the number of stored actions, or -1 when the trace was re-queued or dropped. */
    private int ingest(PendingTrace item) {
        String traceId = item.trace().traceId();
        try {
            List<Action> actions = normalizer.normalizeTrace(item.trace());
            actionStore.replaceTrace(traceId, actions);
            return actions.size();
        } catch (RuntimeException e) {
            int attempts = item.attempts() + 1;
            if (attempts >= Math.max(1, properties.getMaxAttempts())) {
                log.error("Dropping trace {} after {} failed attempt(s): {}", traceId, attempts, e.getMessage(), e);
            } else {
                log.warn("Storing actions for trace {} failed (attempt {}), re-queued: {}", traceId, attempts, e.getMessage(), e);
                pending.offer(new PendingTrace(item.trace(), attempts));
            }
            return -1;
        }
    }
}
