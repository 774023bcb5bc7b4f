package com.geoenrich.service;

import com.geoenrich.model.result.PerformanceSnapshot;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only counters shared by all enrichment runs
 */
@Component
public class EnrichmentMetrics {

    private final AtomicLong totalEnrichments = new AtomicLong();
    private final AtomicLong totalTimeMs = new AtomicLong();
    private final AtomicLong parallelTasks = new AtomicLong();
    private final AtomicLong failedTasks = new AtomicLong();

    private final Timer enrichmentTimer;
    private final Counter taskFailures;

    public EnrichmentMetrics(MeterRegistry meterRegistry) {
        this.enrichmentTimer = Timer.builder("geoenrich.enrichment")
                .description("Wall time of one location enrichment")
                .register(meterRegistry);
        this.taskFailures = Counter.builder("geoenrich.enrichment.failures")
                .description("Enrichment types that ended in an error entry")
                .register(meterRegistry);
    }

    public void recordEnrichment(long elapsedMs, int tasks) {
        totalEnrichments.incrementAndGet();
        totalTimeMs.addAndGet(elapsedMs);
        parallelTasks.addAndGet(tasks);
        enrichmentTimer.record(elapsedMs, TimeUnit.MILLISECONDS);
    }

    public void recordFailure() {
        failedTasks.incrementAndGet();
        taskFailures.increment();
    }

    public PerformanceSnapshot snapshot() {
        long count = totalEnrichments.get();
        long time = totalTimeMs.get();
        return PerformanceSnapshot.builder()
                .totalEnrichments(count)
                .totalTimeMs(time)
                .averageTimeMs(count == 0 ? 0.0 : (double) time / count)
                .parallelTasks(parallelTasks.get())
                .failedTasks(failedTasks.get())
                .build();
    }
}
