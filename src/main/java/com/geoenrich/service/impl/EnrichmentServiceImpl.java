package com.geoenrich.service.impl;

import com.geoenrich.aspect.Timed;
import com.geoenrich.model.LatLon;
import com.geoenrich.model.result.EnrichmentResult;
import com.geoenrich.provider.EnrichmentProvider;
import com.geoenrich.provider.EnrichmentProviderRegistry;
import com.geoenrich.service.EnrichmentMetrics;
import com.geoenrich.service.EnrichmentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fans one location out to all requested providers on the enrichment executor and
 * merges their outputs after every task has settled
 */
@Slf4j
@Service
public class EnrichmentServiceImpl implements EnrichmentService {

    private final EnrichmentProviderRegistry registry;
    private final Executor executor;
    private final EnrichmentMetrics metrics;

    @Autowired
    public EnrichmentServiceImpl(EnrichmentProviderRegistry registry,
                                 @Qualifier("enrichmentExecutor") Executor executor,
                                 EnrichmentMetrics metrics) {
        this.registry = registry;
        this.executor = executor;
        this.metrics = metrics;
    }

    @Override
    @Timed("enrichment.types")
    public Map<String, Object> enrich(LatLon origin, Map<String, Double> radiusByType, Collection<String> selectedTypes) {
        long start = System.currentTimeMillis();
        Set<String> types = new LinkedHashSet<>(registry.getAlwaysOn());
        if (selectedTypes != null) {
            selectedTypes.stream()
                    .filter(type -> type != null && !type.isBlank())
                    .forEach(types::add);
        }
        Map<String, Double> radii = radiusByType == null ? Map.of() : radiusByType;

        Map<String, CompletableFuture<Map<String, Object>>> tasks = new LinkedHashMap<>();
        for (String type : types) {
            tasks.put(type, submit(type, origin, radii.get(type)));
        }
        CompletableFuture.allOf(tasks.values().toArray(new CompletableFuture[0])).join();

        Map<String, Object> merged = new LinkedHashMap<>();
        tasks.values().forEach(task -> merged.putAll(task.join()));

        long elapsed = System.currentTimeMillis() - start;
        metrics.recordEnrichment(elapsed, tasks.size());
        log.info("Enriched {} with {} type(s) in {}ms", origin, tasks.size(), elapsed);
        return merged;
    }

    /**
     * The inner {@link #enrich} call is not proxied
     */
    @Override
    @Timed(value = "enrichment.location", logLevel = Timed.LogLevel.INFO)
    public EnrichmentResult enrichLocation(LatLon origin, Map<String, Double> radiusByType, Collection<String> selectedTypes) {
        long start = System.currentTimeMillis();
        Map<String, Object> enrichments = enrich(origin, radiusByType, selectedTypes);
        return EnrichmentResult.builder()
                .location(origin)
                .enrichments(enrichments)
                .elapsedMs(System.currentTimeMillis() - start)
                .build();
    }

    /**
     * The returned future never completes exceptionally
     */
    private CompletableFuture<Map<String, Object>> submit(String type, LatLon origin, Double requestedRadius) {
        CompletableFuture<Map<String, Object>> task;
        try {
            task = CompletableFuture.supplyAsync(() -> runProvider(type, origin, requestedRadius), executor);
        } catch (RejectedExecutionException e) {
            task = CompletableFuture.failedFuture(e);
        }
        return task.exceptionally(e -> errorEntry(type, e));
    }

    private Map<String, Object> runProvider(String type, LatLon origin, Double requestedRadius) {
        EnrichmentProvider provider = registry.require(type);
        Map<String, Object> result = provider.enrich(origin, provider.resolveRadiusMiles(requestedRadius));
        return result == null ? Map.of() : result;
    }

    private Map<String, Object> errorEntry(String type, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        log.error("Enrichment '{}' failed: {}", type, message);
        metrics.recordFailure();
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put(type + "_error", message);
        return entry;
    }
}
