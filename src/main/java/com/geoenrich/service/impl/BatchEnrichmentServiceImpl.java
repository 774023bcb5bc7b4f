package com.geoenrich.service.impl;

import com.geoenrich.config.EnrichmentProperties;
import com.geoenrich.model.LatLon;
import com.geoenrich.model.result.EnrichmentResult;
import com.geoenrich.service.BatchEnrichmentService;
import com.geoenrich.service.EnrichmentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One location at a time, with a fixed minimum delay between locations
 */
@Slf4j
@Service
public class BatchEnrichmentServiceImpl implements BatchEnrichmentService {

    private final EnrichmentService enrichmentService;
    private final long minDelayMs;
    private final long estimatedMsPerLocation;

    @Autowired
    public BatchEnrichmentServiceImpl(EnrichmentService enrichmentService, EnrichmentProperties properties) {
        this(enrichmentService, properties.getBatch().getMinDelayMs(), properties.getBatch().getEstimatedMsPerLocation());
    }

    public BatchEnrichmentServiceImpl(EnrichmentService enrichmentService, long minDelayMs, long estimatedMsPerLocation) {
        this.enrichmentService = enrichmentService;
        this.minDelayMs = minDelayMs;
        this.estimatedMsPerLocation = estimatedMsPerLocation;
    }

    @Override
    public List<EnrichmentResult> enrichBatch(List<LatLon> locations, Map<String, Double> radiusByType,
                                              Collection<String> selectedTypes, ProgressListener listener) {
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;
        int total = locations.size();
        List<EnrichmentResult> results = new ArrayList<>(total);
        log.info("Starting batch enrichment of {} location(s)", total);

        for (int i = 0; i < total; i++) {
            LatLon location = locations.get(i);
            progress.onProgress(i + 1, total, (total - i) * estimatedMsPerLocation);
            results.add(enrichOne(location, radiusByType, selectedTypes));

            if (i < total - 1 && !pause()) {
                log.warn("Batch enrichment interrupted after {}/{} location(s)", i + 1, total);
                return results;
            }
        }

        log.info("Completed batch enrichment of {} location(s)", total);
        return results;
    }

    private EnrichmentResult enrichOne(LatLon location, Map<String, Double> radiusByType, Collection<String> selectedTypes) {
        long start = System.currentTimeMillis();
        try {
            return enrichmentService.enrichLocation(location, radiusByType, selectedTypes);
        } catch (RuntimeException e) {
            log.error("Batch enrichment failed for {}", location, e);
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return EnrichmentResult.builder()
                    .location(location)
                    .enrichments(error)
                    .elapsedMs(System.currentTimeMillis() - start)
                    .build();
        }
    }

    private boolean pause() {
        if (minDelayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(minDelayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
