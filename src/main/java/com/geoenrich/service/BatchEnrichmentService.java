package com.geoenrich.service;

import com.geoenrich.model.LatLon;
import com.geoenrich.model.result.EnrichmentResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Sequential enrichment of many locations, rate limited for a shared upstream
 */
public interface BatchEnrichmentService {

    @FunctionalInterface
    interface ProgressListener {

        ProgressListener NONE = (current, total, estimatedRemainingMs) -> {
        };

        void onProgress(int current, int total, long estimatedRemainingMs);
    }

    List<EnrichmentResult> enrichBatch(List<LatLon> locations, Map<String, Double> radiusByType,
                                       Collection<String> selectedTypes, ProgressListener listener);
}
