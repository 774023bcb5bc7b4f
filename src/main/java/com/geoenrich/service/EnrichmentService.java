package com.geoenrich.service;

import com.geoenrich.model.LatLon;
import com.geoenrich.model.result.EnrichmentResult;

import java.util.Collection;
import java.util.Map;

/**
 * Runs every requested enrichment type for one location concurrently
 */
public interface EnrichmentService {

    /**
     * Enrich {@code origin} with the always-on types plus {@code selectedTypes}.
     * A type that fails contributes a {@code <type>_error} entry instead of its results;
     * this method does not throw for per-type failures.
     *
     * @param radiusByType requested radius in miles per type; missing means the type's default
     */
    Map<String, Object> enrich(LatLon origin, Map<String, Double> radiusByType, Collection<String> selectedTypes);

    /**
     * Same as {@link #enrich} with location and timing attached
     */
    EnrichmentResult enrichLocation(LatLon origin, Map<String, Double> radiusByType, Collection<String> selectedTypes);
}
