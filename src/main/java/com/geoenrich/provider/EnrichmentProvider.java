package com.geoenrich.provider;

import com.geoenrich.model.LatLon;

import java.util.Map;

/**
 * One enrichment type. Output keys are namespaced so that results of different types can
 * be merged into one map without collisions.
 */
public interface EnrichmentProvider {

    String getType();

    /**
     * Radius actually used for a request; null when the type has no radius
     */
    default Double resolveRadiusMiles(Double requestedMiles) {
        return null;
    }

    /**
     * @throws com.geoenrich.exception.EnrichmentException on any failure; the caller turns it
     *                                                     into a {@code <type>_error} entry
     */
    Map<String, Object> enrich(LatLon origin, Double radiusMiles);
}
