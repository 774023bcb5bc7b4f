package com.geoenrich.service;

import com.geoenrich.model.AnnotatedFeature;
import com.geoenrich.model.LatLon;
import com.geoenrich.model.ProximityResultSet;
import com.geoenrich.model.QuerySpec;
import com.geoenrich.source.SpatialSource;

import java.util.List;

/**
 * Proximity engine entry points over a single {@link SpatialSource}
 */
public interface ProximityService {

    /**
     * Features containing {@code origin} plus features within {@code radiusMiles}, merged
     * and sorted
     */
    ProximityResultSet queryProximity(LatLon origin, double radiusMiles, SpatialSource source);

    /**
     * Only the features whose geometry contains {@code origin}
     */
    List<AnnotatedFeature> queryContaining(LatLon origin, SpatialSource source);

    ProximityResultSet query(QuerySpec spec, SpatialSource source);
}
