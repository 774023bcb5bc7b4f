package com.geoenrich.provider;

import com.geoenrich.config.SourceDefinition;
import com.geoenrich.model.LatLon;
import com.geoenrich.model.ProximityResultSet;
import com.geoenrich.model.QuerySpec;
import com.geoenrich.service.ProximityService;
import com.geoenrich.source.SpatialSource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Enrichment type backed by a configured feature service
 */
public class FeatureSourceProvider implements EnrichmentProvider {

    private final SourceDefinition definition;
    private final SpatialSource source;
    private final ProximityService proximityService;

    public FeatureSourceProvider(SourceDefinition definition, SpatialSource source, ProximityService proximityService) {
        this.definition = definition;
        this.source = source;
        this.proximityService = proximityService;
    }

    @Override
    public String getType() {
        return definition.getId();
    }

    public SourceDefinition getDefinition() {
        return definition;
    }

    @Override
    public Double resolveRadiusMiles(Double requestedMiles) {
        return definition.capRadius(requestedMiles);
    }

    @Override
    public Map<String, Object> enrich(LatLon origin, Double radiusMiles) {
        double radius = radiusMiles != null ? radiusMiles : resolveRadiusMiles(null);
        QuerySpec spec = QuerySpec.builder()
                .origin(origin)
                .radiusMiles(radius)
                .wantContaining(definition.isContainment())
                .build();
        ProximityResultSet result = proximityService.query(spec, source);

        String type = getType();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put(type + "_containing", result.getContaining());
        out.put(type + "_nearby", result.getNearby());
        out.put(type + "_count", result.totalCount());
        out.put(type + "_containing_count", result.getContaining().size());
        out.put(type + "_nearby_count", result.getNearby().size());
        out.put(type + "_radius_miles", radius);
        return out;
    }
}
