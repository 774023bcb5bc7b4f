package com.geoenrich.service.impl;

import com.geoenrich.aspect.Timed;
import com.geoenrich.exception.GeometryException;
import com.geoenrich.model.AnnotatedFeature;
import com.geoenrich.model.LatLon;
import com.geoenrich.model.ProximityResultSet;
import com.geoenrich.model.QuerySpec;
import com.geoenrich.model.RawFeature;
import com.geoenrich.query.FeatureDeduplicator;
import com.geoenrich.query.PagedFeatures;
import com.geoenrich.query.ResultClassifier;
import com.geoenrich.query.SpatialQueryPaginator;
import com.geoenrich.service.ProximityService;
import com.geoenrich.source.SpatialSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a containment pass and a buffered pass against one source, classifies every
 * returned feature locally and merges the two candidate lists
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProximityServiceImpl implements ProximityService {

    private final SpatialQueryPaginator paginator;
    private final ResultClassifier classifier;
    private final FeatureDeduplicator deduplicator;

    @Override
    @Timed("proximity.nearby")
    public ProximityResultSet queryProximity(LatLon origin, double radiusMiles, SpatialSource source) {
        return query(QuerySpec.proximity(origin, radiusMiles), source);
    }

    @Override
    @Timed("proximity.containing")
    public List<AnnotatedFeature> queryContaining(LatLon origin, SpatialSource source) {
        return query(QuerySpec.containing(origin), source).getContaining();
    }

    @Override
    @Timed("proximity.query")
    public ProximityResultSet query(QuerySpec spec, SpatialSource source) {
        LatLon origin = spec.getOrigin();
        List<AnnotatedFeature> containing = new ArrayList<>();
        List<AnnotatedFeature> nearby = new ArrayList<>();

        if (spec.isWantContaining()) {
            PagedFeatures pass = runPass(source, origin, null);
            classifyInto(pass, spec, source, containing, nearby);
        }
        if (spec.isWantNearby() && spec.getRadiusMiles() > 0) {
            PagedFeatures pass = runPass(source, origin, spec.getRadiusMiles());
            classifyInto(pass, spec, source, containing, nearby);
        }

        ProximityResultSet result = deduplicator.merge(containing, nearby);
        log.debug("Source '{}': {} containing, {} nearby within {} mi",
                source.getId(), result.getContaining().size(), result.getNearby().size(), spec.getRadiusMiles());
        return result;
    }

    private PagedFeatures runPass(SpatialSource source, LatLon origin, Double bufferMiles) {
        PagedFeatures pass = paginator.paginate(source, origin, bufferMiles);
        if (pass.isFailedEmpty()) {
            throw pass.getFailure();
        }
        if (!pass.isComplete()) {
            log.warn("Source '{}' {} pass incomplete ({}), continuing with {} feature(s)",
                    source.getId(), bufferMiles == null ? "containment" : "proximity",
                    pass.getStopReason(), pass.getFeatures().size());
        }
        return pass;
    }

    private void classifyInto(PagedFeatures pass, QuerySpec spec, SpatialSource source,
                              List<AnnotatedFeature> containing, List<AnnotatedFeature> nearby) {
        for (RawFeature raw : pass.getFeatures()) {
            AnnotatedFeature feature;
            try {
                feature = classifier.classify(spec.getOrigin(), raw, source.getIdentityFields(), source.getFieldAliases());
            } catch (GeometryException e) {
                log.debug("Dropping feature from '{}': {}", source.getId(), e.getMessage());
                continue;
            }
            if (feature.isContaining()) {
                containing.add(feature);
            } else if (spec.isWantNearby() && ResultClassifier.isIncluded(feature, spec.getRadiusMiles())) {
                nearby.add(feature);
            }
        }
    }
}
