package com.geoenrich.query;

import com.geoenrich.model.AnnotatedFeature;
import com.geoenrich.model.ProximityResultSet;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Merges the containment pass and the buffered pass into one {@link ProximityResultSet}.
 * Containment wins: a feature seen by both passes is reported once, as containing.
 * Features without an identity are not collapsed by identity; a containing one is dropped
 * only when an already kept containing feature has exactly the same geometry.
 */
@Component
public class FeatureDeduplicator {

    public ProximityResultSet merge(List<AnnotatedFeature> containingCandidates,
                                    List<AnnotatedFeature> nearbyCandidates) {
        Set<String> seen = new HashSet<>();
        List<AnnotatedFeature> containing = new ArrayList<>();
        List<AnnotatedFeature> nearby = new ArrayList<>();

        for (AnnotatedFeature feature : concat(containingCandidates, nearbyCandidates)) {
            if (!feature.isContaining()) {
                continue;
            }
            if (feature.getIdentity() == null) {
                if (!sameGeometryKept(containing, feature)) {
                    containing.add(feature);
                }
            } else if (seen.add(feature.getIdentity())) {
                containing.add(feature);
            }
        }
        for (AnnotatedFeature feature : concat(containingCandidates, nearbyCandidates)) {
            if (feature.isContaining()) {
                continue;
            }
            if (feature.getIdentity() == null || seen.add(feature.getIdentity())) {
                nearby.add(feature);
            }
        }

        // List.sort is stable, so equal distances keep arrival order
        nearby.sort(Comparator.comparingDouble(AnnotatedFeature::getDistanceMiles));

        return ProximityResultSet.builder()
                .containing(containing)
                .nearby(nearby)
                .build();
    }

    private static boolean sameGeometryKept(List<AnnotatedFeature> kept, AnnotatedFeature candidate) {
        Geometry geometry = candidate.getGeometry();
        if (geometry == null) {
            return false;
        }
        for (AnnotatedFeature feature : kept) {
            if (feature.getIdentity() == null && feature.getGeometry() != null
                    && feature.getGeometry().equalsExact(geometry)) {
                return true;
            }
        }
        return false;
    }

    private static List<AnnotatedFeature> concat(List<AnnotatedFeature> first, List<AnnotatedFeature> second) {
        List<AnnotatedFeature> all = new ArrayList<>();
        if (first != null) {
            all.addAll(first);
        }
        if (second != null) {
            all.addAll(second);
        }
        return all;
    }
}
