package com.geoenrich.query;

import com.geoenrich.exception.GeometryException;
import com.geoenrich.geometry.DistanceEngine;
import com.geoenrich.geometry.GeometryNormalizer;
import com.geoenrich.model.AnnotatedFeature;
import com.geoenrich.model.FeatureAttributes;
import com.geoenrich.model.FieldAliases;
import com.geoenrich.model.LatLon;
import com.geoenrich.model.RawFeature;
import lombok.RequiredArgsConstructor;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Lineal;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygonal;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Normalizes a raw feature's geometry and annotates it with containment and distance
 */
@Component
@RequiredArgsConstructor
public class ResultClassifier {

    private final GeometryNormalizer geometryNormalizer;

    /**
     * @throws GeometryException when the geometry is missing, degenerate or of an unsupported kind
     */
    public AnnotatedFeature classify(LatLon origin, RawFeature feature, List<String> identityFields,
                                     FieldAliases aliases) {
        Geometry geometry = geometryNormalizer.normalize(feature.getGeometry());
        FeatureAttributes attributes = feature.getAttributes() == null
                ? FeatureAttributes.empty()
                : feature.getAttributes();

        boolean containing = false;
        double distance;
        if (geometry instanceof Point) {
            Point point = (Point) geometry;
            distance = DistanceEngine.haversine(origin.getLat(), origin.getLon(), point.getY(), point.getX());
        } else if (geometry instanceof Lineal) {
            distance = DistanceEngine.pointToPolyline(origin, geometry);
        } else if (geometry instanceof Polygonal) {
            containing = DistanceEngine.pointInPolygonal(origin, geometry);
            distance = containing ? 0.0 : DistanceEngine.distanceToPolygonalBoundary(origin, geometry);
        } else {
            throw new GeometryException("Unsupported geometry type: " + geometry.getGeometryType());
        }

        String identity = attributes.first(identityFields).map(String::valueOf).orElse(null);

        return AnnotatedFeature.builder()
                .identity(identity)
                .sourceId(feature.getSourceId())
                .geometry(geometry)
                .attributes(aliases == null ? attributes : attributes.canonicalize(aliases))
                .distanceMiles(distance)
                .containing(containing)
                .build();
    }

    /**
     * A feature belongs in a result when it contains the origin or lies within the radius
     */
    public static boolean isIncluded(AnnotatedFeature feature, double radiusMiles) {
        return feature.isContaining() || feature.getDistanceMiles() <= radiusMiles;
    }
}
