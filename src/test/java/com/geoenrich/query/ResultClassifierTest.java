package com.geoenrich.query;

import com.geoenrich.exception.GeometryException;
import com.geoenrich.geometry.DistanceEngine;
import com.geoenrich.geometry.GeometryNormalizer;
import com.geoenrich.model.AnnotatedFeature;
import com.geoenrich.model.FeatureAttributes;
import com.geoenrich.model.FieldAliases;
import com.geoenrich.model.LatLon;
import com.geoenrich.model.RawFeature;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ResultClassifierTest {

    private static final LatLon ORIGIN = LatLon.of(29.76, -95.37);

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final ResultClassifier classifier = new ResultClassifier(new GeometryNormalizer());

    @Test
    void testPointUsesHaversine() {
        RawFeature feature = feature(geometryFactory.createPoint(new Coordinate(-95.36, 29.77)), Map.of("OBJECTID", 5));

        AnnotatedFeature annotated = classify(feature);

        assertFalse(annotated.isContaining());
        assertEquals(DistanceEngine.haversine(ORIGIN, LatLon.of(29.77, -95.36)), annotated.getDistanceMiles(), 1e-12);
        assertEquals("5", annotated.getIdentity());
    }

    @Test
    void testPolylineUsesNearestSegment() {
        Geometry road = geometryFactory.createLineString(new Coordinate[]{
                new Coordinate(-95.40, 29.78), new Coordinate(-95.30, 29.78)});

        AnnotatedFeature annotated = classify(feature(road, Map.of()));

        assertEquals(DistanceEngine.haversine(ORIGIN, LatLon.of(29.78, -95.37)), annotated.getDistanceMiles(), 1e-6);
        assertNull(annotated.getIdentity());
    }

    @Test
    void testPolygonContainingOriginHasZeroDistance() {
        AnnotatedFeature annotated = classify(feature(box(-95.40, 29.70, -95.30, 29.80), Map.of("FID", 1)));

        assertTrue(annotated.isContaining());
        assertEquals(0.0, annotated.getDistanceMiles());
    }

    @Test
    void testPolygonElsewhereMeasuresToBoundary() {
        AnnotatedFeature annotated = classify(feature(box(-95.36, 29.70, -95.30, 29.80), Map.of()));

        assertFalse(annotated.isContaining());
        assertEquals(DistanceEngine.haversine(ORIGIN, LatLon.of(29.76, -95.36)), annotated.getDistanceMiles(), 1e-6);
    }

    @Test
    void testWebMercatorGeometryIsNormalizedFirst() {
        double[] sw = GeometryNormalizer.fromWgs84(LatLon.of(29.70, -95.40));
        double[] ne = GeometryNormalizer.fromWgs84(LatLon.of(29.80, -95.30));

        AnnotatedFeature annotated = classify(feature(box(sw[0], sw[1], ne[0], ne[1]), Map.of()));

        assertTrue(annotated.isContaining());
        assertTrue(Math.abs(annotated.getGeometry().getCoordinates()[0].getX()) <= 180.0);
    }

    @Test
    void testIdentityAndAliasesResolved() {
        FieldAliases aliases = FieldAliases.of(Map.of("name", List.of("NAME", "Name")));
        RawFeature feature = feature(geometryFactory.createPoint(new Coordinate(-95.37, 29.76)),
                Map.of("GlobalID", "{A1}", "Name", "Montrose"));

        AnnotatedFeature annotated = classifier.classify(ORIGIN, feature, FieldAliases.DEFAULT_IDENTITY_FIELDS, aliases);

        assertEquals("{A1}", annotated.getIdentity());
        assertEquals("Montrose", annotated.getFields().get("name"));
        assertEquals("test", annotated.getSourceId());
    }

    @Test
    void testUnsupportedGeometryIsRejected() {
        Geometry collection = geometryFactory.createGeometryCollection(new Geometry[]{
                geometryFactory.createPoint(new Coordinate(-95.37, 29.76))});

        assertThrows(GeometryException.class, () -> classify(feature(collection, Map.of())));
        assertThrows(GeometryException.class, () -> classify(feature(null, Map.of())));
    }

    @Test
    void testInclusionRule() {
        AnnotatedFeature near = AnnotatedFeature.builder().distanceMiles(0.9).build();
        AnnotatedFeature far = AnnotatedFeature.builder().distanceMiles(1.1).build();
        AnnotatedFeature containing = AnnotatedFeature.builder().containing(true).distanceMiles(0).build();

        assertTrue(ResultClassifier.isIncluded(near, 1.0));
        assertFalse(ResultClassifier.isIncluded(far, 1.0));
        assertTrue(ResultClassifier.isIncluded(containing, 0.0));
    }

    private AnnotatedFeature classify(RawFeature feature) {
        return classifier.classify(ORIGIN, feature, FieldAliases.DEFAULT_IDENTITY_FIELDS, FieldAliases.empty());
    }

    private RawFeature feature(Geometry geometry, Map<String, Object> attributes) {
        return RawFeature.builder()
                .geometry(geometry)
                .attributes(FeatureAttributes.of(attributes))
                .sourceId("test")
                .build();
    }

    private Geometry box(double minX, double minY, double maxX, double maxY) {
        return geometryFactory.createPolygon(new Coordinate[]{
                new Coordinate(minX, minY), new Coordinate(maxX, minY), new Coordinate(maxX, maxY),
                new Coordinate(minX, maxY), new Coordinate(minX, minY)});
    }
}
