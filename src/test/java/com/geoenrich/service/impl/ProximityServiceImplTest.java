package com.geoenrich.service.impl;

import com.geoenrich.exception.NetworkException;
import com.geoenrich.geometry.GeometryNormalizer;
import com.geoenrich.model.AnnotatedFeature;
import com.geoenrich.model.FeatureAttributes;
import com.geoenrich.model.FieldAliases;
import com.geoenrich.model.LatLon;
import com.geoenrich.model.ProximityResultSet;
import com.geoenrich.model.RawFeature;
import com.geoenrich.model.SourcePage;
import com.geoenrich.model.SourceQuery;
import com.geoenrich.query.FeatureDeduplicator;
import com.geoenrich.query.ResultClassifier;
import com.geoenrich.query.SpatialQueryPaginator;
import com.geoenrich.source.ScriptedSource;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProximityServiceImplTest {

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final ProximityServiceImpl proximityService = new ProximityServiceImpl(
            new SpatialQueryPaginator(100000, 0),
            new ResultClassifier(new GeometryNormalizer()),
            new FeatureDeduplicator());

    @Test
    void testContainingPolygonIsNotRepeatedInNearby() {
        // Given a neighborhood polygon around downtown Houston returned by both passes
        LatLon origin = LatLon.of(29.76, -95.37);
        RawFeature neighborhood = feature(box(-95.40, 29.74, -95.365, 29.78), Map.of("OBJECTID", 42, "NAME", "Downtown"));
        RawFeature neighborhoodAgain = feature(box(-95.40, 29.74, -95.365, 29.78), Map.of("OBJECTID", 42, "NAME", "Downtown"));
        RawFeature nextDoor = feature(box(-95.365, 29.74, -95.33, 29.78), Map.of("OBJECTID", 43, "NAME", "East End"));
        ScriptedSource source = ScriptedSource.twoPass("houston_neighborhoods",
                List.of(neighborhood), List.of(neighborhoodAgain, nextDoor))
                .withFieldAliases(FieldAliases.of(Map.of("name", List.of("NAME"))));

        // When
        ProximityResultSet result = proximityService.queryProximity(origin, 1.0, source);

        // Then
        assertEquals(1, result.getContaining().size());
        AnnotatedFeature downtown = result.getContaining().get(0);
        assertEquals("42", downtown.getIdentity());
        assertEquals(0.0, downtown.getDistanceMiles());
        assertEquals("Downtown", downtown.getFields().get("name"));

        assertEquals(1, result.getNearby().size());
        assertEquals("43", result.getNearby().get(0).getIdentity());
        assertTrue(result.getNearby().get(0).getDistanceMiles() <= 1.0);
        assertTrue(result.getNearby().stream().noneMatch(f -> "42".equals(f.getIdentity())));
    }

    @Test
    void testSinglePolygonAroundOriginIsContainingOnly() {
        // Given one polygon around (43.0, -71.5), returned by both passes
        LatLon origin = LatLon.of(43.0, -71.5);
        ScriptedSource source = ScriptedSource.twoPass("nh_towns",
                List.of(feature(box(-71.6, 42.9, -71.4, 43.1), Map.of("OBJECTID", 7))),
                List.of(feature(box(-71.6, 42.9, -71.4, 43.1), Map.of("OBJECTID", 7))));

        // When
        ProximityResultSet result = proximityService.queryProximity(origin, 5.0, source);

        // Then
        assertEquals(1, result.getContaining().size());
        assertEquals(0.0, result.getContaining().get(0).getDistanceMiles());
        assertTrue(result.getNearby().isEmpty());
    }

    @Test
    void testWebMercatorRingsAreNormalizedBeforeDistance() {
        // Given rings around (-7925000, 5225000) in Web Mercator meters
        Geometry mercatorBlock = box(-7925500, 5224500, -7924500, 5225500);
        Geometry mercatorNeighbor = box(-7924400, 5224500, -7923400, 5225500);
        LatLon origin = GeometryNormalizer.toWgs84(-7925000, 5225000);
        ScriptedSource source = ScriptedSource.twoPass("ma_parcels",
                List.of(feature(mercatorBlock, Map.of("FID", 1))),
                List.of(feature(mercatorNeighbor, Map.of("FID", 2))));

        // When
        ProximityResultSet result = proximityService.queryProximity(origin, 2.0, source);

        // Then the results are in continental US degrees and distances are sane
        assertEquals(42.43, origin.getLat(), 0.02);
        assertEquals(-71.19, origin.getLon(), 0.02);
        assertEquals(1, result.getContaining().size());
        assertEquals(1, result.getNearby().size());
        for (AnnotatedFeature feature : result.all()) {
            for (Coordinate c : feature.getGeometry().getCoordinates()) {
                assertTrue(c.getX() > -125 && c.getX() < -66, "lon " + c.getX());
                assertTrue(c.getY() > 24 && c.getY() < 50, "lat " + c.getY());
            }
        }
        double neighborMiles = result.getNearby().get(0).getDistanceMiles();
        assertTrue(neighborMiles > 0.0 && neighborMiles < 1.0, "distance " + neighborMiles);
    }

    @Test
    void testFeaturesBeyondRadiusAreExcluded() {
        LatLon origin = LatLon.of(29.76, -95.37);
        RawFeature close = feature(geometryFactory.createPoint(new Coordinate(-95.37, 29.765)), Map.of("OBJECTID", 1));
        RawFeature far = feature(geometryFactory.createPoint(new Coordinate(-95.20, 29.76)), Map.of("OBJECTID", 2));
        ScriptedSource source = ScriptedSource.twoPass("parks", List.of(), List.of(far, close));

        ProximityResultSet result = proximityService.queryProximity(origin, 1.0, source);

        assertTrue(result.getContaining().isEmpty());
        assertEquals(1, result.getNearby().size());
        assertEquals("1", result.getNearby().get(0).getIdentity());
    }

    @Test
    void testQueryContainingSkipsBufferedPass() {
        LatLon origin = LatLon.of(29.76, -95.37);
        ScriptedSource source = ScriptedSource.twoPass("zones",
                List.of(feature(box(-95.40, 29.74, -95.34, 29.78), Map.of("OBJECTID", 9))), List.of());

        List<AnnotatedFeature> containing = proximityService.queryContaining(origin, source);

        assertEquals(1, containing.size());
        assertTrue(source.getRequests().stream().noneMatch(SourceQuery::isBuffered));
    }

    @Test
    void testMalformedGeometryDropsOnlyThatFeature() {
        LatLon origin = LatLon.of(29.76, -95.37);
        RawFeature broken = feature(geometryFactory.createGeometryCollection(), Map.of("OBJECTID", 1));
        RawFeature fine = feature(geometryFactory.createPoint(new Coordinate(-95.371, 29.761)), Map.of("OBJECTID", 2));
        ScriptedSource source = ScriptedSource.twoPass("mixed", List.of(), List.of(broken, fine));

        ProximityResultSet result = proximityService.queryProximity(origin, 1.0, source);

        assertEquals(1, result.totalCount());
        assertEquals("2", result.getNearby().get(0).getIdentity());
    }

    @Test
    void testFailureBeforeAnyPagePropagates() {
        ScriptedSource source = new ScriptedSource("down", 1000, query -> {
            throw new NetworkException("HTTP 502");
        });

        NetworkException e = assertThrows(NetworkException.class,
                () -> proximityService.queryProximity(LatLon.of(29.76, -95.37), 1.0, source));
        assertEquals("HTTP 502", e.getMessage());
    }

    @Test
    void testPartialPaginationKeepsFetchedFeatures() {
        LatLon origin = LatLon.of(29.76, -95.37);
        ScriptedSource source = new ScriptedSource("flaky", 1, query -> {
            if (!query.isBuffered()) {
                return SourcePage.empty();
            }
            if (query.getOffset() == 0) {
                return SourcePage.builder()
                        .features(List.of(feature(geometryFactory.createPoint(new Coordinate(-95.371, 29.761)), Map.of("OBJECTID", 1))))
                        .build();
            }
            throw new NetworkException("timeout");
        });

        ProximityResultSet result = proximityService.queryProximity(origin, 1.0, source);

        assertEquals(1, result.getNearby().size());
    }

    @Test
    void testZeroRadiusSkipsNearbyPass() {
        LatLon origin = LatLon.of(29.76, -95.37);
        ScriptedSource source = ScriptedSource.twoPass("zones", List.of(), List.of());

        proximityService.queryProximity(origin, 0.0, source);

        assertEquals(1, source.getRequests().size());
        assertFalse(source.getRequests().get(0).isBuffered());
    }

    private RawFeature feature(Geometry geometry, Map<String, Object> attributes) {
        return RawFeature.builder()
                .geometry(geometry)
                .attributes(FeatureAttributes.of(attributes))
                .build();
    }

    private Geometry box(double minX, double minY, double maxX, double maxY) {
        return geometryFactory.createPolygon(new Coordinate[]{
                new Coordinate(minX, minY), new Coordinate(maxX, minY), new Coordinate(maxX, maxY),
                new Coordinate(minX, maxY), new Coordinate(minX, minY)});
    }
}
