package com.geoenrich.geometry;

import com.geoenrich.exception.GeometryException;
import com.geoenrich.model.LatLon;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

import static org.junit.jupiter.api.Assertions.*;

class GeometryNormalizerTest {

    private final GeometryNormalizer normalizer = new GeometryNormalizer();
    private final GeometryFactory geometryFactory = new GeometryFactory();

    @Test
    void testRoundTripWithinMicroDegree() {
        double[][] samples = {{0, 0}, {42.4, -71.19}, {-33.86, 151.21}, {84.9, 179.9}, {-84.9, -179.9}, {29.76, -95.37}};
        for (double[] sample : samples) {
            LatLon original = LatLon.of(sample[0], sample[1]);
            double[] xy = GeometryNormalizer.fromWgs84(original);
            LatLon back = GeometryNormalizer.toWgs84(xy[0], xy[1]);

            assertEquals(original.getLat(), back.getLat(), 1e-6, "lat for " + original);
            assertEquals(original.getLon(), back.getLon(), 1e-6, "lon for " + original);
        }
    }

    @Test
    void testDetectCrs() {
        Point geographic = geometryFactory.createPoint(new Coordinate(-95.37, 29.76));
        Point projected = geometryFactory.createPoint(new Coordinate(-7925000, 5225000));

        assertEquals(CrsKind.GEOGRAPHIC, normalizer.detectCrs(geographic));
        assertEquals(CrsKind.PROJECTED, normalizer.detectCrs(projected));
    }

    @Test
    void testWebMercatorPolygonLandsInMassachusetts() {
        // Given a ring in Web Mercator meters around (-7925000, 5225000)
        Polygon mercator = geometryFactory.createPolygon(new Coordinate[]{
                new Coordinate(-7926000, 5224000),
                new Coordinate(-7924000, 5224000),
                new Coordinate(-7924000, 5226000),
                new Coordinate(-7926000, 5226000),
                new Coordinate(-7926000, 5224000)
        });

        // When
        Geometry normalized = normalizer.normalize(mercator);

        // Then every vertex is geographic and near Boston
        assertEquals(CrsKind.GEOGRAPHIC, normalizer.detectCrs(normalized));
        for (Coordinate c : normalized.getCoordinates()) {
            assertEquals(-71.19, c.getX(), 0.02);
            assertEquals(42.43, c.getY(), 0.02);
        }
        // the input is left untouched
        assertEquals(-7926000, mercator.getCoordinates()[0].getX());
    }

    @Test
    void testGeographicInputIsReturnedAsEqualCopy() {
        Point point = geometryFactory.createPoint(new Coordinate(-95.37, 29.76));

        Geometry normalized = normalizer.normalize(point);

        assertNotSame(point, normalized);
        assertTrue(point.equalsExact(normalized));
    }

    @Test
    void testRejectsMissingAndNonFiniteGeometry() {
        assertThrows(GeometryException.class, () -> normalizer.normalize(null));
        assertThrows(GeometryException.class, () -> normalizer.normalize(geometryFactory.createPoint()));
        Point nan = geometryFactory.createPoint(new Coordinate(Double.NaN, 10));
        assertThrows(GeometryException.class, () -> normalizer.normalize(nan));
    }
}
