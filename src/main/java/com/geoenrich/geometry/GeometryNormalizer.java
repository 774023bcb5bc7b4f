package com.geoenrich.geometry;

import com.geoenrich.exception.GeometryException;
import com.geoenrich.model.LatLon;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Geometry;
import org.springframework.stereotype.Component;

/**
 * Brings raw service geometries into WGS84 degrees (x = lon, y = lat).
 *
 * <p>CRS detection is a magnitude heuristic: any coordinate with |x| &gt; 180 or
 * |y| &gt; 90 marks the whole geometry as spherical Web Mercator. This is ambiguous near
 * the antimeridian and the poles and is kept as a known approximation.
 */
@Slf4j
@Component
public class GeometryNormalizer {

    /** Half the Web Mercator world width in meters */
    public static final double MERCATOR_EXTENT = 20037508.34;

    public CrsKind detectCrs(Geometry geometry) {
        if (geometry == null || geometry.isEmpty()) {
            return CrsKind.GEOGRAPHIC;
        }
        for (Coordinate coordinate : geometry.getCoordinates()) {
            if (Math.abs(coordinate.getX()) > 180.0 || Math.abs(coordinate.getY()) > 90.0) {
                return CrsKind.PROJECTED;
            }
        }
        return CrsKind.GEOGRAPHIC;
    }

    /**
     * Inverse spherical Mercator
     */
    public static LatLon toWgs84(double x, double y) {
        return LatLon.of(mercatorYToLat(y), mercatorXToLon(x));
    }

    /**
     * Forward spherical Mercator, returned as {x, y}
     */
    public static double[] fromWgs84(LatLon point) {
        double x = point.getLon() * MERCATOR_EXTENT / 180.0;
        double y = Math.log(Math.tan((90.0 + point.getLat()) * Math.PI / 360.0)) / Math.PI * MERCATOR_EXTENT;
        return new double[]{x, y};
    }

    static double mercatorXToLon(double x) {
        return x / MERCATOR_EXTENT * 180.0;
    }

    static double mercatorYToLat(double y) {
        return 180.0 / Math.PI * (2.0 * Math.atan(Math.exp(y / MERCATOR_EXTENT * Math.PI)) - Math.PI / 2.0);
    }

    /**
     * Returns a copy of the geometry in WGS84 degrees; the input is never modified.
     *
     * @throws GeometryException for null, empty or non-finite geometries
     */
    public Geometry normalize(Geometry geometry) {
        if (geometry == null || geometry.isEmpty()) {
            throw new GeometryException("Geometry is missing or empty");
        }
        for (Coordinate coordinate : geometry.getCoordinates()) {
            if (!Double.isFinite(coordinate.getX()) || !Double.isFinite(coordinate.getY())) {
                throw new GeometryException("Geometry has non-finite coordinates");
            }
        }

        Geometry copy = geometry.copy();
        if (detectCrs(geometry) == CrsKind.GEOGRAPHIC) {
            return copy;
        }

        copy.apply(new MercatorToWgs84Filter());
        copy.geometryChanged();
        log.trace("Converted {} from Web Mercator to WGS84", geometry.getGeometryType());
        return copy;
    }

    private static final class MercatorToWgs84Filter implements CoordinateSequenceFilter {

        @Override
        public void filter(CoordinateSequence sequence, int i) {
            double x = sequence.getX(i);
            double y = sequence.getY(i);
            sequence.setOrdinate(i, CoordinateSequence.X, mercatorXToLon(x));
            sequence.setOrdinate(i, CoordinateSequence.Y, mercatorYToLat(y));
        }

        @Override
        public boolean isDone() {
            return false;
        }

        @Override
        public boolean isGeometryChanged() {
            return true;
        }
    }
}
