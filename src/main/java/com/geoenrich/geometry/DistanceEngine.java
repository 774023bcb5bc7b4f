package com.geoenrich.geometry;

import com.geoenrich.model.LatLon;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;

/**
 * Great-circle distances in miles from a query point to points, polylines and polygons,
 * plus even-odd point-in-polygon. Geometries must already be in WGS84 (x = lon, y = lat).
 *
 * <p>Segment projection is planar in degree space, which is adequate at municipal and
 * regional scale. Nothing here rounds.
 */
public final class DistanceEngine {

    public static final double EARTH_RADIUS_MILES = 3958.8;

    /** Segments shorter than this (miles) are treated as a single point */
    static final double DEGENERATE_SEGMENT_MILES = 0.001;

    private DistanceEngine() {
    }

    public static double haversine(LatLon a, LatLon b) {
        return haversine(a.getLat(), a.getLon(), b.getLat(), b.getLon());
    }

    public static double haversine(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double h = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        // guards against h drifting past 1 through rounding
        h = Math.min(1.0, Math.max(0.0, h));
        return EARTH_RADIUS_MILES * 2 * Math.atan2(Math.sqrt(h), Math.sqrt(1 - h));
    }

    public static double pointToSegment(LatLon p, LatLon s1, LatLon s2) {
        return pointToSegment(p.getLat(), p.getLon(), s1.getLat(), s1.getLon(), s2.getLat(), s2.getLon());
    }

    static double pointToSegment(LatLon p, Coordinate s1, Coordinate s2) {
        return pointToSegment(p.getLat(), p.getLon(), s1.getY(), s1.getX(), s2.getY(), s2.getX());
    }

    private static double pointToSegment(double pLat, double pLon,
                                         double lat1, double lon1, double lat2, double lon2) {
        double segmentMiles = haversine(lat1, lon1, lat2, lon2);
        if (segmentMiles < DEGENERATE_SEGMENT_MILES) {
            return Math.min(haversine(pLat, pLon, lat1, lon1), haversine(pLat, pLon, lat2, lon2));
        }

        double dLat = lat2 - lat1;
        double dLon = lon2 - lon1;
        double lengthSquared = dLat * dLat + dLon * dLon;
        double t = ((pLat - lat1) * dLat + (pLon - lon1) * dLon) / lengthSquared;
        t = Math.max(0.0, Math.min(1.0, t));

        return haversine(pLat, pLon, lat1 + t * dLat, lon1 + t * dLon);
    }

    /**
     * Minimum distance over every segment of every path of a LineString or MultiLineString
     */
    public static double pointToPolyline(LatLon p, Geometry lineal) {
        double min = Double.POSITIVE_INFINITY;
        for (int n = 0; n < lineal.getNumGeometries(); n++) {
            Coordinate[] path = lineal.getGeometryN(n).getCoordinates();
            if (path.length == 1) {
                min = Math.min(min, haversine(p.getLat(), p.getLon(), path[0].getY(), path[0].getX()));
                continue;
            }
            for (int i = 0; i < path.length - 1; i++) {
                min = Math.min(min, pointToSegment(p, path[i], path[i + 1]));
            }
        }
        return min;
    }

    /**
     * Even-odd ray casting. Works on open or closed rings.
     */
    public static boolean pointInRing(LatLon p, Coordinate[] ring) {
        double x = p.getLon();
        double y = p.getLat();
        boolean inside = false;
        for (int i = 0, j = ring.length - 1; i < ring.length; j = i++) {
            double xi = ring[i].getX();
            double yi = ring[i].getY();
            double xj = ring[j].getX();
            double yj = ring[j].getY();
            if ((yi > y) != (yj > y) && x < (xj - xi) * (y - yi) / (yj - yi) + xi) {
                inside = !inside;
            }
        }
        return inside;
    }

    /**
     * Inside the shell and not inside any hole
     */
    public static boolean pointInPolygon(LatLon p, Polygon polygon) {
        if (!pointInRing(p, polygon.getExteriorRing().getCoordinates())) {
            return false;
        }
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            if (pointInRing(p, polygon.getInteriorRingN(i).getCoordinates())) {
                return false;
            }
        }
        return true;
    }

    /**
     * Any part of a Polygon or MultiPolygon contains the point
     */
    public static boolean pointInPolygonal(LatLon p, Geometry polygonal) {
        for (int n = 0; n < polygonal.getNumGeometries(); n++) {
            if (pointInPolygon(p, (Polygon) polygonal.getGeometryN(n))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Zero when inside; otherwise the nearest edge of any ring, holes included
     */
    public static double distanceToPolygonBoundary(LatLon p, Polygon polygon) {
        if (pointInPolygon(p, polygon)) {
            return 0.0;
        }
        double min = ringDistance(p, polygon.getExteriorRing());
        for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
            min = Math.min(min, ringDistance(p, polygon.getInteriorRingN(i)));
        }
        return min;
    }

    public static double distanceToPolygonalBoundary(LatLon p, Geometry polygonal) {
        double min = Double.POSITIVE_INFINITY;
        for (int n = 0; n < polygonal.getNumGeometries(); n++) {
            min = Math.min(min, distanceToPolygonBoundary(p, (Polygon) polygonal.getGeometryN(n)));
            if (min == 0.0) {
                break;
            }
        }
        return min;
    }

    private static double ringDistance(LatLon p, LineString ring) {
        Coordinate[] coordinates = ring.getCoordinates();
        double min = Double.POSITIVE_INFINITY;
        for (int i = 0; i < coordinates.length; i++) {
            Coordinate a = coordinates[i];
            Coordinate b = coordinates[(i + 1) % coordinates.length];
            min = Math.min(min, pointToSegment(p, a, b));
        }
        return min;
    }
}
