package com.geoenrich.geometry;

/**
 * Coordinate reference system guessed from coordinate magnitudes
 */
public enum CrsKind {
    /** WGS84 degrees */
    GEOGRAPHIC,
    /** Web-Mercator-like meters */
    PROJECTED
}
