package com.geoenrich.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;
import org.locationtech.jts.geom.Coordinate;

/**
 * Geographic position in WGS84 degrees
 */
@Value
public class LatLon {

    double lat;
    double lon;

    @JsonCreator
    public LatLon(@JsonProperty("lat") double lat, @JsonProperty("lon") double lon) {
        if (!Double.isFinite(lat) || lat < -90.0 || lat > 90.0) {
            throw new IllegalArgumentException("Latitude out of range: " + lat);
        }
        if (!Double.isFinite(lon) || lon < -180.0 || lon > 180.0) {
            throw new IllegalArgumentException("Longitude out of range: " + lon);
        }
        this.lat = lat;
        this.lon = lon;
    }

    public static LatLon of(double lat, double lon) {
        return new LatLon(lat, lon);
    }

    /**
     * JTS coordinate with x = lon, y = lat
     */
    public Coordinate toCoordinate() {
        return new Coordinate(lon, lat);
    }
}
