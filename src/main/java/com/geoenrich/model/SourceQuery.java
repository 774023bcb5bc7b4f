package com.geoenrich.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request for a single page from a {@code SpatialSource}
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SourceQuery {

    public static final double METERS_PER_MILE = 1609.34;

    private LatLon origin;

    @Builder.Default
    private SpatialRelation relation = SpatialRelation.INTERSECTS;

    /**
     * Buffer around the origin in miles; null for a plain containment query
     */
    private Double bufferMiles;

    private int offset;
    private int pageSize;

    public boolean isBuffered() {
        return bufferMiles != null && bufferMiles > 0;
    }

    public double bufferMeters() {
        return isBuffered() ? bufferMiles * METERS_PER_MILE : 0.0;
    }
}
