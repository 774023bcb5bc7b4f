package com.geoenrich.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One proximity request against one source
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuerySpec {

    private LatLon origin;

    /**
     * Search radius in miles, already capped by the source
     */
    private double radiusMiles;

    @Builder.Default
    private boolean wantContaining = true;

    @Builder.Default
    private boolean wantNearby = true;

    public static QuerySpec proximity(LatLon origin, double radiusMiles) {
        return QuerySpec.builder().origin(origin).radiusMiles(radiusMiles).build();
    }

    public static QuerySpec containing(LatLon origin) {
        return QuerySpec.builder().origin(origin).radiusMiles(0).wantNearby(false).build();
    }
}
