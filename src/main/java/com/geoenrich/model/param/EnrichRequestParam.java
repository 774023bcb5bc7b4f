package com.geoenrich.model.param;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter object for a single-location enrichment
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichRequestParam {

    private Double lat;
    private Double lon;

    @Builder.Default
    private List<String> types = new ArrayList<>();

    /**
     * Requested radius in miles per type; capped by each source
     */
    @Builder.Default
    private Map<String, Double> radii = new LinkedHashMap<>();

    public boolean hasValidCoordinates() {
        return lat != null && lon != null
                && Double.isFinite(lat) && Double.isFinite(lon)
                && lat >= -90 && lat <= 90
                && lon >= -180 && lon <= 180;
    }
}
