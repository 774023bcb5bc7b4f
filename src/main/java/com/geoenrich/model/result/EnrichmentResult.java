package com.geoenrich.model.result;

import com.geoenrich.model.LatLon;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated enrichment output for one location. Keys are namespaced by enrichment type.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnrichmentResult {

    private LatLon location;

    @Builder.Default
    private Map<String, Object> enrichments = new LinkedHashMap<>();

    private long elapsedMs;

    public boolean hasError(String type) {
        return enrichments.containsKey(type + "_error");
    }
}
