package com.geoenrich.config;

import com.geoenrich.model.FieldAliases;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative description of one dataset: where it lives, how far it may be searched
 * and how its attribute names map onto canonical fields
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceDefinition {

    /**
     * Enrichment type key; filled from the map key when bound from configuration
     */
    private String id;

    private String label;

    /**
     * Feature layer URL, without the trailing /query
     */
    private String serviceUrl;

    /**
     * Informational: point, polyline or polygon
     */
    private String geometryType;

    @Builder.Default
    private double maxRadiusMiles = 5.0;

    @Builder.Default
    private double defaultRadiusMiles = 1.0;

    /**
     * Null means the global default page size
     */
    private Integer pageSize;

    /**
     * Whether a point-in-polygon pass runs before the buffered pass
     */
    @Builder.Default
    private boolean containment = true;

    @Builder.Default
    private List<String> identityFields = new ArrayList<>();

    @Builder.Default
    private Map<String, List<String>> fields = new LinkedHashMap<>();

    public List<String> effectiveIdentityFields() {
        return identityFields == null || identityFields.isEmpty()
                ? FieldAliases.DEFAULT_IDENTITY_FIELDS
                : identityFields;
    }

    public FieldAliases fieldAliases() {
        return FieldAliases.of(fields);
    }

    public double capRadius(Double requestedMiles) {
        double radius = requestedMiles != null ? requestedMiles : defaultRadiusMiles;
        return Math.min(radius, maxRadiusMiles);
    }
}
