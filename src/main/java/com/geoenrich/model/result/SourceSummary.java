package com.geoenrich.model.result;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of a configured enrichment type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceSummary {

    private String id;
    private String label;
    private String kind;
    private String geometryType;
    private Double defaultRadiusMiles;
    private Double maxRadiusMiles;
    private boolean alwaysOn;
}
