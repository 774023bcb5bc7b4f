package com.geoenrich.model.param;

import com.geoenrich.model.LatLon;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parameter object for batch enrichment. Locations are processed in order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BatchEnrichParam {

    @Builder.Default
    private List<LatLon> locations = new ArrayList<>();

    @Builder.Default
    private List<String> types = new ArrayList<>();

    @Builder.Default
    private Map<String, Double> radii = new LinkedHashMap<>();
}
