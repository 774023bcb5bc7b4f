package com.geoenrich.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Geometry;

/**
 * A feature as fetched from a source page, before classification
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RawFeature {

    private FeatureAttributes attributes;
    private Geometry geometry;
    private String sourceId;
}
