package com.geoenrich.model;

/**
 * Spatial predicate sent to a feature service
 */
public enum SpatialRelation {

    INTERSECTS("esriSpatialRelIntersects"),
    CONTAINS("esriSpatialRelContains"),
    WITHIN("esriSpatialRelWithin");

    private final String esriName;

    SpatialRelation(String esriName) {
        this.esriName = esriName;
    }

    public String getEsriName() {
        return esriName;
    }
}
