package com.geoenrich.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoenrich.client.JsonFetcher;
import com.geoenrich.config.EnrichmentProperties;
import com.geoenrich.config.SourceDefinition;
import com.geoenrich.config.serializer.EsriGeometryDeserializer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Builds {@link SpatialSource}s from declarative definitions
 */
@Component
@RequiredArgsConstructor
public class SpatialSourceFactory {

    private final JsonFetcher jsonFetcher;
    private final ObjectMapper objectMapper;
    private final EsriGeometryDeserializer esriGeometryDeserializer;
    private final EnrichmentProperties properties;

    public SpatialSource create(SourceDefinition definition) {
        if (definition.getServiceUrl() == null || definition.getServiceUrl().isBlank()) {
            throw new IllegalArgumentException("Source '" + definition.getId() + "' has no service-url");
        }
        return new ArcGisFeatureSource(definition, properties.getPagination().getDefaultPageSize(),
                jsonFetcher, objectMapper, esriGeometryDeserializer);
    }
}
