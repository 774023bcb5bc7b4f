package com.geoenrich.source;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.geoenrich.client.JsonFetcher;
import com.geoenrich.config.SourceDefinition;
import com.geoenrich.config.serializer.EsriGeometryDeserializer;
import com.geoenrich.exception.GeometryException;
import com.geoenrich.exception.SourceQueryException;
import com.geoenrich.model.FeatureAttributes;
import com.geoenrich.model.FieldAliases;
import com.geoenrich.model.RawFeature;
import com.geoenrich.model.SourcePage;
import com.geoenrich.model.SourceQuery;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * {@link SpatialSource} backed by an ArcGIS REST feature layer query endpoint
 */
@Slf4j
public class ArcGisFeatureSource implements SpatialSource {

    private static final TypeReference<Map<String, Object>> ATTRIBUTE_MAP = new TypeReference<>() {
    };

    private final SourceDefinition definition;
    private final int pageSize;
    private final FieldAliases fieldAliases;
    private final JsonFetcher fetcher;
    private final ObjectMapper objectMapper;
    private final EsriGeometryDeserializer geometryReader;

    public ArcGisFeatureSource(SourceDefinition definition, int defaultPageSize, JsonFetcher fetcher,
                               ObjectMapper objectMapper, EsriGeometryDeserializer geometryReader) {
        this.definition = definition;
        this.pageSize = definition.getPageSize() != null && definition.getPageSize() > 0
                ? definition.getPageSize() : defaultPageSize;
        this.fieldAliases = definition.fieldAliases();
        this.fetcher = fetcher;
        this.objectMapper = objectMapper;
        this.geometryReader = geometryReader;
    }

    @Override
    public String getId() {
        return definition.getId();
    }

    @Override
    public int getPageSize() {
        return pageSize;
    }

    @Override
    public List<String> getIdentityFields() {
        return definition.effectiveIdentityFields();
    }

    @Override
    public FieldAliases getFieldAliases() {
        return fieldAliases;
    }

    public SourceDefinition getDefinition() {
        return definition;
    }

    @Override
    public SourcePage query(SourceQuery query) {
        String url = buildQueryUrl(query);
        log.debug("Querying source '{}' at offset {}: {}", getId(), query.getOffset(), url);

        JsonNode body = fetcher.fetchJson(url);
        JsonNode error = body.path("error");
        if (error.isObject()) {
            Integer code = error.hasNonNull("code") ? error.get("code").asInt() : null;
            throw new SourceQueryException(getId(), code, error.path("message").asText("unknown error"));
        }

        JsonNode featureNodes = body.path("features");
        List<RawFeature> features = new ArrayList<>();
        int dropped = 0;
        for (JsonNode featureNode : featureNodes) {
            try {
                features.add(toRawFeature(featureNode));
            } catch (GeometryException e) {
                dropped++;
                log.debug("Dropping feature from '{}': {}", getId(), e.getMessage());
            }
        }
        if (dropped > 0) {
            log.debug("Source '{}' page at offset {}: dropped {} malformed feature(s)", getId(), query.getOffset(), dropped);
        }

        return SourcePage.builder()
                .features(features)
                .hasMore(body.path("exceededTransferLimit").asBoolean(false))
                .returnedCount(featureNodes.size())
                .build();
    }

    String buildQueryUrl(SourceQuery query) {
        ObjectNode point = objectMapper.createObjectNode();
        point.put("x", query.getOrigin().getLon());
        point.put("y", query.getOrigin().getLat());
        point.putObject("spatialReference").put("wkid", 4326);

        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(stripTrailingSlash(definition.getServiceUrl()) + "/query")
                .queryParam("f", "json")
                .queryParam("where", "1=1")
                .queryParam("outFields", "*")
                .queryParam("geometry", point.toString())
                .queryParam("geometryType", "esriGeometryPoint")
                .queryParam("spatialRel", query.getRelation().getEsriName());
        if (query.isBuffered()) {
            builder.queryParam("distance", query.bufferMeters())
                    .queryParam("units", "esriSRUnit_Meter");
        }
        return builder
                .queryParam("inSR", "4326")
                .queryParam("outSR", "4326")
                .queryParam("returnGeometry", "true")
                .queryParam("resultRecordCount", query.getPageSize() > 0 ? query.getPageSize() : pageSize)
                .queryParam("resultOffset", query.getOffset())
                .build()
                .encode()
                .toUriString();
    }

    private RawFeature toRawFeature(JsonNode featureNode) {
        Geometry geometry = geometryReader.read(featureNode.get("geometry"));
        JsonNode attributesNode = featureNode.path("attributes");
        Map<String, Object> attributes = attributesNode.isObject()
                ? objectMapper.convertValue(attributesNode, ATTRIBUTE_MAP)
                : Map.of();
        return RawFeature.builder()
                .attributes(FeatureAttributes.of(attributes))
                .geometry(geometry)
                .sourceId(getId())
                .build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
