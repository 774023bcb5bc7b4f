package com.geoenrich.config.serializer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.geoenrich.exception.GeometryException;
import com.geoenrich.model.AnnotatedFeature;
import com.geoenrich.model.FeatureAttributes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.Polygon;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GeometryJsonTest {

    private final GeometryFactory geometryFactory = new GeometryFactory();
    private final EsriGeometryDeserializer reader = new EsriGeometryDeserializer(geometryFactory);
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        SimpleModule module = new SimpleModule();
        module.addSerializer(Geometry.class, new GeometrySerializer());
        module.addDeserializer(Geometry.class, reader);
        objectMapper.registerModule(module);
    }

    @Test
    void testReadsMultiPathPolylineAndOpenRing() throws Exception {
        Geometry lines = reader.read(objectMapper.readTree("{\"paths\":[[[0,0],[1,1]],[[2,2],[3,3]]]}"));
        Geometry polygon = reader.read(objectMapper.readTree(
                "{\"rings\":[[[0,0],[10,0],[10,10],[0,10]],[[4,4],[6,4],[6,6],[4,6],[4,4]]]}"));

        assertInstanceOf(MultiLineString.class, lines);
        assertEquals(2, lines.getNumGeometries());
        assertInstanceOf(Polygon.class, polygon);
        assertEquals(1, ((Polygon) polygon).getNumInteriorRing());
        assertTrue(((Polygon) polygon).getExteriorRing().isClosed());
    }

    @Test
    void testRejectsMalformedGeometry() throws Exception {
        assertThrows(GeometryException.class, () -> reader.read(objectMapper.readTree("{\"x\":\"east\",\"y\":1}")));
        assertThrows(GeometryException.class, () -> reader.read(objectMapper.readTree("{\"rings\":[[[0,0],[1,1]]]}")));
        assertThrows(GeometryException.class, () -> reader.read(objectMapper.readTree("{\"curveRings\":[]}")));
        assertThrows(GeometryException.class, () -> reader.read(null));
    }

    @Test
    void testFeatureSerializesLatLonAndRoundedDistance() throws Exception {
        AnnotatedFeature feature = AnnotatedFeature.builder()
                .identity("12")
                .geometry(geometryFactory.createPoint(new Coordinate(-95.37, 29.76)))
                .attributes(FeatureAttributes.of(Map.of("OBJECTID", 12)))
                .distanceMiles(0.123456)
                .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(feature));

        assertEquals("Point", json.path("geometry").path("type").asText());
        assertEquals(29.76, json.path("geometry").path("lat").asDouble());
        assertEquals(-95.37, json.path("geometry").path("lon").asDouble());
        assertEquals(0.12, json.path("distanceMiles").asDouble());
        assertFalse(json.path("isContaining").asBoolean());
        assertEquals(12, json.path("extra").path("OBJECTID").asInt());
        assertTrue(json.path("attributes").isMissingNode());
    }
}
