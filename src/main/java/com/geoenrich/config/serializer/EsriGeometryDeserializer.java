package com.geoenrich.config.serializer;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import com.geoenrich.exception.GeometryException;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads ESRI JSON geometries into JTS.
 * Supports {x, y} points, {paths} polylines, {rings} polygons (ring 0 is the shell,
 * the rest are holes) and a plain {lat, lon} object. Coordinates are kept as served;
 * CRS normalization happens later.
 */
public class EsriGeometryDeserializer extends JsonDeserializer<Geometry> {

    private final GeometryFactory geometryFactory;

    public EsriGeometryDeserializer() {
        this(new GeometryFactory());
    }

    public EsriGeometryDeserializer(GeometryFactory geometryFactory) {
        this.geometryFactory = geometryFactory;
    }

    @Override
    public Geometry deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonNode node = parser.getCodec().readTree(parser);
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return read(node);
        } catch (GeometryException e) {
            throw new IOException(e.getMessage(), e);
        }
    }

    /**
     * @throws GeometryException when the node is missing or malformed
     */
    public Geometry read(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            throw new GeometryException("Feature has no geometry");
        }
        if (node.has("x") && node.has("y")) {
            return geometryFactory.createPoint(new Coordinate(number(node.get("x"), "x"), number(node.get("y"), "y")));
        }
        if (node.has("lat") && node.has("lon")) {
            return geometryFactory.createPoint(new Coordinate(number(node.get("lon"), "lon"), number(node.get("lat"), "lat")));
        }
        if (node.has("paths")) {
            return readPolyline(node.get("paths"));
        }
        if (node.has("rings")) {
            return readPolygon(node.get("rings"));
        }
        throw new GeometryException("Unsupported geometry: expected x/y, paths or rings");
    }

    private Geometry readPolyline(JsonNode paths) {
        if (!paths.isArray() || paths.isEmpty()) {
            throw new GeometryException("Polyline has no paths");
        }
        List<LineString> lines = new ArrayList<>();
        for (JsonNode path : paths) {
            Coordinate[] coordinates = coordinates(path);
            if (coordinates.length < 2) {
                throw new GeometryException("Polyline path needs at least 2 points, got " + coordinates.length);
            }
            lines.add(geometryFactory.createLineString(coordinates));
        }
        if (lines.size() == 1) {
            return lines.get(0);
        }
        return geometryFactory.createMultiLineString(lines.toArray(new LineString[0]));
    }

    private Geometry readPolygon(JsonNode rings) {
        if (!rings.isArray() || rings.isEmpty()) {
            throw new GeometryException("Polygon has no rings");
        }
        List<LinearRing> linearRings = new ArrayList<>();
        for (JsonNode ring : rings) {
            linearRings.add(ring(coordinates(ring)));
        }
        LinearRing shell = linearRings.get(0);
        LinearRing[] holes = linearRings.subList(1, linearRings.size()).toArray(new LinearRing[0]);
        return geometryFactory.createPolygon(shell, holes);
    }

    private LinearRing ring(Coordinate[] coordinates) {
        if (coordinates.length < 3) {
            throw new GeometryException("Polygon ring needs at least 3 points, got " + coordinates.length);
        }
        Coordinate[] closed = coordinates;
        if (!coordinates[0].equals2D(coordinates[coordinates.length - 1])) {
            closed = new Coordinate[coordinates.length + 1];
            System.arraycopy(coordinates, 0, closed, 0, coordinates.length);
            closed[coordinates.length] = new Coordinate(coordinates[0]);
        }
        if (closed.length < 4) {
            throw new GeometryException("Polygon ring is degenerate");
        }
        return geometryFactory.createLinearRing(closed);
    }

    private Coordinate[] coordinates(JsonNode array) {
        if (array == null || !array.isArray()) {
            throw new GeometryException("Expected a coordinate array");
        }
        Coordinate[] coordinates = new Coordinate[array.size()];
        for (int i = 0; i < array.size(); i++) {
            JsonNode pair = array.get(i);
            if (!pair.isArray() || pair.size() < 2) {
                throw new GeometryException("Malformed coordinate at index " + i);
            }
            coordinates[i] = new Coordinate(number(pair.get(0), "x"), number(pair.get(1), "y"));
        }
        return coordinates;
    }

    private double number(JsonNode value, String name) {
        if (value == null || !value.isNumber()) {
            throw new GeometryException("Coordinate '" + name + "' is not numeric");
        }
        double number = value.asDouble();
        if (!Double.isFinite(number)) {
            throw new GeometryException("Coordinate '" + name + "' is not finite");
        }
        return number;
    }
}
