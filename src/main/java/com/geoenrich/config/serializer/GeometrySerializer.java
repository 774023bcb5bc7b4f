package com.geoenrich.config.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.MultiLineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.io.WKTWriter;

import java.io.IOException;

/**
 * Writes normalized JTS geometries in lat/lon order for map clients.
 * Points become {lat, lon}; polylines carry "paths" and polygons "rings", each
 * coordinate as [lat, lon]. Anything else falls back to WKT.
 */
public class GeometrySerializer extends JsonSerializer<Geometry> {

    private final WKTWriter wktWriter = new WKTWriter();

    @Override
    public void serialize(Geometry geometry, JsonGenerator gen, SerializerProvider serializers)
            throws IOException {
        if (geometry == null) {
            gen.writeNull();
            return;
        }

        gen.writeStartObject();
        if (geometry instanceof Point) {
            Point point = (Point) geometry;
            gen.writeStringField("type", "Point");
            gen.writeNumberField("lat", point.getY());
            gen.writeNumberField("lon", point.getX());
        } else if (geometry instanceof LineString || geometry instanceof MultiLineString) {
            gen.writeStringField("type", "Polyline");
            gen.writeArrayFieldStart("paths");
            for (int i = 0; i < geometry.getNumGeometries(); i++) {
                writeCoordinates(gen, geometry.getGeometryN(i).getCoordinates());
            }
            gen.writeEndArray();
        } else if (geometry instanceof Polygon) {
            Polygon polygon = (Polygon) geometry;
            gen.writeStringField("type", "Polygon");
            gen.writeArrayFieldStart("rings");
            writeCoordinates(gen, polygon.getExteriorRing().getCoordinates());
            for (int i = 0; i < polygon.getNumInteriorRing(); i++) {
                writeCoordinates(gen, polygon.getInteriorRingN(i).getCoordinates());
            }
            gen.writeEndArray();
        } else {
            gen.writeStringField("type", geometry.getGeometryType());
            gen.writeStringField("wkt", wktWriter.write(geometry));
        }
        gen.writeEndObject();
    }

    private void writeCoordinates(JsonGenerator gen, Coordinate[] coordinates) throws IOException {
        gen.writeStartArray();
        for (Coordinate coordinate : coordinates) {
            gen.writeStartArray();
            gen.writeNumber(coordinate.getY());
            gen.writeNumber(coordinate.getX());
            gen.writeEndArray();
        }
        gen.writeEndArray();
    }
}
