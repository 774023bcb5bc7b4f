package com.geoenrich.config.serializer;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Rounds distances to hundredths of a mile on output. Internal values stay unrounded.
 */
public class RoundedMilesSerializer extends JsonSerializer<Double> {

    public static double round(double miles) {
        return Math.round(miles * 100.0) / 100.0;
    }

    @Override
    public void serialize(Double value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
        if (value == null) {
            gen.writeNull();
            return;
        }
        gen.writeNumber(round(value));
    }
}
