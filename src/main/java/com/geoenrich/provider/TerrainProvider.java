package com.geoenrich.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.geoenrich.client.JsonFetcher;
import com.geoenrich.config.EnrichmentProperties;
import com.geoenrich.exception.ResponseParseException;
import com.geoenrich.model.LatLon;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Elevation, slope and aspect from a 3x3 elevation grid around the origin.
 * Slope and aspect use Horn's method.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TerrainProvider implements EnrichmentProvider {

    public static final String TYPE = "terrain";

    public static final double GRID_SPACING_METERS = 90.0;

    private static final double METERS_PER_DEGREE = 111000.0;
    private static final double FEET_PER_METER = 3.28084;
    private static final int GRID_SIZE = 3;

    private static final String[] DIRECTIONS = {
            "N", "NNE", "NE", "ENE", "E", "ESE", "SE", "SSE",
            "S", "SSW", "SW", "WSW", "W", "WNW", "NW", "NNW"
    };

    private final JsonFetcher jsonFetcher;
    private final EnrichmentProperties properties;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> enrich(LatLon origin, Double radiusMiles) {
        double[][] grid = fetchGrid(origin);
        double elevation = grid[1][1];
        double slope = slope(grid);
        double aspect = aspect(grid);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("terrain_elevation", elevation);
        out.put("terrain_slope", Math.round(slope * 10.0) / 10.0);
        out.put("terrain_aspect", Math.round(aspect));
        out.put("terrain_slope_direction", direction(aspect));
        out.put("elevation_ft", Math.round(elevation * FEET_PER_METER));
        return out;
    }

    double[][] fetchGrid(LatLon center) {
        StringJoiner latitudes = new StringJoiner(",");
        StringJoiner longitudes = new StringJoiner(",");
        double lonStep = GRID_SPACING_METERS / (METERS_PER_DEGREE * Math.cos(Math.toRadians(center.getLat())));
        double latStep = GRID_SPACING_METERS / METERS_PER_DEGREE;
        for (int row = 0; row < GRID_SIZE; row++) {
            for (int col = 0; col < GRID_SIZE; col++) {
                latitudes.add(format(center.getLat() + (row - 1) * latStep));
                longitudes.add(format(center.getLon() + (col - 1) * lonStep));
            }
        }

        String url = UriComponentsBuilder.fromHttpUrl(properties.getEndpoints().getElevationUrl())
                .queryParam("latitude", latitudes.toString())
                .queryParam("longitude", longitudes.toString())
                .build()
                .encode()
                .toUriString();
        log.debug("Elevation grid request: {}", url);

        JsonNode elevations = jsonFetcher.fetchJson(url).path("elevation");
        if (!elevations.isArray() || elevations.size() != GRID_SIZE * GRID_SIZE) {
            throw new ResponseParseException("Invalid elevation data received");
        }
        double[][] grid = new double[GRID_SIZE][GRID_SIZE];
        for (int i = 0; i < elevations.size(); i++) {
            JsonNode value = elevations.get(i);
            if (!value.isNumber()) {
                throw new ResponseParseException("Non-numeric elevation at grid cell " + i);
            }
            grid[i / GRID_SIZE][i % GRID_SIZE] = value.asDouble();
        }
        return grid;
    }

    /**
     * Slope in degrees. Row 0 of the grid is the southern row, as the grid is fetched.
     */
    public static double slope(double[][] z) {
        double[] gradient = gradient(z);
        return Math.toDegrees(Math.atan(Math.sqrt(gradient[0] * gradient[0] + gradient[1] * gradient[1])));
    }

    /**
     * Aspect in degrees, 0..360
     */
    public static double aspect(double[][] z) {
        double[] gradient = gradient(z);
        double aspect = Math.toDegrees(Math.atan2(gradient[1], -gradient[0]));
        return aspect < 0 ? aspect + 360.0 : aspect;
    }

    /**
     * 16-point compass name for an aspect in degrees
     */
    public static String direction(double aspect) {
        int index = (int) (Math.round(aspect / 22.5) % DIRECTIONS.length);
        return DIRECTIONS[index];
    }

    private static double[] gradient(double[][] z) {
        double a = ((z[0][2] + 2 * z[1][2] + z[2][2]) - (z[0][0] + 2 * z[1][0] + z[2][0])) / (8 * GRID_SPACING_METERS);
        double b = ((z[2][0] + 2 * z[2][1] + z[2][2]) - (z[0][0] + 2 * z[0][1] + z[0][2])) / (8 * GRID_SPACING_METERS);
        return new double[]{a, b};
    }

    private static String format(double degrees) {
        return String.format(Locale.ROOT, "%.6f", degrees);
    }
}
