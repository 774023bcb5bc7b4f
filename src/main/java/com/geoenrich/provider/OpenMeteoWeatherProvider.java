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

/**
 * Current conditions from the Open-Meteo forecast API
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OpenMeteoWeatherProvider implements EnrichmentProvider {

    public static final String TYPE = "weather";

    private static final String PREFIX = "open_meteo_weather_";

    private static final Map<Integer, String> WEATHER_CODES = Map.ofEntries(
            Map.entry(0, "Clear sky"),
            Map.entry(1, "Mainly clear"),
            Map.entry(2, "Partly cloudy"),
            Map.entry(3, "Overcast"),
            Map.entry(45, "Foggy"),
            Map.entry(48, "Depositing rime fog"),
            Map.entry(51, "Light drizzle"),
            Map.entry(53, "Moderate drizzle"),
            Map.entry(55, "Dense drizzle"),
            Map.entry(56, "Light freezing drizzle"),
            Map.entry(57, "Dense freezing drizzle"),
            Map.entry(61, "Slight rain"),
            Map.entry(63, "Moderate rain"),
            Map.entry(65, "Heavy rain"),
            Map.entry(66, "Light freezing rain"),
            Map.entry(67, "Heavy freezing rain"),
            Map.entry(71, "Slight snow fall"),
            Map.entry(73, "Moderate snow fall"),
            Map.entry(75, "Heavy snow fall"),
            Map.entry(77, "Snow grains"),
            Map.entry(80, "Slight rain showers"),
            Map.entry(81, "Moderate rain showers"),
            Map.entry(82, "Violent rain showers"),
            Map.entry(85, "Slight snow showers"),
            Map.entry(86, "Heavy snow showers"),
            Map.entry(95, "Thunderstorm"),
            Map.entry(96, "Thunderstorm with slight hail"),
            Map.entry(99, "Thunderstorm with heavy hail"));

    private final JsonFetcher jsonFetcher;
    private final EnrichmentProperties properties;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> enrich(LatLon origin, Double radiusMiles) {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getEndpoints().getWeatherUrl())
                .queryParam("latitude", origin.getLat())
                .queryParam("longitude", origin.getLon())
                .queryParam("current_weather", "true")
                .queryParam("timezone", "auto")
                .build()
                .encode()
                .toUriString();
        log.debug("Open-Meteo weather request: {}", url);

        JsonNode body = jsonFetcher.fetchJson(url);
        JsonNode current = body.path("current_weather");
        if (!current.isObject()) {
            throw new ResponseParseException("No current weather data available");
        }

        double temperatureC = current.path("temperature").asDouble();
        double temperatureF = temperatureC * 9.0 / 5.0 + 32.0;
        double windKmh = current.path("windspeed").asDouble();
        double windMph = windKmh * 0.621371;
        int code = current.path("weathercode").asInt(-1);
        String description = describe(code);

        Map<String, Object> out = new LinkedHashMap<>();
        out.put(PREFIX + "temperature_c", temperatureC);
        out.put(PREFIX + "temperature_f", temperatureF);
        out.put(PREFIX + "windspeed", windKmh);
        out.put(PREFIX + "windspeed_mph", windMph);
        out.put(PREFIX + "winddirection", current.path("winddirection").asDouble());
        out.put(PREFIX + "weathercode", code);
        out.put(PREFIX + "weather_description", description);
        out.put(PREFIX + "time", current.path("time").asText(null));
        out.put(PREFIX + "timezone", body.path("timezone").asText("Unknown"));
        out.put(PREFIX + "timezone_abbreviation", body.path("timezone_abbreviation").asText("Unknown"));
        out.put(PREFIX + "utc_offset_seconds", body.path("utc_offset_seconds").asInt(0));
        out.put(PREFIX + "summary", String.format(Locale.ROOT, "Current weather: %s, %.1f°F, %.1f mph wind",
                description, temperatureF, windMph));
        return out;
    }

    static String describe(int weatherCode) {
        return WEATHER_CODES.getOrDefault(weatherCode, "Unknown weather condition");
    }
}
