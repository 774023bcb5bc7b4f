package com.geoenrich.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.geoenrich.client.JsonFetcher;
import com.geoenrich.config.EnrichmentProperties;
import com.geoenrich.geometry.DistanceEngine;
import com.geoenrich.model.LatLon;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Active National Weather Service alerts at the point. Alerts with a geometry are kept when
 * the area's centre lies within the radius; zone-based alerts without one are always kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NwsWeatherAlertsProvider implements EnrichmentProvider {

    public static final String TYPE = "nws_weather_alerts";

    public static final double DEFAULT_RADIUS_MILES = 25.0;

    private static final String PREFIX = "nws_weather_alerts_";

    private final JsonFetcher jsonFetcher;
    private final EnrichmentProperties properties;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Double resolveRadiusMiles(Double requestedMiles) {
        return requestedMiles != null && requestedMiles > 0 ? requestedMiles : DEFAULT_RADIUS_MILES;
    }

    @Override
    public Map<String, Object> enrich(LatLon origin, Double radiusMiles) {
        double radius = resolveRadiusMiles(radiusMiles);
        String url = UriComponentsBuilder.fromHttpUrl(properties.getEndpoints().getNwsAlertsUrl())
                .queryParam("point", String.format(Locale.ROOT, "%.6f,%.6f", origin.getLat(), origin.getLon()))
                .build()
                .encode()
                .toUriString();
        log.debug("NWS alerts request: {}", url);

        JsonNode features = jsonFetcher.fetchJson(url).path("features");
        List<Map<String, Object>> details = new ArrayList<>();
        Map<String, Integer> severityCounts = new LinkedHashMap<>();
        for (JsonNode alert : features) {
            JsonNode geometry = alert.path("geometry");
            if (geometry.isObject()) {
                LatLon centre = centre(geometry);
                if (centre == null || DistanceEngine.haversine(origin, centre) > radius) {
                    continue;
                }
            }
            Map<String, Object> detail = detail(alert);
            details.add(detail);
            severityCounts.merge(((String) detail.get("severity")).toLowerCase(Locale.ROOT), 1, Integer::sum);
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put(PREFIX + "count", details.size());
        out.put(PREFIX + "active", details.size());
        out.put(PREFIX + "summary", summarize(details, severityCounts));
        out.put(PREFIX + "details", details);
        out.put(PREFIX + "severity_breakdown", severityCounts);
        out.put(PREFIX + "radius_miles", radius);
        log.debug("{} NWS alert(s) within {} mi of {}", details.size(), radius, origin);
        return out;
    }

    /**
     * Point coordinates, or the vertex mean of a polygon's outer ring; null for anything else
     */
    static LatLon centre(JsonNode geometry) {
        JsonNode coordinates = geometry.path("coordinates");
        String type = geometry.path("type").asText();
        try {
            if ("Point".equals(type) && coordinates.size() >= 2) {
                return LatLon.of(coordinates.get(1).asDouble(), coordinates.get(0).asDouble());
            }
            if ("Polygon".equals(type) && coordinates.size() > 0 && coordinates.get(0).size() > 0) {
                JsonNode ring = coordinates.get(0);
                double lon = 0;
                double lat = 0;
                for (JsonNode position : ring) {
                    lon += position.path(0).asDouble();
                    lat += position.path(1).asDouble();
                }
                return LatLon.of(lat / ring.size(), lon / ring.size());
            }
        } catch (IllegalArgumentException e) {
            log.debug("Ignoring alert with unusable geometry: {}", e.getMessage());
        }
        return null;
    }

    static String summarize(List<Map<String, Object>> details, Map<String, Integer> severityCounts) {
        if (details.isEmpty()) {
            return "No active weather alerts";
        }
        if (details.size() == 1) {
            return "1 active weather alert: " + details.get(0).get("event");
        }
        StringBuilder summary = new StringBuilder(details.size() + " active weather alerts");
        if (severityCounts.containsKey("extreme")) {
            summary.append(" (").append(severityCounts.get("extreme")).append(" extreme)");
        }
        if (severityCounts.containsKey("severe")) {
            summary.append(" (").append(severityCounts.get("severe")).append(" severe)");
        }
        return summary.toString();
    }

    private static Map<String, Object> detail(JsonNode alert) {
        JsonNode properties = alert.path("properties");
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("id", alert.path("id").asText("Unknown"));
        detail.put("event", properties.path("event").asText("Unknown Event"));
        detail.put("severity", properties.path("severity").asText("Unknown"));
        detail.put("urgency", properties.path("urgency").asText("Unknown"));
        detail.put("certainty", properties.path("certainty").asText("Unknown"));
        detail.put("headline", properties.path("headline").asText("No headline"));
        detail.put("area_desc", properties.path("areaDesc").asText("Unknown area"));
        detail.put("effective", properties.path("effective").asText("Unknown"));
        detail.put("expires", properties.path("expires").asText("Unknown"));
        detail.put("status", properties.path("status").asText("Unknown"));
        return detail;
    }
}
