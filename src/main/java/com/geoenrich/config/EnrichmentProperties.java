package com.geoenrich.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Externalized settings under the {@code geoenrich} prefix
 */
@Data
@ConfigurationProperties(prefix = "geoenrich")
public class EnrichmentProperties {

    private Fetch fetch = new Fetch();
    private Pagination pagination = new Pagination();
    private Batch batch = new Batch();
    private Executor executor = new Executor();
    private Endpoints endpoints = new Endpoints();

    /**
     * Enrichment types that run on every request
     */
    private List<String> alwaysOn = new ArrayList<>(List.of("weather", "nws_weather_alerts", "terrain", "census", "acs"));

    private Map<String, SourceDefinition> sources = new LinkedHashMap<>();

    /**
     * Source definitions with their ids filled from the map keys
     */
    public Map<String, SourceDefinition> resolvedSources() {
        Map<String, SourceDefinition> resolved = new LinkedHashMap<>();
        sources.forEach((key, definition) -> {
            if (definition.getId() == null || definition.getId().isBlank()) {
                definition.setId(key);
            }
            if (definition.getLabel() == null) {
                definition.setLabel(key);
            }
            resolved.put(key, definition);
        });
        return resolved;
    }

    @Data
    public static class Fetch {
        private List<Proxy> proxies = new ArrayList<>();
        private long attemptDelayMs = 200;
        private int connectTimeoutMs = 5000;
        private int readTimeoutMs = 15000;
    }

    @Data
    public static class Proxy {
        /**
         * prefix: base + url; wrap: base + urlEncode(url)
         */
        private String type = "prefix";
        private String base;
    }

    @Data
    public static class Pagination {
        private int defaultPageSize = 2000;
        private int maxOffset = 100000;
        private long pageDelayMs = 0;
    }

    @Data
    public static class Batch {
        private long minDelayMs = 1100;
        private long estimatedMsPerLocation = 1200;
    }

    @Data
    public static class Executor {
        private int corePoolSize = 16;
        private int maxPoolSize = 64;
        private int queueCapacity = 256;
        private String threadNamePrefix = "geoenrich-";
    }

    @Data
    public static class Endpoints {
        private String weatherUrl = "https://api.open-meteo.com/v1/forecast";
        private String elevationUrl = "https://api.open-meteo.com/v1/elevation";
        private String censusUrl = "https://geocoding.geo.census.gov/geocoder/geographies/coordinates";
        private String acsUrl = "https://api.census.gov/data/2022/acs/acs5";
        private String nwsAlertsUrl = "https://api.weather.gov/alerts/active";
    }
}
