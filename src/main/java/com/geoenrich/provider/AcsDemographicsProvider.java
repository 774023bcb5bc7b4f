package com.geoenrich.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.geoenrich.client.JsonFetcher;
import com.geoenrich.config.EnrichmentProperties;
import com.geoenrich.model.LatLon;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tract-level American Community Survey figures for the tract that contains the point.
 * The tract is resolved through {@link CensusGeographyProvider} first.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AcsDemographicsProvider implements EnrichmentProvider {

    public static final String TYPE = "acs";

    private static final Map<String, String> VARIABLES = new LinkedHashMap<>();

    static {
        VARIABLES.put("B01003_001E", "acs_population");
        VARIABLES.put("B19013_001E", "acs_median_hh_income");
        VARIABLES.put("B01002_001E", "acs_median_age");
    }

    private final JsonFetcher jsonFetcher;
    private final CensusGeographyProvider censusGeography;
    private final EnrichmentProperties properties;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> enrich(LatLon origin, Double radiusMiles) {
        Map<String, Object> fips = censusGeography.enrich(origin, null);
        Object state = fips.get("fips_state");
        Object county = fips.get("fips_county");
        Object tract = fips.get("fips_tract6");
        Map<String, Object> out = new LinkedHashMap<>();
        if (state == null || county == null || tract == null) {
            log.debug("No census tract for {}, skipping ACS", origin);
            return out;
        }

        String url = UriComponentsBuilder.fromHttpUrl(properties.getEndpoints().getAcsUrl())
                .queryParam("get", String.join(",", VARIABLES.keySet()) + ",NAME")
                .queryParam("for", "tract:" + tract)
                .queryParam("in", "state:" + state + " county:" + county)
                .build()
                .encode()
                .toUriString();
        log.debug("ACS request: {}", url);

        // [[header...], [row...]]
        JsonNode table = jsonFetcher.fetchJson(url);
        if (!table.isArray() || table.size() < 2) {
            log.warn("ACS returned no rows for tract {}{}{}", state, county, tract);
            return out;
        }
        JsonNode header = table.get(0);
        JsonNode row = table.get(1);
        for (int i = 0; i < header.size(); i++) {
            String column = header.get(i).asText();
            if (VARIABLES.containsKey(column)) {
                out.put(VARIABLES.get(column), estimate(row.get(i)));
            } else if ("NAME".equals(column)) {
                out.put("acs_name", row.get(i) == null || row.get(i).isNull() ? null : row.get(i).asText());
            }
        }
        return out;
    }

    /**
     * Numeric estimate, or null for missing values and the negative annotation codes
     */
    static Number estimate(JsonNode cell) {
        if (cell == null || cell.isNull()) {
            return null;
        }
        String text = cell.asText().trim();
        try {
            double value = Double.parseDouble(text);
            if (value < 0) {
                return null;
            }
            if (text.contains(".")) {
                return value;
            }
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
