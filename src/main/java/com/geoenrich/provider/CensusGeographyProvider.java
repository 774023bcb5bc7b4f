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
 * FIPS codes and named census geographies from the Census geocoder
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CensusGeographyProvider implements EnrichmentProvider {

    public static final String TYPE = "census";

    private final JsonFetcher jsonFetcher;
    private final EnrichmentProperties properties;

    @Override
    public String getType() {
        return TYPE;
    }

    @Override
    public Map<String, Object> enrich(LatLon origin, Double radiusMiles) {
        String url = UriComponentsBuilder.fromHttpUrl(properties.getEndpoints().getCensusUrl())
                .queryParam("x", origin.getLon())
                .queryParam("y", origin.getLat())
                .queryParam("benchmark", "Public_AR_Current")
                .queryParam("vintage", "Current_Current")
                .queryParam("format", "json")
                .build()
                .encode()
                .toUriString();
        log.debug("Census geographies request: {}", url);

        JsonNode geographies = jsonFetcher.fetchJson(url).path("result").path("geographies");
        Map<String, Object> out = new LinkedHashMap<>();
        if (!geographies.isObject()) {
            log.warn("Census geocoder returned no geographies for {}", origin);
            return out;
        }

        JsonNode state = first(geographies, "States");
        JsonNode county = first(geographies, "Counties");
        JsonNode tract = first(geographies, "Census Tracts");
        JsonNode block = first(geographies, "2020 Census Blocks");
        JsonNode place = first(geographies, "Incorporated Places");

        if (state != null && county != null && tract != null && block != null) {
            out.put("fips_state", text(state, "STATE"));
            out.put("fips_county", text(county, "COUNTY"));
            out.put("fips_tract", text(tract, "GEOID"));
            out.put("fips_tract6", text(tract, "TRACT"));
            out.put("fips_block", text(block, "GEOID"));
        }
        if (state != null) {
            out.put("state_name", text(state, "NAME"));
            out.put("state_code", text(state, "STUSAB"));
            out.put("state_geoid", text(state, "GEOID"));
        }
        if (county != null) {
            out.put("county_name", text(county, "NAME"));
            out.put("county_geoid", text(county, "GEOID"));
        }
        if (tract != null) {
            out.put("census_tract_name", text(tract, "NAME"));
            out.put("census_tract_geoid", text(tract, "GEOID"));
        }
        if (block != null) {
            out.put("census_block_name", text(block, "NAME"));
            out.put("census_block_geoid", text(block, "GEOID"));
            out.put("census_block_urban_rural", "U".equals(text(block, "UR")) ? "Urban" : "Rural");
        }
        if (place != null) {
            out.put("city_name", text(place, "NAME"));
            out.put("city_geoid", text(place, "GEOID"));
        }
        return out;
    }

    private static JsonNode first(JsonNode geographies, String layer) {
        JsonNode items = geographies.path(layer);
        return items.isArray() && items.size() > 0 ? items.get(0) : null;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
