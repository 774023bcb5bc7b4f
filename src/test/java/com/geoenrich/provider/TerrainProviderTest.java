package com.geoenrich.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoenrich.client.JsonFetcher;
import com.geoenrich.config.EnrichmentProperties;
import com.geoenrich.exception.ResponseParseException;
import com.geoenrich.model.LatLon;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TerrainProviderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private JsonFetcher jsonFetcher;

    @Test
    void testFlatGridHasNoSlope() {
        double[][] flat = {{100, 100, 100}, {100, 100, 100}, {100, 100, 100}};

        assertEquals(0.0, TerrainProvider.slope(flat), 1e-12);
    }

    @Test
    void testHornSlopeAndAspect() {
        // Rises 9 m per 90 m cell toward higher row index
        double[][] grid = {{0, 0, 0}, {9, 9, 9}, {18, 18, 18}};

        double slope = TerrainProvider.slope(grid);
        double aspect = TerrainProvider.aspect(grid);

        assertEquals(Math.toDegrees(Math.atan(0.1)), slope, 1e-9);
        assertEquals(90.0, aspect, 1e-9);
        assertEquals("E", TerrainProvider.direction(aspect));
    }

    @Test
    void testSixteenPointDirections() {
        assertEquals("N", TerrainProvider.direction(0));
        assertEquals("NNE", TerrainProvider.direction(22.5));
        assertEquals("S", TerrainProvider.direction(180));
        assertEquals("NNW", TerrainProvider.direction(337.5));
        assertEquals("N", TerrainProvider.direction(355));
    }

    @Test
    void testEnrichBuildsGridRequestAndOutputs() throws Exception {
        // Given
        when(jsonFetcher.fetchJson(anyString())).thenReturn(objectMapper.readTree(
                "{\"elevation\":[10,10,10,19,19,19,28,28,28]}"));
        TerrainProvider provider = new TerrainProvider(jsonFetcher, new EnrichmentProperties());

        // When
        Map<String, Object> result = provider.enrich(LatLon.of(39.74, -104.99), null);

        // Then
        ArgumentCaptor<String> url = ArgumentCaptor.forClass(String.class);
        verify(jsonFetcher).fetchJson(url.capture());
        assertTrue(url.getValue().startsWith("https://api.open-meteo.com/v1/elevation?latitude="));
        assertEquals(9, url.getValue().split("latitude=")[1].split("&")[0].split(",").length);

        assertEquals(19.0, result.get("terrain_elevation"));
        assertEquals(5.7, result.get("terrain_slope"));
        assertEquals(90L, result.get("terrain_aspect"));
        assertEquals("E", result.get("terrain_slope_direction"));
        assertEquals(62L, result.get("elevation_ft"));
    }

    @Test
    void testIncompleteGridIsRejected() throws Exception {
        when(jsonFetcher.fetchJson(anyString())).thenReturn(objectMapper.readTree("{\"elevation\":[1,2,3]}"));
        TerrainProvider provider = new TerrainProvider(jsonFetcher, new EnrichmentProperties());

        assertThrows(ResponseParseException.class, () -> provider.enrich(LatLon.of(39.74, -104.99), null));
    }
}
