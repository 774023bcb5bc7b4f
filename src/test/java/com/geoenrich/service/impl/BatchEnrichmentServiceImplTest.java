package com.geoenrich.service.impl;

import com.geoenrich.model.LatLon;
import com.geoenrich.model.result.EnrichmentResult;
import com.geoenrich.service.EnrichmentService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BatchEnrichmentServiceImplTest {

    private static final LatLon FIRST = LatLon.of(29.76, -95.37);
    private static final LatLon SECOND = LatLon.of(30.27, -97.74);
    private static final LatLon THIRD = LatLon.of(32.78, -96.80);

    @Mock
    private EnrichmentService enrichmentService;

    @Test
    void testProcessesLocationsInOrderWithProgress() {
        // Given
        when(enrichmentService.enrichLocation(any(LatLon.class), anyMap(), anyList()))
                .thenAnswer(invocation -> EnrichmentResult.builder()
                        .location(invocation.getArgument(0))
                        .enrichments(Map.of("weather_ok", true))
                        .build());
        BatchEnrichmentServiceImpl batch = new BatchEnrichmentServiceImpl(enrichmentService, 0, 1200);
        List<long[]> progress = new ArrayList<>();

        // When
        List<EnrichmentResult> results = batch.enrichBatch(List.of(FIRST, SECOND, THIRD), Map.of(), List.of("weather"),
                (current, total, remaining) -> progress.add(new long[]{current, total, remaining}));

        // Then
        assertEquals(3, results.size());
        assertEquals(FIRST, results.get(0).getLocation());
        assertEquals(THIRD, results.get(2).getLocation());
        InOrder order = inOrder(enrichmentService);
        order.verify(enrichmentService).enrichLocation(eq(FIRST), anyMap(), anyList());
        order.verify(enrichmentService).enrichLocation(eq(SECOND), anyMap(), anyList());
        order.verify(enrichmentService).enrichLocation(eq(THIRD), anyMap(), anyList());

        assertEquals(3, progress.size());
        assertArrayEquals(new long[]{1, 3, 3600}, progress.get(0));
        assertArrayEquals(new long[]{3, 3, 1200}, progress.get(2));
    }

    @Test
    void testFailureForOneLocationBecomesErrorResult() {
        when(enrichmentService.enrichLocation(eq(FIRST), anyMap(), anyList()))
                .thenThrow(new IllegalStateException("executor shut down"));
        when(enrichmentService.enrichLocation(eq(SECOND), anyMap(), anyList()))
                .thenReturn(EnrichmentResult.builder().location(SECOND).build());
        BatchEnrichmentServiceImpl batch = new BatchEnrichmentServiceImpl(enrichmentService, 0, 1200);

        List<EnrichmentResult> results = batch.enrichBatch(List.of(FIRST, SECOND), Map.of(), List.of(), null);

        assertEquals(2, results.size());
        assertEquals("executor shut down", results.get(0).getEnrichments().get("error"));
        assertEquals(FIRST, results.get(0).getLocation());
        assertEquals(SECOND, results.get(1).getLocation());
    }

    @Test
    void testMinimumDelayBetweenLocations() {
        when(enrichmentService.enrichLocation(any(LatLon.class), anyMap(), anyList()))
                .thenAnswer(invocation -> EnrichmentResult.builder().location(invocation.getArgument(0)).build());
        BatchEnrichmentServiceImpl batch = new BatchEnrichmentServiceImpl(enrichmentService, 50, 1200);

        long start = System.currentTimeMillis();
        batch.enrichBatch(List.of(FIRST, SECOND, THIRD), Map.of(), List.of(), null);
        long elapsed = System.currentTimeMillis() - start;

        // two gaps for three locations, none after the last
        assertTrue(elapsed >= 100, "elapsed " + elapsed);
    }

    @Test
    void testInterruptStopsBatchWithFinishedResults() {
        when(enrichmentService.enrichLocation(any(LatLon.class), anyMap(), anyList()))
                .thenAnswer(invocation -> EnrichmentResult.builder().location(invocation.getArgument(0)).build());
        BatchEnrichmentServiceImpl batch = new BatchEnrichmentServiceImpl(enrichmentService, 10_000, 1200);

        Thread.currentThread().interrupt();
        try {
            List<EnrichmentResult> results = batch.enrichBatch(List.of(FIRST, SECOND), Map.of(), List.of(), null);
            assertEquals(1, results.size());
            assertTrue(Thread.currentThread().isInterrupted());
        } finally {
            Thread.interrupted();
        }
    }
}
