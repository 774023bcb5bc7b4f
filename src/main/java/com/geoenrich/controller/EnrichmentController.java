package com.geoenrich.controller;

import com.geoenrich.model.LatLon;
import com.geoenrich.model.param.BatchEnrichParam;
import com.geoenrich.model.param.EnrichRequestParam;
import com.geoenrich.model.result.ApiResponse;
import com.geoenrich.model.result.EnrichmentResult;
import com.geoenrich.model.result.PerformanceSnapshot;
import com.geoenrich.model.result.SourceSummary;
import com.geoenrich.provider.EnrichmentProviderRegistry;
import com.geoenrich.service.BatchEnrichmentService;
import com.geoenrich.service.EnrichmentMetrics;
import com.geoenrich.service.EnrichmentService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * HTTP REST API for enrichment
 */
@RestController
@RequestMapping("/api/v1")
@Slf4j
public class EnrichmentController {

    @Autowired
    private EnrichmentService enrichmentService;

    @Autowired
    private BatchEnrichmentService batchEnrichmentService;

    @Autowired
    private EnrichmentProviderRegistry providerRegistry;

    @Autowired
    private EnrichmentMetrics enrichmentMetrics;

    /**
     * POST /api/v1/enrich
     */
    @PostMapping("/enrich")
    public ResponseEntity<ApiResponse<EnrichmentResult>> enrich(@RequestBody EnrichRequestParam param) {
        if (param == null || !param.hasValidCoordinates()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("Valid lat (-90..90) and lon (-180..180) are required"));
        }
        LatLon origin = LatLon.of(param.getLat(), param.getLon());
        EnrichmentResult result = enrichmentService.enrichLocation(origin, param.getRadii(), param.getTypes());
        return ResponseEntity.ok(ApiResponse.success(result, result.getElapsedMs()));
    }

    /**
     * POST /api/v1/enrich/batch
     */
    @PostMapping("/enrich/batch")
    public ResponseEntity<ApiResponse<List<EnrichmentResult>>> enrichBatch(@RequestBody BatchEnrichParam param) {
        if (param == null || param.getLocations() == null || param.getLocations().isEmpty()) {
            return ResponseEntity.badRequest().body(ApiResponse.error("At least one location is required"));
        }
        long start = System.currentTimeMillis();
        List<EnrichmentResult> results = batchEnrichmentService.enrichBatch(
                param.getLocations(), param.getRadii(), param.getTypes(),
                (current, total, remainingMs) -> log.info("Batch progress {}/{}, ~{}ms remaining", current, total, remainingMs));
        return ResponseEntity.ok(ApiResponse.success(results, System.currentTimeMillis() - start));
    }

    /**
     * GET /api/v1/enrich/metrics
     */
    @GetMapping("/enrich/metrics")
    public ResponseEntity<ApiResponse<PerformanceSnapshot>> metrics() {
        return ResponseEntity.ok(ApiResponse.success(enrichmentMetrics.snapshot()));
    }

    /**
     * GET /api/v1/sources
     */
    @GetMapping("/sources")
    public ResponseEntity<ApiResponse<List<SourceSummary>>> sources() {
        return ResponseEntity.ok(ApiResponse.success(providerRegistry.summaries()));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, IllegalArgumentException.class})
    public ResponseEntity<ApiResponse<Void>> handleBadRequest(Exception e) {
        log.debug("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ApiResponse.error("Invalid request: " + e.getMessage()));
    }
}
