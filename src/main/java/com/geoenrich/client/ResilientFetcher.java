package com.geoenrich.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.geoenrich.config.EnrichmentProperties;
import com.geoenrich.exception.EnrichmentException;
import com.geoenrich.exception.NetworkException;
import com.geoenrich.exception.ResponseParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Fetches JSON through an ordered list of strategies: the direct URL first, then each
 * configured proxy. A fixed delay separates attempts; the last failure is rethrown once
 * every strategy has been tried. Nothing is cached.
 */
@Slf4j
@Component
public class ResilientFetcher implements JsonFetcher {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final List<FetchStrategy> strategies;
    private final long attemptDelayMs;

    @Autowired
    public ResilientFetcher(RestTemplate enrichmentRestTemplate, ObjectMapper objectMapper,
                            EnrichmentProperties properties) {
        this(enrichmentRestTemplate, objectMapper, strategiesFrom(properties.getFetch()),
                properties.getFetch().getAttemptDelayMs());
    }

    public ResilientFetcher(RestTemplate restTemplate, ObjectMapper objectMapper,
                            List<FetchStrategy> strategies, long attemptDelayMs) {
        if (strategies == null || strategies.isEmpty()) {
            throw new IllegalArgumentException("At least one fetch strategy is required");
        }
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.strategies = Collections.unmodifiableList(new ArrayList<>(strategies));
        this.attemptDelayMs = attemptDelayMs;
    }

    static List<FetchStrategy> strategiesFrom(EnrichmentProperties.Fetch fetch) {
        List<FetchStrategy> strategies = new ArrayList<>();
        strategies.add(FetchStrategy.direct());
        strategies.addAll(fetch.getProxies().stream()
                .map(FetchStrategy::fromProxy)
                .collect(Collectors.toList()));
        return strategies;
    }

    public List<FetchStrategy> getStrategies() {
        return strategies;
    }

    @Override
    public JsonNode fetchJson(String url) {
        EnrichmentException lastError = null;

        for (int i = 0; i < strategies.size(); i++) {
            String target = strategies.get(i).apply(url);
            try {
                log.debug("Attempt {}/{}: GET {}", i + 1, strategies.size(), target);
                JsonNode body = parse(target, get(target));
                log.debug("Parsed JSON from {}", target);
                return body;
            } catch (NetworkException | ResponseParseException e) {
                lastError = e;
                log.warn("Attempt {}/{} failed for {}: {}", i + 1, strategies.size(), target, e.getMessage());
            }

            if (i < strategies.size() - 1) {
                pause();
            }
        }

        log.error("All {} attempts failed for {}", strategies.size(), url);
        throw lastError;
    }

    private String get(String target) {
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        try {
            ResponseEntity<String> response = restTemplate.exchange(
                    URI.create(target), HttpMethod.GET, new HttpEntity<>(headers), String.class);
            return response.getBody();
        } catch (RestClientException e) {
            throw new NetworkException("Request to " + target + " failed: " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new NetworkException("Invalid URL: " + target, e);
        }
    }

    private JsonNode parse(String target, String body) {
        if (body == null || body.isBlank()) {
            throw new ResponseParseException("Empty response body from " + target);
        }
        String head = body.stripLeading().toLowerCase(Locale.ROOT);
        if (head.startsWith("<html") || head.startsWith("<!doctype")) {
            throw new ResponseParseException("Received HTML instead of JSON from " + target);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ResponseParseException("Invalid JSON response from " + target, e);
        }
    }

    private void pause() {
        if (attemptDelayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(attemptDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NetworkException("Interrupted between fetch attempts", e);
        }
    }
}
