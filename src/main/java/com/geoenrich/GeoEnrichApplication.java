package com.geoenrich;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Geospatial proximity enrichment service
 * Answers "what does each configured dataset contain at or near this point?"
 */
@SpringBootApplication
public class GeoEnrichApplication {
    public static void main(String[] args) {
        SpringApplication.run(GeoEnrichApplication.class, args);
    }
}
