package com.geoenrich.exception;

public class UnknownEnrichmentTypeException extends EnrichmentException {

    public UnknownEnrichmentTypeException(String type) {
        super("Unknown enrichment type: " + type);
    }
}
