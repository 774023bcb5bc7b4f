package com.geoenrich.exception;

/**
 * Root of the enrichment engine's unchecked error hierarchy
 */
public class EnrichmentException extends RuntimeException {

    public EnrichmentException(String message) {
        super(message);
    }

    public EnrichmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
