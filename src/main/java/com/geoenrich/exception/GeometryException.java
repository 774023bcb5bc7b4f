package com.geoenrich.exception;

/**
 * Missing or malformed feature geometry. The offending feature is dropped; the batch continues.
 */
public class GeometryException extends EnrichmentException {

    public GeometryException(String message) {
        super(message);
    }

    public GeometryException(String message, Throwable cause) {
        super(message, cause);
    }
}
