package com.geoenrich.exception;

/**
 * Response body was not JSON, or was an HTML page served in place of JSON
 */
public class ResponseParseException extends EnrichmentException {

    public ResponseParseException(String message) {
        super(message);
    }

    public ResponseParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
