package com.geoenrich.exception;

/**
 * A fetch attempt failed at the transport level: connection error, timeout or non-2xx status
 */
public class NetworkException extends EnrichmentException {

    public NetworkException(String message) {
        super(message);
    }

    public NetworkException(String message, Throwable cause) {
        super(message, cause);
    }
}
