package com.geoenrich.exception;

import lombok.Getter;

/**
 * The feature service answered with a well-formed JSON error object
 */
@Getter
public class SourceQueryException extends EnrichmentException {

    private final String sourceId;
    private final Integer code;

    public SourceQueryException(String sourceId, Integer code, String message) {
        super(String.format("Source '%s' returned error%s: %s", sourceId, code != null ? " " + code : "", message));
        this.sourceId = sourceId;
        this.code = code;
    }
}
