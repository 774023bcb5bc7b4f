package com.geoenrich.exception;

import lombok.Getter;

/**
 * Pagination offset passed the configured safety bound. Recorded, never thrown past the paginator.
 */
@Getter
public class PaginationSafetyException extends EnrichmentException {

    private final String sourceId;
    private final int offset;
    private final int maxOffset;

    public PaginationSafetyException(String sourceId, int offset, int maxOffset) {
        super(String.format("Source '%s' stopped at offset %d (safety bound %d)", sourceId, offset, maxOffset));
        this.sourceId = sourceId;
        this.offset = offset;
        this.maxOffset = maxOffset;
    }
}
