package com.geoenrich.query;

import com.geoenrich.exception.EnrichmentException;
import com.geoenrich.model.RawFeature;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one pagination run collected, with the reason it stopped
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PagedFeatures {

    public enum StopReason {
        /** An empty or short page without a "more" signal */
        COMPLETE,
        /** The next offset would have passed the configured bound */
        SAFETY_BOUND,
        /** A page request threw; features gathered so far are kept */
        FAILED
    }

    @Builder.Default
    private List<RawFeature> features = new ArrayList<>();

    private int pageRequests;

    private StopReason stopReason;

    /**
     * The error behind {@link StopReason#FAILED} or {@link StopReason#SAFETY_BOUND}
     */
    private EnrichmentException failure;

    public boolean isComplete() {
        return stopReason == StopReason.COMPLETE;
    }

    /**
     * A failure before any page returned a feature
     */
    public boolean isFailedEmpty() {
        return stopReason == StopReason.FAILED && (features == null || features.isEmpty());
    }
}
