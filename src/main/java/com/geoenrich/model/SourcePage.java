package com.geoenrich.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourcePage {

    @Builder.Default
    private List<RawFeature> features = new ArrayList<>();

    /**
     * Explicit "more data" signal from the service
     */
    private boolean hasMore;

    /**
     * Features the service sent, before malformed ones were dropped; null means none were dropped
     */
    private Integer returnedCount;

    public int size() {
        return features == null ? 0 : features.size();
    }

    /**
     * Raw page length used for paging decisions
     */
    public int received() {
        return returnedCount != null ? returnedCount : size();
    }

    public static SourcePage empty() {
        return SourcePage.builder().build();
    }
}
