package com.geoenrich.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Merged result of one source query. {@code nearby} is ascending by distance and no
 * identity appears twice across both lists.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProximityResultSet {

    @Builder.Default
    private List<AnnotatedFeature> containing = new ArrayList<>();

    @Builder.Default
    private List<AnnotatedFeature> nearby = new ArrayList<>();

    public int totalCount() {
        return containing.size() + nearby.size();
    }

    public List<AnnotatedFeature> all() {
        List<AnnotatedFeature> all = new ArrayList<>(containing);
        all.addAll(nearby);
        return all;
    }

    public static ProximityResultSet empty() {
        return ProximityResultSet.builder().build();
    }
}
