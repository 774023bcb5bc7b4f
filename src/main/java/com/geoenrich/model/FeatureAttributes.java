package com.geoenrich.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Attribute bag of a feature: canonical fields resolved through a {@link FieldAliases}
 * table, plus every remaining attribute in {@code extra}
 */
@Getter
@ToString
@EqualsAndHashCode
public class FeatureAttributes {

    private final Map<String, Object> canonical;
    private final Map<String, Object> extra;

    private FeatureAttributes(Map<String, Object> canonical, Map<String, Object> extra) {
        this.canonical = Collections.unmodifiableMap(canonical);
        this.extra = Collections.unmodifiableMap(extra);
    }

    public static FeatureAttributes of(Map<String, Object> raw) {
        return new FeatureAttributes(new LinkedHashMap<>(), raw == null ? new LinkedHashMap<>() : new LinkedHashMap<>(raw));
    }

    public static FeatureAttributes empty() {
        return of(null);
    }

    /**
     * Value by canonical name first, then by raw attribute name
     */
    public Object get(String key) {
        Object value = canonical.get(key);
        return value != null ? value : extra.get(key);
    }

    public Optional<Object> first(List<String> candidates) {
        return FieldAliases.lookup(asMap(), candidates).map(Map.Entry::getValue);
    }

    /**
     * Moves the attributes matched by {@code aliases} into the canonical map. Matched raw
     * keys leave {@code extra}; nothing is dropped.
     */
    public FeatureAttributes canonicalize(FieldAliases aliases) {
        Map<String, Object> resolved = new LinkedHashMap<>(canonical);
        Map<String, Object> remaining = new LinkedHashMap<>(extra);
        for (String field : aliases.canonicalFields()) {
            aliases.resolve(extra, field).ifPresent(match -> {
                resolved.put(field, match.getValue());
                remaining.remove(match.getKey());
            });
        }
        return new FeatureAttributes(resolved, remaining);
    }

    /**
     * Flat view with canonical names taking precedence
     */
    @JsonIgnore
    public Map<String, Object> asMap() {
        Map<String, Object> all = new LinkedHashMap<>(extra);
        all.putAll(canonical);
        return all;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return canonical.isEmpty() && extra.isEmpty();
    }
}
