package com.geoenrich.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative alias table: canonical field name to the attribute names different
 * services use for it. One lookup replaces the per-adapter "NAME || Name || name" chains.
 */
public final class FieldAliases {

    /**
     * Identity candidates in priority order
     */
    public static final List<String> DEFAULT_IDENTITY_FIELDS = List.of(
            "objectId", "OBJECTID", "objectid", "OBJECTID_1", "FID", "fid",
            "GLOBALID", "GlobalID", "globalid", "ESRI_OID");

    private static final FieldAliases EMPTY = new FieldAliases(Collections.emptyMap());

    private final Map<String, List<String>> aliases;

    private FieldAliases(Map<String, List<String>> aliases) {
        this.aliases = aliases;
    }

    public static FieldAliases of(Map<String, List<String>> table) {
        if (table == null || table.isEmpty()) {
            return EMPTY;
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        table.forEach((canonical, names) -> copy.put(canonical, names == null ? List.of() : List.copyOf(names)));
        return new FieldAliases(Collections.unmodifiableMap(copy));
    }

    public static FieldAliases empty() {
        return EMPTY;
    }

    public Set<String> canonicalFields() {
        return aliases.keySet();
    }

    public List<String> aliasesFor(String canonical) {
        return aliases.getOrDefault(canonical, List.of());
    }

    /**
     * Resolve one canonical field against a raw attribute map
     */
    public Optional<Map.Entry<String, Object>> resolve(Map<String, Object> attributes, String canonical) {
        return lookup(attributes, aliasesFor(canonical));
    }

    /**
     * First non-null, non-blank value among the candidate names. Exact names are tried in
     * order first, then the same names ignoring case. Returns the matched key with the value.
     */
    public static Optional<Map.Entry<String, Object>> lookup(Map<String, Object> attributes, List<String> candidates) {
        if (attributes == null || attributes.isEmpty() || candidates == null) {
            return Optional.empty();
        }
        for (String candidate : candidates) {
            Object value = attributes.get(candidate);
            if (isPresent(value)) {
                return Optional.of(Map.entry(candidate, value));
            }
        }
        for (String candidate : candidates) {
            for (Map.Entry<String, Object> entry : attributes.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(candidate) && isPresent(entry.getValue())) {
                    return Optional.of(Map.entry(entry.getKey(), entry.getValue()));
                }
            }
        }
        return Optional.empty();
    }

    private static boolean isPresent(Object value) {
        if (value == null) {
            return false;
        }
        return !(value instanceof String) || !((String) value).isBlank();
    }
}
