package com.geoenrich.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.geoenrich.config.serializer.RoundedMilesSerializer;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.locationtech.jts.geom.Geometry;

import java.util.Map;

/**
 * A feature classified against a query origin. Containing features always carry
 * {@code distanceMiles == 0}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnnotatedFeature {

    private String identity;
    private String sourceId;
    private Geometry geometry;

    @JsonIgnore
    private FeatureAttributes attributes;

    @JsonSerialize(using = RoundedMilesSerializer.class)
    private double distanceMiles;

    @JsonProperty("isContaining")
    private boolean containing;

    @JsonProperty("fields")
    public Map<String, Object> getFields() {
        return attributes == null ? Map.of() : attributes.getCanonical();
    }

    @JsonProperty("extra")
    public Map<String, Object> getExtraAttributes() {
        return attributes == null ? Map.of() : attributes.getExtra();
    }
}
