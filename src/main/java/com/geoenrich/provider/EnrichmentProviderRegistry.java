package com.geoenrich.provider;

import com.geoenrich.config.EnrichmentProperties;
import com.geoenrich.config.SourceDefinition;
import com.geoenrich.exception.UnknownEnrichmentTypeException;
import com.geoenrich.model.result.SourceSummary;
import com.geoenrich.service.ProximityService;
import com.geoenrich.source.SpatialSourceFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves enrichment type keys to providers: the built-in providers plus one
 * {@link FeatureSourceProvider} per configured source
 */
@Slf4j
@Component
public class EnrichmentProviderRegistry {

    private final Map<String, EnrichmentProvider> providers = new LinkedHashMap<>();
    private final List<String> alwaysOn;

    @Autowired
    public EnrichmentProviderRegistry(List<EnrichmentProvider> builtIn, EnrichmentProperties properties,
                                      SpatialSourceFactory sourceFactory, ProximityService proximityService) {
        this.alwaysOn = List.copyOf(properties.getAlwaysOn());
        builtIn.forEach(this::register);
        for (SourceDefinition definition : properties.resolvedSources().values()) {
            register(new FeatureSourceProvider(definition, sourceFactory.create(definition), proximityService));
        }
        log.info("Registered {} enrichment type(s), always on: {}", providers.size(), alwaysOn);
    }

    public EnrichmentProviderRegistry(Collection<EnrichmentProvider> providers, List<String> alwaysOn) {
        this.alwaysOn = List.copyOf(alwaysOn);
        providers.forEach(this::register);
    }

    public Optional<EnrichmentProvider> find(String type) {
        return Optional.ofNullable(providers.get(type));
    }

    public EnrichmentProvider require(String type) {
        return find(type).orElseThrow(() -> new UnknownEnrichmentTypeException(type));
    }

    public List<String> getAlwaysOn() {
        return alwaysOn;
    }

    public Collection<EnrichmentProvider> all() {
        return Collections.unmodifiableCollection(providers.values());
    }

    public List<SourceSummary> summaries() {
        List<SourceSummary> summaries = new ArrayList<>();
        for (EnrichmentProvider provider : providers.values()) {
            SourceSummary.SourceSummaryBuilder summary = SourceSummary.builder()
                    .id(provider.getType())
                    .label(provider.getType())
                    .kind("builtin")
                    .alwaysOn(alwaysOn.contains(provider.getType()));
            if (provider instanceof FeatureSourceProvider) {
                SourceDefinition definition = ((FeatureSourceProvider) provider).getDefinition();
                summary.label(definition.getLabel())
                        .kind("feature-service")
                        .geometryType(definition.getGeometryType())
                        .defaultRadiusMiles(definition.getDefaultRadiusMiles())
                        .maxRadiusMiles(definition.getMaxRadiusMiles());
            }
            summaries.add(summary.build());
        }
        return summaries;
    }

    private void register(EnrichmentProvider provider) {
        EnrichmentProvider previous = providers.put(provider.getType(), provider);
        if (previous != null) {
            log.warn("Enrichment type '{}' registered twice; keeping the later one", provider.getType());
        }
    }
}
