package com.geoenrich.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.geoenrich.config.serializer.EsriGeometryDeserializer;
import com.geoenrich.config.serializer.GeometrySerializer;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

/**
 * Application configuration for the enrichment engine
 */
@Configuration
@EnableConfigurationProperties(EnrichmentProperties.class)
public class GeoEnrichConfiguration {

    @Bean
    public GeometryFactory geometryFactory() {
        return new GeometryFactory();
    }

    @Bean
    public EsriGeometryDeserializer esriGeometryDeserializer(GeometryFactory geometryFactory) {
        return new EsriGeometryDeserializer(geometryFactory);
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper(EsriGeometryDeserializer esriGeometryDeserializer) {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        SimpleModule geometryModule = new SimpleModule();
        geometryModule.addSerializer(Geometry.class, new GeometrySerializer());
        geometryModule.addDeserializer(Geometry.class, esriGeometryDeserializer);
        mapper.registerModule(geometryModule);

        return mapper;
    }

    /**
     * Per-call timeouts are the only cancellation mechanism for outbound requests
     */
    @Bean
    public RestTemplate enrichmentRestTemplate(EnrichmentProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getFetch().getConnectTimeoutMs());
        requestFactory.setReadTimeout(properties.getFetch().getReadTimeoutMs());
        return new RestTemplate(requestFactory);
    }

    @Bean(name = "enrichmentExecutor")
    public ThreadPoolTaskExecutor enrichmentExecutor(EnrichmentProperties properties) {
        EnrichmentProperties.Executor settings = properties.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(settings.getCorePoolSize());
        executor.setMaxPoolSize(settings.getMaxPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix(settings.getThreadNamePrefix());
        executor.setKeepAliveSeconds(60);
        executor.setAllowCoreThreadTimeOut(true);
        executor.initialize();
        return executor;
    }
}
