package com.uitgo.proximity.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.uber.h3core.H3Core;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.io.IOException;

/**
 * Application configuration for the proximity index
 */
@Configuration
@EnableConfigurationProperties(ProximityProperties.class)
public class ProximityConfiguration {
    
    /** SRID of WGS84 longitude/latitude */
    public static final int WGS84_SRID = 4326;
    
    @Bean
    public GeometryFactory geometryFactory() {
        return new GeometryFactory(new PrecisionModel(), WGS84_SRID);
    }
    
    /**
     * H3Core is thread-safe, one instance is shared by the whole index
     */
    @Bean
    public H3Core h3Core() throws IOException {
        return H3Core.newInstance();
    }
    
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
