package org.mides.delivery.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.mides.delivery.graph.GraphBuilder;
import org.mides.delivery.graph.ReferenceDataLoader;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class ReferenceDataConfiguration {

    @Bean
    public ReferenceDataLoader referenceDataLoader(ObjectMapper objectMapper) {
        return new ReferenceDataLoader(objectMapper);
    }

    @Bean
    public GraphBuilder graphBuilder(
        ReferenceDataLoader loader,
        ResourceLoader resourceLoader,
        GraphConfiguration graphConfig)
    {
        var locations = loader.loadLocations(resourceLoader.getResource(graphConfig.getLocationsFile()));
        var trafficProfile = loader.loadTrafficProfile(resourceLoader.getResource(graphConfig.getTrafficFile()));
        return new GraphBuilder(locations, trafficProfile);
    }
}
