package org.mides.delivery.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "graph")
public class GraphConfiguration {
    private String locationsFile = "classpath:data/locations.json";
    private String trafficFile = "classpath:data/historical_traffic.json";
}
