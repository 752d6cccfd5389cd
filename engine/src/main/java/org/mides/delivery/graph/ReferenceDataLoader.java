package org.mides.delivery.graph;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.delivery.exception.InvalidReferenceDataException;
import org.mides.delivery.model.Location;
import org.mides.delivery.model.TrafficPattern;
import org.mides.delivery.model.TrafficProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class ReferenceDataLoader {

    private static final Logger logger = LoggerFactory.getLogger(ReferenceDataLoader.class);

    private final ObjectMapper objectMapper;

    public ReferenceDataLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Location> loadLocations(Resource resource) {
        Map<String, LocationEntry> entries = read(resource, new TypeReference<LinkedHashMap<String, LocationEntry>>() {});

        var locations = new ArrayList<Location>();
        entries.forEach((name, entry) -> {
            if (entry == null || entry.getLat() == null || entry.getLng() == null)
                throw new InvalidReferenceDataException(
                    String.format("Location %s is missing coordinates", name)
                );
            locations.add(Location.of(name, entry.getLat(), entry.getLng(), entry.getType(), entry.getAreaType()));
        });

        logger.info("Loaded {} locations from {}", locations.size(), resource.getDescription());
        return locations;
    }

    public TrafficProfile loadTrafficProfile(Resource resource) {
        TrafficProfileEntry entry = read(resource, new TypeReference<TrafficProfileEntry>() {});

        var patterns = new ArrayList<TrafficPattern>();
        entry.getTrafficPatterns().forEach((name, pattern) -> {
            if (pattern == null || pattern.getMultiplier() == null)
                throw new InvalidReferenceDataException(
                    String.format("Traffic pattern %s is missing a multiplier", name)
                );
            patterns.add(TrafficPattern.of(
                name,
                pattern.getHours(),
                pattern.getDays(),
                pattern.getAffectedAreas(),
                pattern.getMultiplier()
            ));
        });

        logger.info("Loaded traffic profile with {} patterns and {} weather conditions from {}",
            patterns.size(), entry.getWeatherImpact().size(), resource.getDescription());
        return new TrafficProfile(entry.getAreaBaseTraffic(), patterns, entry.getWeatherImpact());
    }

    private <T> T read(Resource resource, TypeReference<T> type) {
        try (InputStream in = resource.getInputStream()) {
            T value = objectMapper.readValue(in, type);
            if (value == null)
                throw new InvalidReferenceDataException(
                    String.format("Reference data %s is empty", resource.getDescription())
                );
            return value;
        } catch (IOException e) {
            throw new InvalidReferenceDataException(
                String.format("Failed to read reference data %s", resource.getDescription()), e
            );
        }
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class LocationEntry {
        @JsonProperty("lat")
        private Double lat;

        @JsonProperty("lng")
        private Double lng;

        @JsonProperty("type")
        private String type;

        @JsonProperty("area_type")
        private String areaType;
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class TrafficProfileEntry {
        @JsonProperty("area_base_traffic")
        private Map<String, Double> areaBaseTraffic = new LinkedHashMap<>();

        /* Insertion order is the evaluation order */
        @JsonProperty("traffic_patterns")
        private LinkedHashMap<String, PatternEntry> trafficPatterns = new LinkedHashMap<>();

        @JsonProperty("weather_impact")
        private Map<String, Double> weatherImpact = new LinkedHashMap<>();
    }

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class PatternEntry {
        @JsonProperty("hours")
        private List<Integer> hours;

        @JsonProperty("days")
        private List<Integer> days;

        @JsonProperty("affected_areas")
        private List<String> affectedAreas;

        @JsonProperty("multiplier")
        private Double multiplier;
    }
}
