package org.mides.delivery.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mides.delivery.exception.InvalidReferenceDataException;
import org.mides.delivery.model.TrafficPattern;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.ClassPathResource;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceDataLoaderTest {

    private final ReferenceDataLoader loader = new ReferenceDataLoader(new ObjectMapper());

    @Test
    void loadLocations_bundledData_shouldReturnCatalogue() {
        var locations = loader.loadLocations(new ClassPathResource("data/locations.json"));

        assertFalse(locations.isEmpty());
        assertEquals("Warehouse", locations.get(0).getName());
        assertEquals("warehouse", locations.get(0).getCategory());
        assertTrue(locations.stream().allMatch(l -> l.getAreaType() != null));
    }

    @Test
    void loadTrafficProfile_bundledData_shouldKeepFileOrder() {
        var profile = loader.loadTrafficProfile(new ClassPathResource("data/historical_traffic.json"));

        assertEquals(
            List.of("weekday_morning_rush", "weekday_evening_rush", "night_minimal", "weekend_light"),
            profile.getPatterns().stream().map(TrafficPattern::getName).toList()
        );
        assertEquals(1.7, profile.weatherMultiplier("heavy_rain"));
        assertTrue(profile.getPatterns().get(2).getAffectedAreas().isEmpty());
        assertTrue(profile.getPatterns().get(3).getHours().isEmpty());
    }

    @Test
    void loadLocations_outOfRangeCoordinates_shouldThrow() {
        var json = "{\"Somewhere\": {\"lat\": 123.0, \"lng\": 10.0, \"type\": \"x\", \"area_type\": \"y\"}}";

        assertThrows(InvalidReferenceDataException.class,
            () -> loader.loadLocations(resource(json)));
    }

    @Test
    void loadLocations_missingCoordinates_shouldThrow() {
        var json = "{\"Somewhere\": {\"lng\": 10.0}}";

        assertThrows(InvalidReferenceDataException.class,
            () -> loader.loadLocations(resource(json)));
    }

    @Test
    void loadLocations_unreadableJson_shouldWrapFailure() {
        var ex = assertThrows(InvalidReferenceDataException.class,
            () -> loader.loadTrafficProfile(resource("{not json")));
        assertNotNull(ex.getCause());
    }

    private static ByteArrayResource resource(String json) {
        return new ByteArrayResource(json.getBytes(StandardCharsets.UTF_8));
    }
}
