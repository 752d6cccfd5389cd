package org.mides.delivery.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mides.delivery.exception.UnknownLocationException;
import org.mides.delivery.graph.GraphBuilder;
import org.mides.delivery.model.Location;
import org.mides.delivery.model.TrafficLevel;
import org.mides.delivery.model.TrafficPattern;
import org.mides.delivery.model.TrafficProfile;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TrafficServiceTest {

    private TrafficService trafficService;

    @BeforeEach
    void setUp() {
        var profile = new TrafficProfile(
            Map.of("Ameerpet", 1.4, "Uppal", 1.0),
            List.of(
                TrafficPattern.of("weekday_evening_rush", List.of(17, 18, 19), null, List.of("Ameerpet"), 2.0),
                TrafficPattern.of("night_minimal", List.of(22, 23, 0, 1, 2, 3, 4, 5), null, null, 0.6)
            ),
            Map.of("clear", 1.0, "rain", 1.3)
        );
        var graphBuilder = new GraphBuilder(List.of(
            Location.of("Ameerpet", 17.437462, 78.448288, "delivery_point", "commercial"),
            Location.of("Uppal", 17.401350, 78.559860, "delivery_point", "industrial")
        ), profile);
        trafficService = new TrafficService(graphBuilder);
    }

    @Test
    void predict_eveningRushInRain_shouldBeVeryHeavy() {
        var prediction = trafficService.predict("Ameerpet", 18, 1, "rain");

        // 1.4 * 2.0 * 1.3
        assertEquals(3.64, prediction.getTrafficMultiplier());
        assertEquals(TrafficLevel.VERY_HEAVY, prediction.getTrafficLevel());
        assertEquals("Ameerpet", prediction.getLocation());
        assertEquals(18, prediction.getConditions().getHour());
        assertEquals(1, prediction.getConditions().getDay());
        assertEquals("rain", prediction.getConditions().getWeather());
        assertTrue(prediction.isSuccess());
    }

    @Test
    void predict_shouldMapMultiplierToLevel() {
        assertEquals(TrafficLevel.MODERATE, trafficService.predict("Uppal", 12, 2, "clear").getTrafficLevel());
        assertEquals(TrafficLevel.LIGHT, trafficService.predict("Uppal", 23, 2, "clear").getTrafficLevel());
        assertEquals(TrafficLevel.HEAVY, trafficService.predict("Ameerpet", 12, 2, "clear").getTrafficLevel());
    }

    @Test
    void predict_unknownWeather_shouldCountAsNeutral() {
        assertEquals(1.4, trafficService.predict("Ameerpet", 12, 2, "hail").getTrafficMultiplier());
    }

    @Test
    void predict_unknownLocation_shouldThrow() {
        var ex = assertThrows(UnknownLocationException.class, () -> trafficService.predict("Atlantis", 12, 2, "clear"));
        assertEquals("Atlantis", ex.getLocation());
    }
}
