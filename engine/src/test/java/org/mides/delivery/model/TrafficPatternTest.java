package org.mides.delivery.model;

import org.junit.jupiter.api.Test;
import org.mides.delivery.exception.InvalidReferenceDataException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TrafficPatternTest {

    @Test
    void appliesTo_hourPatternWithAreas_shouldMatchOnlyThoseAreas() {
        var rush = TrafficPattern.of("weekday_morning_rush", List.of(7, 8, 9), null, List.of("Ameerpet"), 1.8);

        assertTrue(rush.appliesTo("Ameerpet", 8, 2));
        assertFalse(rush.appliesTo("Uppal", 8, 2));
        assertFalse(rush.appliesTo("Ameerpet", 10, 2));
        /* No day restriction, so weekends match too */
        assertTrue(rush.appliesTo("Ameerpet", 8, 6));
    }

    @Test
    void appliesTo_dayPattern_shouldIgnoreHourAndArea() {
        var weekend = TrafficPattern.of("weekend_light", null, List.of(5, 6), null, 0.8);

        assertTrue(weekend.appliesTo("Anywhere", 3, 5));
        assertFalse(weekend.appliesTo("Anywhere", 3, 4));
        assertTrue(weekend.getHours().isEmpty());
        assertEquals(java.util.Set.of(5, 6), weekend.getDays().orElseThrow());
    }

    @Test
    void of_invalidDefinition_shouldThrow() {
        assertThrows(InvalidReferenceDataException.class,
            () -> TrafficPattern.of("always", null, null, null, 1.5));
        assertThrows(InvalidReferenceDataException.class,
            () -> TrafficPattern.of("negative", List.of(1), null, null, -0.1));
        assertThrows(InvalidReferenceDataException.class,
            () -> TrafficPattern.of("bad_hour", List.of(24), null, null, 1.0));
        assertThrows(InvalidReferenceDataException.class,
            () -> TrafficPattern.of("bad_day", null, List.of(7), null, 1.0));
        assertThrows(InvalidReferenceDataException.class,
            () -> TrafficPattern.of("", List.of(1), null, null, 1.0));
    }

    @Test
    void fromMultiplier_thresholds_shouldMapToLevels() {
        assertEquals(TrafficLevel.LIGHT, TrafficLevel.fromMultiplier(0.79));
        assertEquals(TrafficLevel.MODERATE, TrafficLevel.fromMultiplier(0.8));
        assertEquals(TrafficLevel.HEAVY, TrafficLevel.fromMultiplier(1.2));
        assertEquals(TrafficLevel.VERY_HEAVY, TrafficLevel.fromMultiplier(1.6));
        assertEquals("very_heavy", TrafficLevel.VERY_HEAVY.wireName());
    }

    @Test
    void fromName_wireNames_shouldResolveToClosedSet() {
        assertEquals(Algorithm.GENETIC, Algorithm.fromName("genetic"));
        assertEquals(Algorithm.A_STAR, Algorithm.fromName("a_star"));
        assertEquals(Algorithm.NEAREST_NEIGHBOR, Algorithm.fromName("nearest_neighbor"));
        assertEquals(Algorithm.UNRECOGNIZED, Algorithm.fromName("brute_force"));
        assertEquals(Algorithm.UNRECOGNIZED, Algorithm.fromName("unrecognized"));
        assertEquals(Algorithm.UNRECOGNIZED, Algorithm.fromName(null));
    }

    @Test
    void fromName_otherCaseOrPadding_shouldBeUnrecognized() {
        assertEquals(Algorithm.UNRECOGNIZED, Algorithm.fromName("Genetic"));
        assertEquals(Algorithm.UNRECOGNIZED, Algorithm.fromName("A_STAR"));
        assertEquals(Algorithm.UNRECOGNIZED, Algorithm.fromName(" a_star "));
    }
}
