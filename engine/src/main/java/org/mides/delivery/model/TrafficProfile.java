package org.mides.delivery.model;

import lombok.Getter;
import org.mides.delivery.exception.InvalidReferenceDataException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Historical traffic reference data: per-location base multipliers, ordered time patterns
 * and weather factors.
 */
@Getter
public final class TrafficProfile {

    private final Map<String, Double> areaBaseTraffic;
    private final List<TrafficPattern> patterns;
    private final Map<String, Double> weatherImpact;

    public TrafficProfile(Map<String, Double> areaBaseTraffic, List<TrafficPattern> patterns, Map<String, Double> weatherImpact) {
        this.areaBaseTraffic = validated("area base traffic", areaBaseTraffic);
        this.patterns = patterns == null ? List.of() : List.copyOf(patterns);
        this.weatherImpact = validated("weather impact", weatherImpact);
    }

    public static TrafficProfile neutral() {
        return new TrafficProfile(Map.of(), List.of(), Map.of());
    }

    public double baseMultiplier(String location) {
        return areaBaseTraffic.getOrDefault(location, 1.0);
    }

    public double weatherMultiplier(String weather) {
        if (weather == null)
            return 1.0;
        return weatherImpact.getOrDefault(weather, 1.0);
    }

    private static Map<String, Double> validated(String table, Map<String, Double> values) {
        if (values == null)
            return Map.of();

        var copy = new LinkedHashMap<String, Double>();
        values.forEach((key, value) -> {
            if (value == null || !Double.isFinite(value) || value < 0)
                throw new InvalidReferenceDataException(
                    String.format("Invalid %s multiplier for %s: %s", table, key, value)
                );
            copy.put(key, value);
        });
        return Collections.unmodifiableMap(copy);
    }
}
