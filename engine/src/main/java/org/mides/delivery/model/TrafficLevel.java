package org.mides.delivery.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrafficLevel {
    LIGHT,
    MODERATE,
    HEAVY,
    VERY_HEAVY;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TrafficLevel fromMultiplier(double multiplier) {
        if (multiplier < 0.8)
            return LIGHT;
        if (multiplier < 1.2)
            return MODERATE;
        if (multiplier < 1.6)
            return HEAVY;
        return VERY_HEAVY;
    }
}
