package org.mides.delivery.model;

import lombok.Getter;
import lombok.ToString;
import org.mides.delivery.exception.InvalidReferenceDataException;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

/**
 * A named, time-bound traffic factor. Each restriction (hours, days, areas) is optional;
 * an absent restriction matches everything.
 */
@ToString
public final class TrafficPattern {

    @Getter
    private final String name;

    @Getter
    private final double multiplier;

    private final Set<Integer> hours;
    private final Set<Integer> days;
    private final Set<String> affectedAreas;

    private TrafficPattern(String name, Set<Integer> hours, Set<Integer> days, Set<String> affectedAreas, double multiplier) {
        this.name = name;
        this.hours = hours;
        this.days = days;
        this.affectedAreas = affectedAreas;
        this.multiplier = multiplier;
    }

    /**
     * Creates a validated pattern. {@code null} collections mean "no restriction".
     * At least one of {@code hours} or {@code days} has to be given.
     */
    public static TrafficPattern of(
        String name,
        Collection<Integer> hours,
        Collection<Integer> days,
        Collection<String> affectedAreas,
        double multiplier)
    {
        if (name == null || name.isBlank())
            throw new InvalidReferenceDataException("Traffic pattern name must not be blank");

        if (hours == null && days == null)
            throw new InvalidReferenceDataException(
                String.format("Traffic pattern %s must restrict hours or days", name)
            );

        if (!Double.isFinite(multiplier) || multiplier < 0)
            throw new InvalidReferenceDataException(
                String.format("Traffic pattern %s has invalid multiplier %s", name, multiplier)
            );

        if (hours != null && hours.stream().anyMatch(h -> h == null || h < 0 || h > 23))
            throw new InvalidReferenceDataException(
                String.format("Traffic pattern %s has hours outside 0-23: %s", name, hours)
            );

        if (days != null && days.stream().anyMatch(d -> d == null || d < 0 || d > 6))
            throw new InvalidReferenceDataException(
                String.format("Traffic pattern %s has days outside 0-6: %s", name, days)
            );

        return new TrafficPattern(
            name,
            hours == null ? null : Set.copyOf(hours),
            days == null ? null : Set.copyOf(days),
            affectedAreas == null ? null : Set.copyOf(affectedAreas),
            multiplier
        );
    }

    public Optional<Set<Integer>> getHours() {
        return Optional.ofNullable(hours);
    }

    public Optional<Set<Integer>> getDays() {
        return Optional.ofNullable(days);
    }

    public Optional<Set<String>> getAffectedAreas() {
        return Optional.ofNullable(affectedAreas);
    }

    public boolean appliesTo(String location, int hour, int day) {
        if (hours != null && !hours.contains(hour))
            return false;
        if (days != null && !days.contains(day))
            return false;
        return affectedAreas == null || affectedAreas.contains(location);
    }
}
