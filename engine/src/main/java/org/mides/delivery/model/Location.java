package org.mides.delivery.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;
import org.mides.delivery.exception.InvalidReferenceDataException;

/**
 * A named delivery location. Immutable once loaded; everything else refers to it by name.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Location {

    @JsonProperty("name")
    String name;

    @JsonProperty("lat")
    double latitude;

    @JsonProperty("lng")
    double longitude;

    @JsonProperty("type")
    String category;

    @JsonProperty("area_type")
    String areaType;

    /**
     * Creates a location, rejecting blank names and coordinates that are NaN or out of range.
     *
     * @throws InvalidReferenceDataException if any field is malformed
     */
    public static Location of(String name, double latitude, double longitude, String category, String areaType) {
        if (name == null || name.isBlank())
            throw new InvalidReferenceDataException("Location name must not be blank");

        if (Double.isNaN(latitude) || latitude < -90.0 || latitude > 90.0)
            throw new InvalidReferenceDataException(
                String.format("Location %s has invalid latitude %s", name, latitude)
            );

        if (Double.isNaN(longitude) || longitude < -180.0 || longitude > 180.0)
            throw new InvalidReferenceDataException(
                String.format("Location %s has invalid longitude %s", name, longitude)
            );

        return new Location(name, latitude, longitude, category, areaType);
    }

    public Coordinate coordinate() {
        return new Coordinate(latitude, longitude);
    }
}
