package org.mides.delivery.model;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Coordinate {
    @NotNull
    private Double latitude;

    @NotNull
    private Double longitude;

    /* [lat, lng] pair as drawn by the map client */
    public List<Double> toLatLng() {
        return List.of(latitude, longitude);
    }

    @Override
    public String toString() {
        return String.format("%.6f,%.6f", latitude, longitude);
    }
}
