package org.mides.delivery.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class DeliveryEstimateRequest {

    @NotNull
    @PositiveOrZero
    @JsonProperty("distance_km")
    private Double distanceKm;

    @PositiveOrZero
    @JsonProperty("num_stops")
    private int numStops = 1;

    @Min(0)
    @Max(23)
    @JsonProperty("hour")
    private Integer hour;

    @Min(0)
    @Max(6)
    @JsonProperty("day")
    private Integer day;

    @JsonProperty("package_size")
    private String packageSize = "medium";

    @JsonProperty("weather")
    private String weather = "clear";
}
