package org.mides.delivery.model.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.delivery.converter.AlgorithmSerializer;
import org.mides.delivery.model.Algorithm;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RouteResponse {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("route")
    private List<String> route = new ArrayList<>();

    /* [lat, lng] for every stop in route */
    @JsonProperty("route_coords")
    private List<List<Double>> routeCoords = new ArrayList<>();

    /* Null when no path exists */
    @JsonProperty("distance")
    private Double distance;

    @JsonProperty("estimated_time_minutes")
    private Double estimatedTimeMinutes;

    @JsonProperty("algorithm")
    @JsonSerialize(using = AlgorithmSerializer.class)
    private Algorithm algorithm;

    @JsonProperty("requested_algorithm")
    private String requestedAlgorithm;

    @JsonProperty("complete")
    private boolean complete = true;

    @JsonProperty("note")
    private String note;

    @JsonProperty("traffic_conditions")
    private TrafficConditions trafficConditions;
}
