package org.mides.delivery.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.delivery.converter.AlgorithmSerializer;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MultiStopResult {

    @JsonProperty("route")
    private List<String> route = new ArrayList<>();

    @JsonProperty("distance")
    private double distance;

    /* The algorithm that actually produced the route */
    @JsonProperty("algorithm")
    @JsonSerialize(using = AlgorithmSerializer.class)
    private Algorithm algorithm;

    @JsonProperty("requested_algorithm")
    private String requestedAlgorithm;

    @JsonProperty("num_stops")
    private int numStops;

    @JsonProperty("complete")
    private boolean complete = true;

    @JsonProperty("note")
    private String note;
}
