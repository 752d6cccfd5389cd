package org.mides.delivery.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.delivery.model.TrafficLevel;

@Data
@NoArgsConstructor
public class TrafficPredictionResponse {

    @JsonProperty("success")
    private boolean success = true;

    @JsonProperty("location")
    private String location;

    @JsonProperty("traffic_multiplier")
    private double trafficMultiplier;

    @JsonProperty("traffic_level")
    private TrafficLevel trafficLevel;

    @JsonProperty("conditions")
    private TrafficConditions conditions;
}
