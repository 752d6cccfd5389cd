package org.mides.delivery.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class DeliveryEstimateResponse {

    @JsonProperty("success")
    private boolean success = true;

    @JsonProperty("estimated_time_minutes")
    private double estimatedTimeMinutes;

    @JsonProperty("estimated_time_hours")
    private double estimatedTimeHours;

    @JsonProperty("parameters")
    private DeliveryEstimateRequest parameters;
}
