package org.mides.delivery.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TrafficConditions {

    @JsonProperty("hour")
    private int hour;

    @JsonProperty("day")
    private int day;

    @JsonProperty("weather")
    private String weather;
}
