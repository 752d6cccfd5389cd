package org.mides.delivery.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class TrafficPredictionRequest {

    @NotBlank
    @JsonProperty("location")
    private String location;

    @Min(0)
    @Max(23)
    @JsonProperty("hour")
    private Integer hour;

    @Min(0)
    @Max(6)
    @JsonProperty("day")
    private Integer day;

    @JsonProperty("weather")
    private String weather = "clear";
}
