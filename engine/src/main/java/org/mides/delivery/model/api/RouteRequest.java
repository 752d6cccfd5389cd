package org.mides.delivery.model.api;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
public class RouteRequest {

    @NotBlank
    @JsonProperty("start")
    private String start = "Warehouse";

    /* Single destination; ignored when stops are given */
    @JsonProperty("end")
    private String end;

    @JsonProperty("stops")
    private List<String> stops = new ArrayList<>();

    @JsonProperty("algorithm")
    private String algorithm = "genetic";

    /* Current local hour when absent */
    @Min(0)
    @Max(23)
    @JsonProperty("hour")
    private Integer hour;

    /* 0 = Monday ... 6 = Sunday, today when absent */
    @Min(0)
    @Max(6)
    @JsonProperty("day")
    private Integer day;

    @JsonProperty("weather")
    private String weather = "clear";

    @JsonProperty("package_size")
    private String packageSize = "medium";

    @JsonIgnore
    public boolean isMultiStop() {
        return stops != null && !stops.isEmpty();
    }
}
