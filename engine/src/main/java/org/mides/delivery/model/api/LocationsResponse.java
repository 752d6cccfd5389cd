package org.mides.delivery.model.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.mides.delivery.model.Location;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationsResponse {

    @JsonProperty("locations")
    private List<Location> locations = new ArrayList<>();
}
