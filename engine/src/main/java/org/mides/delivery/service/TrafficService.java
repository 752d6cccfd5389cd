package org.mides.delivery.service;

import org.mides.delivery.graph.GraphBuilder;
import org.mides.delivery.model.TrafficLevel;
import org.mides.delivery.model.api.TrafficConditions;
import org.mides.delivery.model.api.TrafficPredictionResponse;
import org.mides.delivery.util.Utils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Traffic prediction backed by the rule-based multiplier of the graph builder.
 */
@Service
public class TrafficService implements ITrafficService {

    private final GraphBuilder graphBuilder;

    @Autowired
    public TrafficService(GraphBuilder graphBuilder) {
        this.graphBuilder = graphBuilder;
    }

    @Override
    public TrafficPredictionResponse predict(String location, int hour, int day, String weather) {
        graphBuilder.getLocation(location);

        double multiplier = graphBuilder.trafficMultiplier(location, hour, day, weather);

        var response = new TrafficPredictionResponse();
        response.setLocation(location);
        response.setTrafficMultiplier(Utils.round(multiplier, 2));
        response.setTrafficLevel(TrafficLevel.fromMultiplier(multiplier));
        response.setConditions(new TrafficConditions(hour, day, weather));
        return response;
    }
}
