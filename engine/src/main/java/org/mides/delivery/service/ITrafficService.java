package org.mides.delivery.service;

import org.mides.delivery.model.api.TrafficPredictionResponse;

public interface ITrafficService {
    TrafficPredictionResponse predict(String location, int hour, int day, String weather);
}
