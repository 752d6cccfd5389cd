package org.mides.delivery.service;

public interface IDeliveryTimeEstimator {
    /**
     * Estimated delivery time in minutes for an already planned route.
     */
    double estimateMinutes(double distanceKm, int stopCount, int hour, int day, String packageSize, String weather);
}
