package org.mides.delivery.service;

import org.springframework.stereotype.Service;

/**
 * Estimate used when no trained model is available: driving at an average speed plus a
 * fixed handling time per stop. Time of day, package size and weather are not considered.
 */
@Service
public class RuleBasedDeliveryTimeEstimator implements IDeliveryTimeEstimator {

    private static final double AVERAGE_SPEED_KMH = 30.0;
    private static final double MINUTES_PER_STOP = 5.0;

    @Override
    public double estimateMinutes(double distanceKm, int stopCount, int hour, int day, String packageSize, String weather) {
        if (!Double.isFinite(distanceKm) || distanceKm < 0)
            throw new IllegalArgumentException("distanceKm must be a finite non-negative number: " + distanceKm);
        if (stopCount < 0)
            throw new IllegalArgumentException("stopCount must not be negative: " + stopCount);

        double drivingMinutes = distanceKm / AVERAGE_SPEED_KMH * 60;
        return drivingMinutes + stopCount * MINUTES_PER_STOP;
    }
}
