package org.mides.delivery.model;

import lombok.Value;

import java.util.List;

/**
 * An ordered stop sequence and its total traffic-adjusted cost. An empty sequence with an
 * infinite cost means no path exists.
 */
@Value
public class Route {

    List<String> stops;
    double distance;

    public Route(List<String> stops, double distance) {
        this.stops = List.copyOf(stops);
        this.distance = distance;
    }

    public static Route unreachable() {
        return new Route(List.of(), Double.POSITIVE_INFINITY);
    }

    public static Route trivial(String start) {
        return new Route(List.of(start), 0);
    }

    public boolean isReachable() {
        return !stops.isEmpty() && Double.isFinite(distance);
    }

    public boolean isClosed() {
        return stops.size() > 1 && stops.get(0).equals(stops.get(stops.size() - 1));
    }
}
