package org.mides.delivery.algorithm;

import org.mides.delivery.model.Route;
import org.mides.delivery.model.WeightedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

@Component
public class NearestNeighborTour {

    private static final Logger logger = LoggerFactory.getLogger(NearestNeighborTour.class);

    public Route tour(WeightedGraph graph, String start, List<String> stops) {
        graph.requireNode(start);
        stops.forEach(graph::requireNode);

        if (stops.isEmpty())
            return Route.trivial(start);

        var route = new ArrayList<String>();
        route.add(start);

        /* Request order decides ties */
        var remaining = new LinkedHashSet<>(stops);
        var current = start;
        double total = 0;

        while (!remaining.isEmpty()) {
            String nearest = null;
            double nearestDistance = Double.POSITIVE_INFINITY;
            for (var candidate : remaining) {
                double distance = graph.weight(current, candidate);
                if (distance < nearestDistance) {
                    nearest = candidate;
                    nearestDistance = distance;
                }
            }

            if (nearest == null) {
                logger.warn("No edge from {} to any of {} remaining stops, returning partial route",
                    current, remaining.size());
                break;
            }

            route.add(nearest);
            remaining.remove(nearest);
            total += nearestDistance;
            current = nearest;
        }

        if (graph.hasEdge(current, start)) {
            route.add(start);
            total += graph.weight(current, start);
        }

        return new Route(route, total);
    }
}
