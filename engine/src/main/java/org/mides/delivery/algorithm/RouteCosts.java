package org.mides.delivery.algorithm;

import org.mides.delivery.model.WeightedGraph;

import java.util.List;

public class RouteCosts {

    private RouteCosts() {
    }

    public static double totalCost(WeightedGraph graph, List<String> stops) {
        double total = 0;
        for (int i = 0; i < stops.size() - 1; i++) {
            var from = stops.get(i);
            var to = stops.get(i + 1);
            if (!graph.hasEdge(from, to))
                return Double.POSITIVE_INFINITY;
            total += graph.weight(from, to);
        }
        return total;
    }
}
