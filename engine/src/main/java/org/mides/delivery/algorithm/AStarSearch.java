package org.mides.delivery.algorithm;

import org.mides.delivery.model.Coordinate;
import org.mides.delivery.model.Route;
import org.mides.delivery.model.WeightedGraph;
import org.mides.delivery.util.GeoUtils;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;

/* Heuristic is not admissible once edges are discounted below 1.0 */
@Component
public class AStarSearch {

    public Route shortestPath(WeightedGraph graph, Map<String, Coordinate> coordinates, String start, String end) {
        graph.requireNode(start);
        graph.requireNode(end);

        var gScore = new HashMap<String, Double>();
        var previous = new HashMap<String, String>();
        var open = new PriorityQueue<SearchEntry>();

        gScore.put(start, 0.0);
        open.add(new SearchEntry(heuristic(coordinates, start, end), 0.0, start));

        while (!open.isEmpty()) {
            var entry = open.poll();
            var current = entry.node;

            /* A cheaper path to this node was queued after this entry */
            if (entry.cost > gScore.get(current))
                continue;

            if (current.equals(end))
                return new Route(PathReconstruction.walkBack(previous, start, end), gScore.get(end));

            for (var edge : graph.neighbors(current).entrySet()) {
                var neighbor = edge.getKey();
                double tentative = entry.cost + edge.getValue();

                if (tentative < gScore.getOrDefault(neighbor, Double.POSITIVE_INFINITY)) {
                    gScore.put(neighbor, tentative);
                    previous.put(neighbor, current);
                    open.add(new SearchEntry(tentative + heuristic(coordinates, neighbor, end), tentative, neighbor));
                }
            }
        }

        return Route.unreachable();
    }

    static double heuristic(Map<String, Coordinate> coordinates, String from, String to) {
        var a = coordinates.get(from);
        var b = coordinates.get(to);
        if (a == null || b == null)
            return 0;
        return GeoUtils.degreeDistanceKm(a, b);
    }
}
