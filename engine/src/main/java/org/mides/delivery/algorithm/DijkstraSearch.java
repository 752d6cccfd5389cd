package org.mides.delivery.algorithm;

import org.mides.delivery.model.Route;
import org.mides.delivery.model.WeightedGraph;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.HashSet;
import java.util.PriorityQueue;

@Component
public class DijkstraSearch {

    public Route shortestPath(WeightedGraph graph, String start, String end) {
        graph.requireNode(start);
        graph.requireNode(end);

        var distances = new HashMap<String, Double>();
        var previous = new HashMap<String, String>();
        var visited = new HashSet<String>();
        var queue = new PriorityQueue<SearchEntry>();

        distances.put(start, 0.0);
        queue.add(new SearchEntry(0.0, 0.0, start));

        while (!queue.isEmpty()) {
            var entry = queue.poll();
            var current = entry.node;

            if (!visited.add(current))
                continue;

            if (current.equals(end))
                break;

            for (var edge : graph.neighbors(current).entrySet()) {
                var neighbor = edge.getKey();
                double candidate = entry.cost + edge.getValue();

                if (candidate < distances.getOrDefault(neighbor, Double.POSITIVE_INFINITY)) {
                    distances.put(neighbor, candidate);
                    previous.put(neighbor, current);
                    queue.add(new SearchEntry(candidate, candidate, neighbor));
                }
            }
        }

        if (!distances.containsKey(end))
            return Route.unreachable();

        var path = PathReconstruction.walkBack(previous, start, end);
        if (path.isEmpty())
            return Route.unreachable();

        return new Route(path, distances.get(end));
    }
}
