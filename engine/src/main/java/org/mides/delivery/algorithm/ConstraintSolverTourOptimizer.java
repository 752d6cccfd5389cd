package org.mides.delivery.algorithm;

import com.google.ortools.constraintsolver.FirstSolutionStrategy;
import com.google.ortools.constraintsolver.LocalSearchMetaheuristic;
import com.google.ortools.constraintsolver.RoutingIndexManager;
import com.google.ortools.constraintsolver.RoutingModel;
import com.google.ortools.constraintsolver.main;
import org.mides.delivery.config.OptimizerConfiguration;
import org.mides.delivery.model.Route;
import org.mides.delivery.model.WeightedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

/* Needs the OR-Tools native libraries loaded */
@Component
public class ConstraintSolverTourOptimizer {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintSolverTourOptimizer.class);

    /* Solver works on integers; km are scaled to metres */
    private static final long COST_SCALE = 1000;

    /* Arc cost used for edges missing from the graph */
    private static final long MISSING_EDGE_COST = 1_000_000_000_000L;

    private final OptimizerConfiguration.ConstraintSolver settings;
    private final NearestNeighborTour fallback;

    @Autowired
    public ConstraintSolverTourOptimizer(OptimizerConfiguration optimizerConfig, NearestNeighborTour fallback) {
        this(optimizerConfig.getConstraintSolver(), fallback);
    }

    public ConstraintSolverTourOptimizer(OptimizerConfiguration.ConstraintSolver settings, NearestNeighborTour fallback) {
        this.settings = settings;
        this.fallback = fallback;
    }

    public Route optimize(WeightedGraph graph, String start, List<String> stops) {
        graph.requireNode(start);
        stops.forEach(graph::requireNode);

        if (new HashSet<>(stops).size() != stops.size())
            throw new IllegalArgumentException("stops must not repeat: " + stops);
        if (stops.contains(start))
            throw new IllegalArgumentException("stops must not include the start: " + start);

        if (stops.isEmpty())
            return Route.trivial(start);

        var nodes = new ArrayList<String>(stops.size() + 1);
        nodes.add(start);
        nodes.addAll(stops);

        long[][] costMatrix = costMatrix(graph, nodes);

        var manager = new RoutingIndexManager(nodes.size(), 1, 0);
        var routing = new RoutingModel(manager);

        var costCallbackIndex = routing.registerTransitCallback((fromIndex, toIndex) -> {
            var fromNode = manager.indexToNode(fromIndex);
            var toNode = manager.indexToNode(toIndex);
            return costMatrix[fromNode][toNode];
        });
        routing.setArcCostEvaluatorOfAllVehicles(costCallbackIndex);

        var searchParams = main.defaultRoutingSearchParameters()
            .toBuilder()
            .setFirstSolutionStrategy(FirstSolutionStrategy.Value.PATH_CHEAPEST_ARC)
            .setLocalSearchMetaheuristic(LocalSearchMetaheuristic.Value.GUIDED_LOCAL_SEARCH)
            .setTimeLimit(com.google.protobuf.Duration.newBuilder().setSeconds(settings.getTimeLimitSeconds()).build())
            .build();

        var assignment = routing.solveWithParameters(searchParams);

        if (assignment == null) {
            logger.warn("Constraint solver found no tour for {} stops, using nearest neighbor", stops.size());
            return fallback.tour(graph, start, stops);
        }

        var tour = new ArrayList<String>(nodes.size() + 1);
        long index = routing.start(0);
        while (!routing.isEnd(index)) {
            tour.add(nodes.get(manager.indexToNode(index)));
            index = assignment.value(routing.nextVar(index));
        }
        tour.add(start);

        return new Route(tour, RouteCosts.totalCost(graph, tour));
    }

    private static long[][] costMatrix(WeightedGraph graph, List<String> nodes) {
        int size = nodes.size();
        var matrix = new long[size][size];
        for (int i = 0; i < size; i++) {
            for (int j = 0; j < size; j++) {
                if (i == j)
                    continue;
                var from = nodes.get(i);
                var to = nodes.get(j);
                matrix[i][j] = graph.hasEdge(from, to)
                    ? Math.round(graph.weight(from, to) * COST_SCALE)
                    : MISSING_EDGE_COST;
            }
        }
        return matrix;
    }
}
