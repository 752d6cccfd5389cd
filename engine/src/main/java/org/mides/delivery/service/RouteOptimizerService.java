package org.mides.delivery.service;

import org.mides.delivery.algorithm.AStarSearch;
import org.mides.delivery.algorithm.ConstraintSolverTourOptimizer;
import org.mides.delivery.algorithm.DijkstraSearch;
import org.mides.delivery.algorithm.GeneticTourOptimizer;
import org.mides.delivery.algorithm.NearestNeighborTour;
import org.mides.delivery.exception.InvalidRouteRequestException;
import org.mides.delivery.model.Algorithm;
import org.mides.delivery.model.Coordinate;
import org.mides.delivery.model.MultiStopResult;
import org.mides.delivery.model.Route;
import org.mides.delivery.model.WeightedGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

@Service
public class RouteOptimizerService implements IRouteOptimizerService {

    private static final Logger logger = LoggerFactory.getLogger(RouteOptimizerService.class);

    private final DijkstraSearch dijkstra;
    private final AStarSearch aStar;
    private final NearestNeighborTour nearestNeighbor;
    private final GeneticTourOptimizer genetic;
    private final ConstraintSolverTourOptimizer constraintSolver;

    @Autowired
    public RouteOptimizerService(
        DijkstraSearch dijkstra,
        AStarSearch aStar,
        NearestNeighborTour nearestNeighbor,
        GeneticTourOptimizer genetic,
        ConstraintSolverTourOptimizer constraintSolver)
    {
        this.dijkstra = dijkstra;
        this.aStar = aStar;
        this.nearestNeighbor = nearestNeighbor;
        this.genetic = genetic;
        this.constraintSolver = constraintSolver;
    }

    @Override
    public Route shortestPath(WeightedGraph graph, String start, String end) {
        return dijkstra.shortestPath(graph, start, end);
    }

    @Override
    public Route shortestPathAStar(WeightedGraph graph, Map<String, Coordinate> coordinates, String start, String end) {
        return aStar.shortestPath(graph, coordinates, start, end);
    }

    @Override
    public Route nearestNeighborTour(WeightedGraph graph, String start, List<String> stops) {
        return nearestNeighbor.tour(graph, start, stops);
    }

    @Override
    public Route geneticTour(WeightedGraph graph, String start, List<String> stops) {
        return genetic.optimize(graph, start, stops);
    }

    @Override
    public Route geneticTour(WeightedGraph graph, String start, List<String> stops, int generations, int populationSize) {
        return genetic.optimize(graph, start, stops, generations, populationSize);
    }

    @Override
    public Route constraintSolverTour(WeightedGraph graph, String start, List<String> stops) {
        return constraintSolver.optimize(graph, start, stops);
    }

    @Override
    public MultiStopResult optimizeMultiStop(WeightedGraph graph, String start, List<String> stops, String algorithmName) {
        var result = optimizeMultiStop(graph, start, stops, Algorithm.fromName(algorithmName));
        result.setRequestedAlgorithm(algorithmName);
        return result;
    }

    @Override
    public MultiStopResult optimizeMultiStop(WeightedGraph graph, String start, List<String> stops, Algorithm algorithm) {
        graph.requireNode(start);
        stops.forEach(graph::requireNode);

        if (stops.contains(start))
            throw new InvalidRouteRequestException(
                String.format("stops must not include the start location %s", start)
            );

        var executed = tourAlgorithm(algorithm);
        Route route;

        if (stops.isEmpty()) {
            route = Route.trivial(start);
        } else {
            switch (executed) {
                case GENETIC:
                    route = genetic.optimize(graph, start, stops);
                    break;
                case CONSTRAINT_SOLVER:
                    route = constraintSolver.optimize(graph, start, stops);
                    break;
                default:
                    route = nearestNeighbor.tour(graph, start, stops);
                    break;
            }
        }

        var result = new MultiStopResult();
        result.setRoute(route.getStops());
        result.setDistance(route.getDistance());
        result.setAlgorithm(executed);
        result.setRequestedAlgorithm(algorithm.wireName());
        result.setNumStops(stops.size());

        var visited = new HashSet<>(route.getStops());
        if (!visited.containsAll(stops)) {
            result.setComplete(false);
            result.setNote(String.format(
                "Route covers %d of %d requested stops; the rest are unreachable",
                (int) stops.stream().distinct().filter(visited::contains).count(),
                (int) stops.stream().distinct().count()
            ));
            logger.warn("Incomplete {} tour from {}: {}", executed.wireName(), start, result.getNote());
        } else if (!stops.isEmpty() && !route.isClosed()) {
            result.setNote(String.format("No edge back to %s, route is left open", start));
        }

        logger.info("Planned {} tour from {} over {} stops, distance {}",
            executed.wireName(), start, stops.size(), route.getDistance());
        return result;
    }

    /* Algorithms that cannot plan tours run as nearest neighbor */
    private static Algorithm tourAlgorithm(Algorithm requested) {
        switch (requested) {
            case GENETIC:
            case NEAREST_NEIGHBOR:
            case CONSTRAINT_SOLVER:
                return requested;
            case DIJKSTRA:
            case A_STAR:
            case UNRECOGNIZED:
                logger.warn("Algorithm {} cannot plan multi-stop tours, using nearest neighbor", requested.wireName());
                return Algorithm.NEAREST_NEIGHBOR;
            default:
                throw new IllegalStateException("Unhandled algorithm " + requested);
        }
    }
}
